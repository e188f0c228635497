package com.ecommerce.analytics.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Redis 单节点配置
 * 连接池上限、命令超时均来自 analytics.redis.*
 */
@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Value("${spring.data.redis.password:}")
    private String password;

    @Value("${spring.data.redis.database:0}")
    private int database;

    /**
     * Lettuce 客户端资源配置
     */
    @Bean(destroyMethod = "shutdown")
    public ClientResources clientResources() {
        return DefaultClientResources.builder()
            .ioThreadPoolSize(4)
            .computationThreadPoolSize(4)
            .build();
    }

    /**
     * 连接池配置
     */
    @Bean
    public GenericObjectPoolConfig<?> redisPoolConfig(AnalyticsProperties properties) {
        AnalyticsProperties.Redis redis = properties.getRedis();
        GenericObjectPoolConfig<?> config = new GenericObjectPoolConfig<>();
        config.setMaxTotal(redis.getMaxConnections());
        config.setMaxIdle(redis.getMaxConnections());
        config.setMinIdle(redis.getMinIdle());
        // 借连接等待不超过一次命令超时
        config.setMaxWait(redis.getCommandTimeout());
        config.setTestWhileIdle(true);
        config.setTimeBetweenEvictionRuns(Duration.ofSeconds(30));
        return config;
    }

    /**
     * Lettuce 客户端配置
     */
    @Bean
    public LettucePoolingClientConfiguration lettuceClientConfiguration(
            ClientResources clientResources,
            GenericObjectPoolConfig<?> poolConfig,
            AnalyticsProperties properties) {

        Duration commandTimeout = properties.getRedis().getCommandTimeout();

        ClientOptions clientOptions = ClientOptions.builder()
            .autoReconnect(true)
            // 断线期间直接拒绝命令，不排队等待
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .timeoutOptions(TimeoutOptions.enabled(commandTimeout))
            .build();

        return LettucePoolingClientConfiguration.builder()
            .clientResources(clientResources)
            .clientOptions(clientOptions)
            .poolConfig(poolConfig)
            .commandTimeout(commandTimeout)
            .build();
    }

    /**
     * Redis 连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory(
            LettucePoolingClientConfiguration lettuceClientConfiguration) {

        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(host, port);
        standalone.setDatabase(database);
        if (password != null && !password.isEmpty()) {
            standalone.setPassword(password);
        }

        log.info("Redis configured at {}:{} (db {})", host, port, database);

        return new LettuceConnectionFactory(standalone, lettuceClientConfiguration);
    }

    /**
     * StringRedisTemplate（值统一为 JSON 文本）
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        return template;
    }
}
