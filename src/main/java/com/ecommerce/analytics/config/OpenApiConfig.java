package com.ecommerce.analytics.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI 3.0 文档配置
 * 文档路径（/swagger-ui、/v3/api-docs）不参与限流
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("销售分析缓存层 API")
                .version("1.0.0")
                .description("""
                    销售分析看板缓存层运维 API

                    ## 核心特性
                    - Redis 缓存旁路，按业务域 TTL
                    - 写操作触发依赖级联失效
                    - 按客户端 + 接口的滑动窗口限流

                    ## 降级策略
                    - Redis 不可用时按未命中处理，业务照常返回
                    - 熔断打开期间跳过 Redis 调用
                    """)
                .contact(new Contact()
                    .name("Analytics Team")
                    .email("analytics-team@ecommerce.com")))
            .servers(List.of(
                new Server().url("http://localhost:8080").description("本地开发环境")
            ));
    }
}
