package com.ecommerce.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 销售分析服务缓存层启动类
 * 缓存旁路 + 依赖级联失效 + 滑动窗口限流
 */
@SpringBootApplication
@EnableScheduling
public class AnalyticsCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnalyticsCacheApplication.class, args);
    }
}
