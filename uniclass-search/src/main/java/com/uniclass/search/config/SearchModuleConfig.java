package com.uniclass.search.config;

import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * 检索模块自动配置。
 */
@Configuration
@ComponentScan(basePackages = "com.uniclass.search")
@EnableConfigurationProperties(SearchProperties.class)
public class SearchModuleConfig {

    @Bean
    public OkHttpClient searchHttpClient(SearchProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
                .readTimeout(Duration.ofSeconds(properties.getReadTimeoutSeconds()))
                .writeTimeout(Duration.ofSeconds(10))
                .build();
    }
}
