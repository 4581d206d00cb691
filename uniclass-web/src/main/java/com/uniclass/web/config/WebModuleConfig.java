package com.uniclass.web.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.relational.core.dialect.Dialect;

/**
 * Web 模块配置：REST 接口与 JDBC KeyStore。
 */
@Configuration
@ComponentScan(basePackages = "com.uniclass.web")
public class WebModuleConfig {

    /**
     * 注册 SQLite 方言。
     */
    @Bean
    public Dialect jdbcDialect() {
        return SqliteDialect.INSTANCE;
    }
}
