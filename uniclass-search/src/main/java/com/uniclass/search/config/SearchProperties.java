package com.uniclass.search.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 检索服务配置项。
 */
@Data
@ConfigurationProperties(prefix = "uniclass.search")
public class SearchProperties {

    /** 检索服务地址 */
    private String baseUrl = "http://localhost:8000";

    /** 访问检索服务的凭证（可选） */
    private String apiKey;

    /** 连接超时（秒） */
    private int connectTimeoutSeconds = 5;

    /** 单次调用的读超时（秒），整体截止时间由网关控制 */
    private int readTimeoutSeconds = 30;
}
