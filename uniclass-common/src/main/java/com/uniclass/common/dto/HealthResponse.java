package com.uniclass.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 健康检查响应。检索服务不可达时 status 为 degraded。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    private String status;

    private Long itemsIndexed;

    private Integer embeddingDim;

    /** 组件 -> 实现名称 */
    private Map<String, String> services;
}
