package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单条检索响应。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SingleSearchResponse {

    private String query;

    private int topK;

    private int count;

    private List<SearchHit> results;

    /** 是否命中缓存 */
    private boolean cached;

    /** 从进入网关到组装响应的耗时（毫秒） */
    private long latencyMs;
}
