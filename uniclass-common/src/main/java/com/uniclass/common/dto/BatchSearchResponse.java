package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 批量检索响应。results 以查询文本为键，重复查询合并为一项。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSearchResponse {

    private List<String> queries;

    private int topK;

    /** 请求中的查询条数（含重复），即本次计入配额的数量 */
    private int count;

    private Map<String, List<SearchHit>> results;

    /** 命中缓存的查询条数，仅用于观测 */
    private int cacheHits;

    /** 全部命中缓存时为 true */
    private boolean cached;

    private long latencyMs;
}
