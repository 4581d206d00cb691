package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 检索请求。action 为空时按是否携带 queries 自动判断单条/批量。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    /** single / batch */
    private String action;

    private String query;

    private List<String> queries;

    private Integer topK;
}
