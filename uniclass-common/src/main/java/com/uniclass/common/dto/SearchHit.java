package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单条检索结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    /** 分类编码，如 "Pr_30_59_24" */
    private String code;

    private String title;

    /** 所属分类表 */
    private String table;

    /** 余弦相似度 [0, 1] */
    private double similarity;
}
