package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 检索索引概况。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStats {

    private long totalItems;

    private int embeddingDim;

    private List<String> tables;
}
