package com.uniclass.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 信息查询请求：stats / usage / cache / clear_cache。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InfoRequest {

    private String action;
}
