package com.uniclass.common.dto;

import com.uniclass.common.exception.ErrorCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 编排层返回给传输层的结果：成功响应体或 {@link ErrorResponse}，附带 HTTP 状态与响应头。
 */
@Getter
public final class GatewayResult {

    private final int status;
    private final Object body;
    private final ErrorResponse error;
    private final Map<String, String> headers = new LinkedHashMap<>();

    private GatewayResult(int status, Object body, ErrorResponse error) {
        this.status = status;
        this.body = body;
        this.error = error;
    }

    public static GatewayResult ok(Object body) {
        return new GatewayResult(200, body, null);
    }

    public static GatewayResult error(ErrorCode code, String message) {
        return error(ErrorResponse.of(code, message));
    }

    public static GatewayResult error(ErrorCode code, String message, Map<String, Object> details) {
        return error(ErrorResponse.of(code, message, details));
    }

    public static GatewayResult error(ErrorResponse error) {
        return new GatewayResult(error.getErrorCode().getHttpStatus(), null, error);
    }

    public GatewayResult withHeaders(Map<String, String> extra) {
        if (extra != null) {
            headers.putAll(extra);
        }
        return this;
    }

    public boolean isSuccess() {
        return error == null;
    }

    /** 渲染用的响应体：成功时为业务对象，失败时为错误信封 */
    public Object getPayload() {
        return isSuccess() ? body : error;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }
}
