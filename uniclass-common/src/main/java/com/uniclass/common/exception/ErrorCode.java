package com.uniclass.common.exception;

/**
 * 网关统一错误码，同时携带传输层使用的 HTTP 状态码。
 */
public enum ErrorCode {

    AUTH_REQUIRED(401),
    INVALID_API_KEY(401),
    RATE_LIMITED(429),
    QUOTA_EXCEEDED(429),
    /** 配额存储不可用（默认 fail-closed） */
    QUOTA_UNAVAILABLE(503),
    MISSING_PARAM(400),
    INVALID_PARAM(400),
    INVALID_ACTION(400),
    /** 所需协作方（KeyStore 等）未配置或暂时不可用 */
    SERVICE_UNAVAILABLE(503),
    SEARCH_FAILED(502),
    NOT_FOUND(404),
    CREATE_FAILED(500),
    LIST_FAILED(500),
    REVOKE_FAILED(500),
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorCode(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
