package com.uniclass.common.exception;

/**
 * 配额存储不可达且策略为 fail-closed 时抛出。
 */
public class QuotaUnavailableException extends UniclassException {

    public QuotaUnavailableException(String message, Throwable cause) {
        super(ErrorCode.QUOTA_UNAVAILABLE, message, cause);
    }
}
