package com.uniclass.common.exception;

/**
 * 密钥/租户存储访问异常。
 */
public class KeyStoreException extends UniclassException {

    public KeyStoreException(String message) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message);
    }

    public KeyStoreException(String message, Throwable cause) {
        super(ErrorCode.SERVICE_UNAVAILABLE, message, cause);
    }
}
