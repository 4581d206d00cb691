package com.uniclass.common.exception;

/**
 * 向量检索服务调用异常（网络错误、非 2xx 响应、响应无法解析等）。
 */
public class SearchEngineException extends UniclassException {

    public SearchEngineException(String message) {
        super(ErrorCode.SEARCH_FAILED, message);
    }

    public SearchEngineException(String message, Throwable cause) {
        super(ErrorCode.SEARCH_FAILED, message, cause);
    }
}
