package com.uniclass.gateway.service;

import com.uniclass.common.exception.SearchEngineException;

/**
 * 检索调用未在请求截止时间前返回。
 */
public class SearchTimeoutException extends SearchEngineException {

    public SearchTimeoutException(String message) {
        super(message);
    }
}
