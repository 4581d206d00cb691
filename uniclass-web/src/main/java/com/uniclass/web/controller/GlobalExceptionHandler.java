package com.uniclass.web.controller;

import com.uniclass.common.dto.ErrorResponse;
import com.uniclass.common.exception.ErrorCode;
import com.uniclass.common.exception.UniclassException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理器。编排层之外漏出的异常也按 {error, code, details?} 输出。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UniclassException.class)
    public ResponseEntity<ErrorResponse> handleUniclassException(UniclassException e) {
        log.warn("业务异常: [{}] {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(e.getErrorCode().getHttpStatus())
                .body(ErrorResponse.of(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("请求体无法解析: {}", e.getMessage());
        return ErrorResponse.of(ErrorCode.INVALID_PARAM, "Malformed JSON request body");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public ErrorResponse handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return ErrorResponse.of(ErrorCode.INVALID_ACTION, "Method " + e.getMethod() + " not supported");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNoResourceFound(NoResourceFoundException e) {
        // favicon.ico 之类，不打 ERROR 日志
        log.debug("资源未找到: {}", e.getResourcePath());
        return ErrorResponse.of(ErrorCode.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "Internal server error");
    }
}
