package com.uniclass.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.uniclass.common.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 统一错误响应：{error, code, details?}。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;

    private String code;

    private Map<String, Object> details;

    public static ErrorResponse of(ErrorCode code, String message) {
        return new ErrorResponse(message, code.name(), null);
    }

    public static ErrorResponse of(ErrorCode code, String message, Map<String, Object> details) {
        return new ErrorResponse(message, code.name(), details);
    }

    @JsonIgnore
    public ErrorCode getErrorCode() {
        return ErrorCode.valueOf(code);
    }
}
