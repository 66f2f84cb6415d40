package com.jdc.foodgram.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private String field;
    private String errorId;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorResponse(String code, String message, String field, String errorId) {
        this.code = code;
        this.message = message;
        this.field = field;
        this.errorId = errorId;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(CustomException ex) {
        return new ErrorResponse(ex.getErrorCode().getCode(), ex.getMessage(), ex.getField(), null);
    }
}
