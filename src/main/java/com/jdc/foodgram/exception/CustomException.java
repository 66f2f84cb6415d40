package com.jdc.foodgram.exception;

import lombok.Getter;

@Getter
public class CustomException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String field;

    public CustomException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null);
    }

    public CustomException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * @param field 요청 본문에서 문제가 된 필드 이름 (snake_case)
     */
    public CustomException(ErrorCode errorCode, String message, String field) {
        super(message);
        this.errorCode = errorCode;
        this.field = field;
    }
}
