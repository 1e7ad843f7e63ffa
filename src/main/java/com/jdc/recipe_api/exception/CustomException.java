package com.jdc.recipe_api.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class CustomException extends RuntimeException {

    private final ErrorCode errorCode;

    /** 필드명 → 오류 메시지. 필드 단위 오류가 아니면 null */
    private final Map<String, String> fieldErrors;

    public CustomException(ErrorCode errorCode) {
        this(errorCode, errorCode.getMessage(), null);
    }

    public CustomException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public CustomException(ErrorCode errorCode, String message, Map<String, String> fieldErrors) {
        super(message);
        this.errorCode = errorCode;
        this.fieldErrors = fieldErrors;
    }

    public static CustomException onField(ErrorCode errorCode, String field) {
        return new CustomException(errorCode, errorCode.getMessage(), Map.of(field, errorCode.getMessage()));
    }
}
