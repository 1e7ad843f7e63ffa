package com.jdc.recipe_api.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "요청한 사용자가 존재하지 않습니다."),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "102", "이미 사용 중인 이메일입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "103", "인증이 필요합니다."),
    MISSING_EMAIL(HttpStatus.BAD_REQUEST, "104", "이메일은 비어 있을 수 없습니다."),
    INVALID_PASSWORD(HttpStatus.BAD_REQUEST, "105", "비밀번호는 비어 있을 수 없습니다."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),

    // --- Tag (300) ---
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "301", "요청한 태그가 존재하지 않습니다."),
    INVALID_TAG_REFERENCE(HttpStatus.BAD_REQUEST, "302", "존재하지 않거나 접근할 수 없는 태그가 포함되어 있습니다."),

    // --- Ingredient (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 재료가 존재하지 않습니다."),
    INVALID_INGREDIENT_REFERENCE(HttpStatus.BAD_REQUEST, "402", "존재하지 않거나 접근할 수 없는 재료가 포함되어 있습니다."),

    // --- Auth (600) ---
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "601", "이메일 또는 비밀번호가 올바르지 않습니다."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "602", "유효하지 않은 토큰입니다."),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "603", "토큰이 만료되었습니다."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "905", "지원하지 않는 Content-Type 입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "906", "데이터베이스 제약조건 위반입니다."),
    MALFORMED_REQUEST_BODY(HttpStatus.BAD_REQUEST, "907", "요청 본문을 읽을 수 없습니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
