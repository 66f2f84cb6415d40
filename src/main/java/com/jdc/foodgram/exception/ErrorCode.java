package com.jdc.foodgram.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "요청한 사용자가 존재하지 않습니다."),
    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "102", "이미 사용 중인 이메일입니다."),
    DUPLICATE_USERNAME(HttpStatus.BAD_REQUEST, "103", "이미 사용 중인 사용자 이름입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "104", "인증이 필요합니다."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "105", "이메일 또는 비밀번호가 올바르지 않습니다."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "106", "현재 비밀번호가 올바르지 않습니다."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "레시피에 대한 접근 권한이 없습니다."),
    INVALID_RECIPE_INGREDIENTS(HttpStatus.BAD_REQUEST, "203", "레시피 재료 구성이 올바르지 않습니다."),
    INVALID_RECIPE_TAGS(HttpStatus.BAD_REQUEST, "204", "레시피 태그 구성이 올바르지 않습니다."),
    INVALID_COOKING_TIME(HttpStatus.BAD_REQUEST, "205", "조리 시간은 1분 이상 32000분 이하여야 합니다."),
    SHORT_LINK_NOT_FOUND(HttpStatus.NOT_FOUND, "206", "존재하지 않는 짧은 링크입니다."),
    SHORT_LINK_GENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "207", "짧은 링크 생성에 실패했습니다."),

    // --- Favorite / Shopping cart (300) ---
    ALREADY_FAVORITED_RECIPE(HttpStatus.BAD_REQUEST, "301", "이미 즐겨찾기에 추가된 레시피입니다."),
    RECIPE_NOT_FAVORITED(HttpStatus.BAD_REQUEST, "302", "즐겨찾기에 추가되지 않은 레시피입니다."),
    ALREADY_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "303", "이미 장바구니에 추가된 레시피입니다."),
    RECIPE_NOT_IN_SHOPPING_CART(HttpStatus.BAD_REQUEST, "304", "장바구니에 추가되지 않은 레시피입니다."),

    // --- Catalog (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 재료가 존재하지 않습니다."),
    TAG_NOT_FOUND(HttpStatus.NOT_FOUND, "402", "요청한 태그가 존재하지 않습니다."),
    INGREDIENT_IMPORT_FAILED(HttpStatus.BAD_REQUEST, "403", "재료 파일을 읽을 수 없습니다."),

    // --- Subscription (500) ---
    CANNOT_SUBSCRIBE_TO_SELF(HttpStatus.BAD_REQUEST, "501", "자기 자신을 구독할 수 없습니다."),
    ALREADY_SUBSCRIBED(HttpStatus.BAD_REQUEST, "502", "이미 구독 중인 사용자입니다."),
    NOT_SUBSCRIBED(HttpStatus.BAD_REQUEST, "503", "구독하지 않은 사용자입니다."),

    // --- Media (600) ---
    INVALID_IMAGE(HttpStatus.BAD_REQUEST, "601", "이미지 형식이 올바르지 않습니다."),
    IMAGE_STORE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "602", "이미지 저장에 실패했습니다."),
    DOCUMENT_RENDER_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "603", "장바구니 문서 생성에 실패했습니다."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "904", "지원하지 않는 Content-Type 입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "905", "데이터베이스 제약조건 위반입니다."),
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
