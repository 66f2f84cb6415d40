package com.jdc.foodgram.facade;

/**
 * 커밋 시점에 short_link 유니크 제약이 깨졌을 때 던진다. RetryTemplate 재시도 대상.
 */
public class ShortLinkCollisionException extends RuntimeException {

    public ShortLinkCollisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
