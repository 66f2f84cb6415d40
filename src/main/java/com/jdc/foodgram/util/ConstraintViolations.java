package com.jdc.foodgram.util;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Locale;

/**
 * 무결성 위반 예외가 어떤 제약에서 났는지 판별한다.
 * Hibernate가 드라이버 오류에서 뽑아 둔 제약 이름만 본다. (H2: "PUBLIC.UK_..._INDEX_8", MySQL: "recipes.uk_...")
 */
public final class ConstraintViolations {

    private ConstraintViolations() {
    }

    public static boolean isViolationOf(DataIntegrityViolationException e, String constraintName) {
        String violated = violatedConstraintName(e);
        return violated != null && violated.toLowerCase(Locale.ROOT).contains(constraintName.toLowerCase(Locale.ROOT));
    }

    static String violatedConstraintName(Throwable e) {
        Throwable cause = e;
        while (cause != null) {
            if (cause instanceof ConstraintViolationException cve) {
                return cve.getConstraintName();
            }
            if (cause.getCause() == cause) {
                break;
            }
            cause = cause.getCause();
        }
        return null;
    }
}
