package com.jdc.foodgram.util;

import com.jdc.foodgram.config.ShortLinkProperties;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * [A-Za-z0-9] 중에서 무작위로 뽑은 짧은 링크 코드를 만든다.
 * 이미 사용 중인 코드는 건너뛰지만, 동시 생성 충돌은 저장 시점의 유니크 제약이 최종 판정한다.
 */
@Component
@RequiredArgsConstructor
public class ShortLinkGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final RecipeRepository recipeRepository;
    private final ShortLinkProperties shortLinkProperties;

    public String generateUnique() {
        String code;
        do {
            code = sample(shortLinkProperties.getLength());
        } while (recipeRepository.existsByShortLink(code));
        return code;
    }

    static String sample(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
