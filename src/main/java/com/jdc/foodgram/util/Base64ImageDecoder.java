package com.jdc.foodgram.util;

import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Base64;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * data:image/&lt;ext&gt;;base64,&lt;payload&gt; 형식의 문자열을 바이트로 풀어낸다.
 */
@Component
public class Base64ImageDecoder {

    private static final Pattern DATA_URI =
            Pattern.compile("^data:image/([A-Za-z0-9.+-]+);base64,(.+)$", Pattern.DOTALL);

    public DecodedImage decode(String dataUri, String field) {
        if (!StringUtils.hasText(dataUri)) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "이미지가 비어 있습니다.", field);
        }
        Matcher matcher = DATA_URI.matcher(dataUri.trim());
        if (!matcher.matches()) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "이미지는 data:image/<형식>;base64, 로 시작해야 합니다.", field);
        }

        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(matcher.group(2));
        } catch (IllegalArgumentException e) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "base64 인코딩이 올바르지 않습니다.", field);
        }
        if (bytes.length == 0) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "이미지가 비어 있습니다.", field);
        }

        String extension = matcher.group(1).toLowerCase(Locale.ROOT);
        return new DecodedImage(bytes, extension);
    }

    @Getter
    @AllArgsConstructor
    public static class DecodedImage {
        private final byte[] bytes;
        private final String extension;
    }
}
