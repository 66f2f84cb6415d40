package com.jdc.foodgram.storage;

import com.jdc.foodgram.config.MediaProperties;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.util.Base64ImageDecoder.DecodedImage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.UUID;

/**
 * 업로드 이미지를 로컬 디스크에 저장하고 공개 URL을 돌려준다.
 * 파일명: &lt;directory&gt;/&lt;uuid&gt;.&lt;ext&gt;
 */
@Slf4j
@Service
public class LocalImageStorage {

    public static final String RECIPE_IMAGES = "recipes/images";
    public static final String AVATARS = "users/avatars";

    private final Path root;
    private final String urlPrefix;

    public LocalImageStorage(MediaProperties mediaProperties) throws IOException {
        this.root = Paths.get(mediaProperties.getRoot()).toAbsolutePath().normalize();
        String prefix = mediaProperties.getUrlPrefix();
        this.urlPrefix = prefix.endsWith("/") ? prefix : prefix + "/";
        Files.createDirectories(root);
        log.info("Media root = {}", root);
    }

    public String save(String directory, DecodedImage image) {
        String relative = directory + "/" + UUID.randomUUID() + "." + image.getExtension();
        Path dst = root.resolve(relative).normalize();
        if (!dst.startsWith(root)) {
            throw new CustomException(ErrorCode.INVALID_IMAGE);
        }
        try {
            Files.createDirectories(dst.getParent());
            Files.write(dst, image.getBytes());
        } catch (IOException e) {
            throw new CustomException(ErrorCode.IMAGE_STORE_FAILED, "이미지 저장 실패: " + e.getMessage());
        }
        return urlPrefix + relative;
    }

    /** 공개 URL에서 media root 기준 상대 경로를 꺼낸다. */
    public Optional<Path> pathFromUrl(String url) {
        if (url == null || !url.startsWith(urlPrefix) || url.length() == urlPrefix.length()) {
            return Optional.empty();
        }
        Path p = root.resolve(url.substring(urlPrefix.length())).normalize();
        if (!p.startsWith(root)) return Optional.empty(); // 경로 탈출 방지
        return Optional.of(p);
    }

    public void deleteByUrl(String url) throws IOException {
        Optional<Path> path = pathFromUrl(url);
        if (path.isEmpty()) return;
        Files.deleteIfExists(path.get());
    }

    /** 실패해도 예외를 던지지 않고 경고만 남긴다. */
    public void deleteByUrlQuietly(String url) {
        try {
            deleteByUrl(url);
        } catch (Exception e) {
            log.warn("이미지 삭제 실패: url={}, err={}", url, e.toString());
        }
    }

    public Path getRoot() {
        return root;
    }

    public String getUrlPrefix() {
        return urlPrefix;
    }
}
