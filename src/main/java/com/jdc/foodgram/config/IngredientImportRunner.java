package com.jdc.foodgram.config;

import com.jdc.foodgram.service.IngredientImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * app.ingredients.import-path 가 지정된 경우 기동 시 재료 목록을 적재한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngredientImportRunner implements ApplicationRunner {

    private final IngredientImportService importService;

    @Value("${app.ingredients.import-path:}")
    private String importPath;

    @Override
    public void run(ApplicationArguments args) {
        if (!StringUtils.hasText(importPath)) {
            return;
        }
        int created = importService.importFrom(Path.of(importPath));
        log.info("재료 초기 적재 완료: path={}, created={}", importPath, created);
    }
}
