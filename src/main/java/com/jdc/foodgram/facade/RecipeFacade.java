package com.jdc.foodgram.facade;

import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeRequestDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.service.RecipeRequestValidator;
import com.jdc.foodgram.service.RecipeService;
import com.jdc.foodgram.storage.LocalImageStorage;
import com.jdc.foodgram.util.Base64ImageDecoder;
import com.jdc.foodgram.util.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 레시피 쓰기 진입점. 검증과 이미지 저장은 트랜잭션 밖에서 하고,
 * 저장 트랜잭션은 short_link 충돌 시 새 코드로 다시 시도한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeFacade {

    private final RecipeService recipeService;
    private final RecipeRequestValidator validator;
    private final Base64ImageDecoder imageDecoder;
    private final LocalImageStorage imageStorage;
    private final RetryTemplate shortLinkRetryTemplate;

    public RecipeDetailDto createRecipe(Long userId, RecipeRequestDto dto) {
        validator.validate(dto, true);
        String imageUrl = imageStorage.save(LocalImageStorage.RECIPE_IMAGES, imageDecoder.decode(dto.getImage(), "image"));

        try {
            return shortLinkRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("short_link 충돌로 레시피 생성 재시도: attempt={}", context.getRetryCount() + 1);
                }
                return createOnce(userId, dto, imageUrl);
            });
        } catch (ShortLinkCollisionException e) {
            imageStorage.deleteByUrlQuietly(imageUrl);
            throw new CustomException(ErrorCode.SHORT_LINK_GENERATION_FAILED);
        } catch (RuntimeException e) {
            imageStorage.deleteByUrlQuietly(imageUrl);
            throw e;
        }
    }

    public RecipeDetailDto updateRecipe(Long userId, Long recipeId, RecipeRequestDto dto) {
        recipeService.checkAuthor(userId, recipeId);
        validator.validate(dto, false);
        if (!StringUtils.hasText(dto.getImage())) {
            return recipeService.updateRecipe(userId, recipeId, dto, null);
        }

        String imageUrl = imageStorage.save(LocalImageStorage.RECIPE_IMAGES, imageDecoder.decode(dto.getImage(), "image"));
        try {
            return recipeService.updateRecipe(userId, recipeId, dto, imageUrl);
        } catch (RuntimeException e) {
            imageStorage.deleteByUrlQuietly(imageUrl);
            throw e;
        }
    }

    public void deleteRecipe(Long userId, Long recipeId) {
        recipeService.deleteRecipe(userId, recipeId);
    }

    private RecipeDetailDto createOnce(Long userId, RecipeRequestDto dto, String imageUrl) {
        try {
            return recipeService.createRecipe(userId, dto, imageUrl);
        } catch (DataIntegrityViolationException e) {
            if (isShortLinkViolation(e)) {
                throw new ShortLinkCollisionException("short_link 유니크 제약 위반", e);
            }
            throw e;
        }
    }

    static boolean isShortLinkViolation(DataIntegrityViolationException e) {
        return ConstraintViolations.isViolationOf(e, Recipe.UK_SHORT_LINK);
    }
}
