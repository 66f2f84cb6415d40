package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeRequestDto;
import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 레시피 생성/수정 요청의 객체 단위 검증. DB 조회 없이 판단할 수 있는 규칙만 본다.
 * 태그/재료 존재 여부는 {@link RecipeTagService}, {@link RecipeIngredientService}에서 확인한다.
 */
@Component
public class RecipeRequestValidator {

    public void validate(RecipeRequestDto dto, boolean imageRequired) {
        validateIngredients(dto.getIngredients());
        validateTags(dto.getTags());
        validateCookingTime(dto.getCookingTime());

        if (imageRequired && !StringUtils.hasText(dto.getImage())) {
            throw new CustomException(ErrorCode.INVALID_IMAGE, "레시피 이미지는 필수입니다.", "image");
        }
    }

    void validateIngredients(List<RecipeIngredientRequestDto> ingredients) {
        if (ingredients == null || ingredients.isEmpty()) {
            throw ingredientError("재료를 하나 이상 입력해야 합니다.");
        }

        Set<Long> seen = new HashSet<>();
        for (RecipeIngredientRequestDto item : ingredients) {
            if (item == null || item.getId() == null) {
                throw ingredientError("재료 ID가 비어 있습니다.");
            }
            Integer amount = item.getAmount();
            if (amount == null || amount < RecipeIngredient.MIN_AMOUNT || amount > RecipeIngredient.MAX_AMOUNT) {
                throw ingredientError("재료 수량은 " + RecipeIngredient.MIN_AMOUNT + " 이상 "
                        + RecipeIngredient.MAX_AMOUNT + " 이하여야 합니다. (재료 ID: " + item.getId() + ")");
            }
            if (!seen.add(item.getId())) {
                throw ingredientError("같은 재료가 두 번 이상 포함되어 있습니다. (재료 ID: " + item.getId() + ")");
            }
        }
    }

    void validateTags(List<Long> tags) {
        if (tags == null || tags.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_TAGS, "태그를 하나 이상 선택해야 합니다.", "tags");
        }
        Set<Long> seen = new HashSet<>();
        for (Long tagId : tags) {
            if (tagId == null) {
                throw new CustomException(ErrorCode.INVALID_RECIPE_TAGS, "태그 ID가 비어 있습니다.", "tags");
            }
            if (!seen.add(tagId)) {
                throw new CustomException(ErrorCode.INVALID_RECIPE_TAGS,
                        "같은 태그가 두 번 이상 포함되어 있습니다. (태그 ID: " + tagId + ")", "tags");
            }
        }
    }

    void validateCookingTime(Integer cookingTime) {
        if (cookingTime == null
                || cookingTime < Recipe.MIN_COOKING_TIME
                || cookingTime > Recipe.MAX_COOKING_TIME) {
            throw new CustomException(ErrorCode.INVALID_COOKING_TIME, ErrorCode.INVALID_COOKING_TIME.getMessage(), "cooking_time");
        }
    }

    private CustomException ingredientError(String message) {
        return new CustomException(ErrorCode.INVALID_RECIPE_INGREDIENTS, message, "ingredients");
    }
}
