package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeIngredientMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;

    /**
     * 요청에 포함된 재료를 한 번에 조회한다. 없는 ID가 있으면 ingredients 필드 오류.
     */
    public Map<Long, Ingredient> resolveIngredients(List<RecipeIngredientRequestDto> dtos) {
        List<Long> ids = dtos.stream().map(RecipeIngredientRequestDto::getId).toList();

        Map<Long, Ingredient> found = ingredientRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        List<Long> missing = ids.stream()
                .filter(id -> !found.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_INGREDIENTS, "존재하지 않는 재료입니다: " + missing, "ingredients");
        }
        return found;
    }

    public List<RecipeIngredient> saveAll(Recipe recipe,
                                          List<RecipeIngredientRequestDto> dtos,
                                          Map<Long, Ingredient> ingredientMap) {
        List<RecipeIngredient> entities = dtos.stream()
                .map(dto -> RecipeIngredientMapper.toEntity(recipe, ingredientMap.get(dto.getId()), dto.getAmount()))
                .toList();
        return recipeIngredientRepository.saveAll(entities);
    }

    public List<RecipeIngredient> findByRecipeId(Long recipeId) {
        return recipeIngredientRepository.findByRecipeId(recipeId);
    }

    public void deleteByRecipeId(Long recipeId) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
    }
}
