package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;

public class RecipeIngredientMapper {

    public static RecipeIngredient toEntity(Recipe recipe, Ingredient ingredient, Integer amount) {
        return RecipeIngredient.builder()
                .recipe(recipe)
                .ingredient(ingredient)
                .amount(amount)
                .build();
    }

    public static RecipeIngredientDto toDto(RecipeIngredient entity) {
        Ingredient ingredient = entity.getIngredient();
        return RecipeIngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .amount(entity.getAmount())
                .build();
    }
}
