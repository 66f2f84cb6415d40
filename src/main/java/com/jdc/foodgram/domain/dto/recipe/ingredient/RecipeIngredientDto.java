package com.jdc.foodgram.domain.dto.recipe.ingredient;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 레시피 상세에 포함되는 재료 한 줄. id는 재료(Ingredient)의 id.
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientDto {
    private Long id;
    private String name;
    private String measurementUnit;
    private Integer amount;
}
