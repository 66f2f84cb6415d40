package com.jdc.foodgram.domain.dto.recipe;

import com.jdc.foodgram.domain.dto.TagDto;
import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeDetailDto {
    private Long id;
    private List<TagDto> tags;
    private UserDto author;
    private List<RecipeIngredientDto> ingredients;
    private Boolean isFavorited;
    private Boolean isInShoppingCart;
    private String name;
    private String image;
    private String text;
    private Integer cookingTime;
}
