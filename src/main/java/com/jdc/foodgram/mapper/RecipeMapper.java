package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeRequestDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.entity.User;

import java.util.Comparator;
import java.util.List;

public class RecipeMapper {

    public static Recipe toEntity(RecipeRequestDto dto, User author, String imageUrl, String shortLink) {
        return Recipe.builder()
                .author(author)
                .name(dto.getName())
                .text(dto.getText())
                .cookingTime(dto.getCookingTime())
                .image(imageUrl)
                .shortLink(shortLink)
                .build();
    }

    /**
     * 읽기 응답. 생성/수정 응답도 모두 이 형태로 내려간다.
     */
    public static RecipeDetailDto toDetailDto(Recipe recipe,
                                              List<RecipeIngredient> ingredients,
                                              UserDto author,
                                              boolean favorited,
                                              boolean inShoppingCart) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .tags(recipe.getTags().stream()
                        .sorted(Comparator.comparing(Tag::getName))
                        .map(CatalogMapper::toTagDto)
                        .toList())
                .author(author)
                .ingredients(ingredients.stream()
                        .map(RecipeIngredientMapper::toDto)
                        .toList())
                .isFavorited(favorited)
                .isInShoppingCart(inShoppingCart)
                .name(recipe.getName())
                .image(recipe.getImage())
                .text(recipe.getText())
                .cookingTime(recipe.getCookingTime())
                .build();
    }

    public static RecipeSimpleDto toSimpleDto(Recipe recipe) {
        return RecipeSimpleDto.builder()
                .id(recipe.getId())
                .name(recipe.getName())
                .image(recipe.getImage())
                .cookingTime(recipe.getCookingTime())
                .build();
    }
}
