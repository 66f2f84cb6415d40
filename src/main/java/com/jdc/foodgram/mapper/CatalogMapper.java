package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.TagDto;
import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Tag;

public class CatalogMapper {

    public static TagDto toTagDto(Tag tag) {
        if (tag == null) return null;
        return TagDto.builder()
                .id(tag.getId())
                .name(tag.getName())
                .slug(tag.getSlug())
                .build();
    }

    public static IngredientDto toIngredientDto(Ingredient ingredient) {
        if (ingredient == null) return null;
        return IngredientDto.builder()
                .id(ingredient.getId())
                .name(ingredient.getName())
                .measurementUnit(ingredient.getMeasurementUnit())
                .build();
    }
}
