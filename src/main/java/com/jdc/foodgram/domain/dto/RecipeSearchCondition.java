package com.jdc.foodgram.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeSearchCondition {
    private Long authorId;
    private List<String> tags;
    private boolean favoritedOnly;
    private boolean inShoppingCartOnly;
}
