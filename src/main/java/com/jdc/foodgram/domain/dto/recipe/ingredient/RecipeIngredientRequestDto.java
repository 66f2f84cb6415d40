package com.jdc.foodgram.domain.dto.recipe.ingredient;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeIngredientRequestDto {

    @NotNull(message = "재료 ID는 필수입니다.")
    private Long id;

    @NotNull(message = "재료 수량은 필수입니다.")
    private Integer amount;
}
