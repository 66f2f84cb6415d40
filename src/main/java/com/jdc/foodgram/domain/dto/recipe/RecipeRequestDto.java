package com.jdc.foodgram.domain.dto.recipe;

import com.jdc.foodgram.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

/**
 * 레시피 생성/수정 공용. 수정 시 image는 생략 가능하다.
 */
@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeRequestDto {

    @Valid
    private List<RecipeIngredientRequestDto> ingredients;

    private List<Long> tags;

    private String image;

    @NotBlank(message = "레시피 이름은 필수입니다.")
    @Size(max = 256, message = "레시피 이름은 256자를 넘을 수 없습니다.")
    private String name;

    @NotBlank(message = "레시피 설명은 필수입니다.")
    private String text;

    private Integer cookingTime;
}
