package com.jdc.foodgram.domain.dto.user;

import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * 구독 목록/구독 응답용. 작성자 정보에 레시피 미리보기와 전체 레시피 수를 더한다.
 */
@Getter
@SuperBuilder
@NoArgsConstructor
public class UserWithRecipesDto extends UserDto {
    private List<RecipeSimpleDto> recipes;
    private Long recipesCount;
}
