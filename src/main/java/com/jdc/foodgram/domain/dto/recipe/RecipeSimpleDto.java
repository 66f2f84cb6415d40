package com.jdc.foodgram.domain.dto.recipe;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 즐겨찾기/장바구니 응답과 구독 목록 미리보기에 쓰는 축약형.
 */
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RecipeSimpleDto {
    private Long id;
    private String name;
    private String image;
    private Integer cookingTime;
}
