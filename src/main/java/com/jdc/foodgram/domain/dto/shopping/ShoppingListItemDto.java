package com.jdc.foodgram.domain.dto.shopping;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 장바구니 집계 결과 한 줄. JPQL 생성자 표현식에서 직접 생성된다.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ShoppingListItemDto {
    private final String name;
    private final String measurementUnit;
    private final Long totalAmount;
}
