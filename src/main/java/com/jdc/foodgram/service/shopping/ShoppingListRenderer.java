package com.jdc.foodgram.service.shopping;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;

import java.time.LocalDate;
import java.util.List;

/**
 * 집계된 장바구니 목록을 내려받을 문서 바이트로 만든다. 부수 효과 없음.
 */
public interface ShoppingListRenderer {

    byte[] render(String username, LocalDate date, List<ShoppingListItemDto> items);

    String contentType();
}
