package com.jdc.foodgram.service.shopping;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ShoppingListServiceTest {

    @Mock
    private RecipeIngredientRepository recipeIngredientRepository;
    @Mock
    private UserRepository userRepository;
    @Mock
    private ShoppingListRenderer renderer;

    @InjectMocks
    private ShoppingListService shoppingListService;

    @Test
    @DisplayName("renderShoppingList: 합산된 목록과 사용자 이름, 오늘 날짜로 문서를 만든다")
    void render_passesAggregatedItems() {
        User user = User.builder().id(1L).username("chef").build();
        List<ShoppingListItemDto> items = List.of(
                new ShoppingListItemDto("flour", "g", 500L),
                new ShoppingListItemDto("sugar", "g", 50L));
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(recipeIngredientRepository.aggregateShoppingList(1L)).thenReturn(items);
        when(renderer.render(eq("chef"), any(LocalDate.class), eq(items))).thenReturn(new byte[]{1, 2, 3});

        byte[] result = shoppingListService.renderShoppingList(1L);

        assertArrayEquals(new byte[]{1, 2, 3}, result);
        verify(renderer, times(1)).render(eq("chef"), eq(LocalDate.now()), eq(items));
    }

    @Test
    @DisplayName("renderShoppingList: 장바구니가 비어 있어도 빈 목록으로 문서를 만든다")
    void render_emptyCart() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(User.builder().id(1L).username("chef").build()));
        when(recipeIngredientRepository.aggregateShoppingList(1L)).thenReturn(List.of());
        when(renderer.render(eq("chef"), any(LocalDate.class), eq(List.of()))).thenReturn(new byte[]{9});

        assertArrayEquals(new byte[]{9}, shoppingListService.renderShoppingList(1L));
    }

    @Test
    @DisplayName("renderShoppingList: 사용자가 없으면 USER_NOT_FOUND")
    void render_userNotFound() {
        when(userRepository.findById(1L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> shoppingListService.renderShoppingList(1L));

        assertEquals(ErrorCode.USER_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(renderer);
    }
}
