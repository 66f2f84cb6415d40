package com.jdc.foodgram.service.shopping;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeIngredientRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShoppingListService {

    private final RecipeIngredientRepository recipeIngredientRepository;
    private final UserRepository userRepository;
    private final ShoppingListRenderer renderer;

    /**
     * 장바구니에 담긴 모든 레시피의 재료를 (이름, 단위)별로 합산한다. 이름, 단위 오름차순.
     */
    @Transactional(readOnly = true)
    public List<ShoppingListItemDto> getShoppingList(Long userId) {
        return recipeIngredientRepository.aggregateShoppingList(userId);
    }

    @Transactional(readOnly = true)
    public byte[] renderShoppingList(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        List<ShoppingListItemDto> items = getShoppingList(userId);
        log.info("장바구니 문서 생성: userId={}, items={}", userId, items.size());
        return renderer.render(user.getUsername(), LocalDate.now(), items);
    }

    public String contentType() {
        return renderer.contentType();
    }
}
