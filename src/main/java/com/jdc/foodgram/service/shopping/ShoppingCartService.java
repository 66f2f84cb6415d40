package com.jdc.foodgram.service.shopping;

import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.ShoppingCart;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import com.jdc.foodgram.util.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShoppingCartService {

    private final ShoppingCartRepository shoppingCartRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeSimpleDto addToShoppingCart(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (shoppingCartRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            shoppingCartRepository.saveAndFlush(ShoppingCart.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, ShoppingCart.UK_USER_RECIPE)) {
                throw e;
            }
            // 동시에 들어온 같은 요청이 먼저 저장된 경우
            log.warn("장바구니 중복 저장 감지: userId={}, recipeId={}", userId, recipeId);
            throw new CustomException(ErrorCode.ALREADY_IN_SHOPPING_CART);
        }
        return RecipeMapper.toSimpleDto(recipe);
    }

    @Transactional
    public void removeFromShoppingCart(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        int deleted = shoppingCartRepository.deleteByUserIdAndRecipeId(userId, recipeId);
        if (deleted == 0) {
            throw new CustomException(ErrorCode.RECIPE_NOT_IN_SHOPPING_CART);
        }
    }
}
