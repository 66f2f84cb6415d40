package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.domain.entity.Favorite;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.FavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
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
public class RecipeFavoriteService {

    private final FavoriteRepository favoriteRepository;
    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    @Transactional
    public RecipeSimpleDto addFavorite(Long userId, Long recipeId) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));

        if (favoriteRepository.existsByUserIdAndRecipeId(userId, recipeId)) {
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            favoriteRepository.saveAndFlush(Favorite.builder().user(user).recipe(recipe).build());
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, Favorite.UK_USER_RECIPE)) {
                throw e;
            }
            // 동시에 들어온 같은 요청이 먼저 저장된 경우
            log.warn("즐겨찾기 중복 저장 감지: userId={}, recipeId={}", userId, recipeId);
            throw new CustomException(ErrorCode.ALREADY_FAVORITED_RECIPE);
        }
        return RecipeMapper.toSimpleDto(recipe);
    }

    @Transactional
    public void removeFavorite(Long userId, Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        int deleted = favoriteRepository.deleteByUserIdAndRecipeId(userId, recipeId);
        if (deleted == 0) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FAVORITED);
        }
    }
}
