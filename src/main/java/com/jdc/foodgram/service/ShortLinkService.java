package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ShortLinkService {

    private final RecipeRepository recipeRepository;

    public Long resolve(String code) {
        // 대소문자를 구분하지 않는 콜레이션에서도 코드가 정확히 같을 때만 찾은 것으로 본다
        return recipeRepository.findByShortLink(code)
                .filter(recipe -> recipe.getShortLink().equals(code))
                .map(Recipe::getId)
                .orElseThrow(() -> new CustomException(ErrorCode.SHORT_LINK_NOT_FOUND));
    }

    public String getShortLink(Long recipeId) {
        return recipeRepository.findById(recipeId)
                .map(Recipe::getShortLink)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }
}
