package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ShortLinkServiceTest {

    @Mock
    private RecipeRepository recipeRepository;

    @InjectMocks
    private ShortLinkService shortLinkService;

    @Test
    @DisplayName("resolve: 코드가 정확히 같으면 레시피 ID")
    void resolve_exactMatch() {
        when(recipeRepository.findByShortLink("aB3xYz"))
                .thenReturn(Optional.of(Recipe.builder().id(10L).shortLink("aB3xYz").build()));

        assertEquals(10L, shortLinkService.resolve("aB3xYz"));
    }

    @Test
    @DisplayName("resolve: DB가 대소문자를 무시해 다른 코드를 돌려줘도 SHORT_LINK_NOT_FOUND")
    void resolve_caseMismatch() {
        when(recipeRepository.findByShortLink("ABCDEF"))
                .thenReturn(Optional.of(Recipe.builder().id(10L).shortLink("abcdef").build()));

        CustomException ex = assertThrows(CustomException.class, () -> shortLinkService.resolve("ABCDEF"));

        assertEquals(ErrorCode.SHORT_LINK_NOT_FOUND, ex.getErrorCode());
    }

    @Test
    @DisplayName("getShortLink: 레시피가 없으면 RECIPE_NOT_FOUND")
    void getShortLink_notFound() {
        when(recipeRepository.findById(99L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> shortLinkService.getShortLink(99L));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
    }
}
