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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;

import java.sql.SQLException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RecipeFavoriteServiceTest {

    @Mock
    private FavoriteRepository favoriteRepository;
    @Mock
    private RecipeRepository recipeRepository;
    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private RecipeFavoriteService favoriteService;

    private User user;
    private Recipe recipe;

    @BeforeEach
    void setUp() {
        user = User.builder().id(1L).build();
        recipe = Recipe.builder().id(10L).name("Borscht").image("/media/recipes/images/b.png").cookingTime(90).build();
    }

    @Test
    @DisplayName("addFavorite: 기록이 없으면 저장하고 요약 정보를 반환")
    void addFavorite_savesAndReturnsSummary() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        ArgumentCaptor<Favorite> captor = ArgumentCaptor.forClass(Favorite.class);
        when(favoriteRepository.saveAndFlush(captor.capture())).thenAnswer(invocation -> invocation.getArgument(0));

        RecipeSimpleDto result = favoriteService.addFavorite(1L, 10L);

        assertEquals(10L, result.getId());
        assertEquals("Borscht", result.getName());
        assertEquals("/media/recipes/images/b.png", result.getImage());
        assertEquals(90, result.getCookingTime());
        assertSame(user, captor.getValue().getUser());
        assertSame(recipe, captor.getValue().getRecipe());
    }

    @Test
    @DisplayName("addFavorite: 이미 즐겨찾기면 ALREADY_FAVORITED_RECIPE, 저장하지 않음")
    void addFavorite_duplicate() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(true);

        CustomException ex = assertThrows(CustomException.class, () -> favoriteService.addFavorite(1L, 10L));

        assertEquals(ErrorCode.ALREADY_FAVORITED_RECIPE, ex.getErrorCode());
        verify(favoriteRepository, never()).saveAndFlush(any());
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("addFavorite: 동시에 저장되어 유니크 제약에 걸리면 ALREADY_FAVORITED_RECIPE")
    void addFavorite_concurrentDuplicate() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(favoriteRepository.saveAndFlush(any(Favorite.class)))
                .thenThrow(violation("PUBLIC.UK_FAVORITES_USER_RECIPE_INDEX_5"));

        CustomException ex = assertThrows(CustomException.class, () -> favoriteService.addFavorite(1L, 10L));

        assertEquals(ErrorCode.ALREADY_FAVORITED_RECIPE, ex.getErrorCode());
    }

    @Test
    @DisplayName("addFavorite: 유니크 제약이 아닌 무결성 오류(FK)는 중복으로 바꾸지 않고 그대로 전파")
    void addFavorite_foreignKeyViolationPropagates() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.of(recipe));
        when(favoriteRepository.existsByUserIdAndRecipeId(1L, 10L)).thenReturn(false);
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        DataIntegrityViolationException fk = violation("PUBLIC.FKT5DEIG3W5WKGHKOYS2KQJ38XR");
        when(favoriteRepository.saveAndFlush(any(Favorite.class))).thenThrow(fk);

        DataIntegrityViolationException ex = assertThrows(DataIntegrityViolationException.class,
                () -> favoriteService.addFavorite(1L, 10L));

        assertSame(fk, ex);
    }

    private static DataIntegrityViolationException violation(String constraintName) {
        return new DataIntegrityViolationException("could not execute statement",
                new ConstraintViolationException("could not execute statement",
                        new SQLException("integrity constraint violation"), constraintName));
    }

    @Test
    @DisplayName("addFavorite: 레시피가 없으면 RECIPE_NOT_FOUND")
    void addFavorite_recipeNotFound() {
        when(recipeRepository.findById(10L)).thenReturn(Optional.empty());

        CustomException ex = assertThrows(CustomException.class, () -> favoriteService.addFavorite(1L, 10L));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(favoriteRepository);
    }

    @Test
    @DisplayName("removeFavorite: 삭제된 행이 있으면 정상 종료")
    void removeFavorite_success() {
        when(recipeRepository.existsById(10L)).thenReturn(true);
        when(favoriteRepository.deleteByUserIdAndRecipeId(1L, 10L)).thenReturn(1);

        assertDoesNotThrow(() -> favoriteService.removeFavorite(1L, 10L));
        verify(favoriteRepository, times(1)).deleteByUserIdAndRecipeId(1L, 10L);
    }

    @Test
    @DisplayName("removeFavorite: 즐겨찾기 기록이 없으면 RECIPE_NOT_FAVORITED")
    void removeFavorite_notFavorited() {
        when(recipeRepository.existsById(10L)).thenReturn(true);
        when(favoriteRepository.deleteByUserIdAndRecipeId(1L, 10L)).thenReturn(0);

        CustomException ex = assertThrows(CustomException.class, () -> favoriteService.removeFavorite(1L, 10L));

        assertEquals(ErrorCode.RECIPE_NOT_FAVORITED, ex.getErrorCode());
        assertEquals(400, ex.getErrorCode().getStatus().value());
    }

    @Test
    @DisplayName("removeFavorite: 레시피가 없으면 RECIPE_NOT_FOUND")
    void removeFavorite_recipeNotFound() {
        when(recipeRepository.existsById(10L)).thenReturn(false);

        CustomException ex = assertThrows(CustomException.class, () -> favoriteService.removeFavorite(1L, 10L));

        assertEquals(ErrorCode.RECIPE_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(favoriteRepository);
    }
}
