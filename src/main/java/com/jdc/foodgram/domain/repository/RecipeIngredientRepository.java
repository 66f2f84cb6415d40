package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RecipeIngredientRepository extends JpaRepository<RecipeIngredient, Long> {

    @EntityGraph(attributePaths = {"ingredient"})
    @Query("SELECT ri FROM RecipeIngredient ri WHERE ri.recipe.id = :recipeId ORDER BY ri.id ASC")
    List<RecipeIngredient> findByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeIngredient ri WHERE ri.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    /**
     * 장바구니에 담긴 레시피들의 재료를 (이름, 단위)로 묶어 수량을 합산한다.
     * 이름, 단위 순 오름차순.
     */
    @Query("""
                SELECT new com.jdc.foodgram.domain.dto.shopping.ShoppingListItemDto(
                    i.name, i.measurementUnit, SUM(ri.amount))
                FROM RecipeIngredient ri
                JOIN ri.ingredient i
                WHERE ri.recipe.id IN (
                    SELECT sc.recipe.id FROM ShoppingCart sc WHERE sc.user.id = :userId
                )
                GROUP BY i.name, i.measurementUnit
                ORDER BY i.name ASC, i.measurementUnit ASC
            """)
    List<ShoppingListItemDto> aggregateShoppingList(@Param("userId") Long userId);
}
