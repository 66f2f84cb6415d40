package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.Recipe;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

public interface RecipeQueryRepository {

    /**
     * 작성자, 태그 slug, 즐겨찾기/장바구니 여부로 레시피를 필터링한다.
     * 즐겨찾기/장바구니 조건은 currentUserId가 있을 때만 적용된다.
     */
    Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId);
}
