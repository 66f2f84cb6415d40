package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.domain.entity.QIngredient;
import com.jdc.foodgram.domain.repository.IngredientRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.CatalogMapper;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class IngredientService {

    private final JPAQueryFactory queryFactory;
    private final IngredientRepository repo;

    private final QIngredient ing = QIngredient.ingredient;

    /**
     * @param name 이름 접두어 (대소문자 무시). 비어 있으면 전체 목록.
     */
    public List<IngredientDto> search(String name) {
        BooleanExpression nameCond = StringUtils.hasText(name)
                ? ing.name.startsWithIgnoreCase(name.trim())
                : null;

        return queryFactory
                .selectFrom(ing)
                .where(nameCond)
                .orderBy(ing.name.asc(), ing.measurementUnit.asc())
                .fetch()
                .stream()
                .map(CatalogMapper::toIngredientDto)
                .toList();
    }

    public IngredientDto getIngredient(Long id) {
        return repo.findById(id)
                .map(CatalogMapper::toIngredientDto)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }
}
