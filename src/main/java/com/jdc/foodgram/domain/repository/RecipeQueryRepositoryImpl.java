package com.jdc.foodgram.domain.repository;

import com.jdc.foodgram.domain.dto.RecipeSearchCondition;
import com.jdc.foodgram.domain.entity.QFavorite;
import com.jdc.foodgram.domain.entity.QRecipe;
import com.jdc.foodgram.domain.entity.QShoppingCart;
import com.jdc.foodgram.domain.entity.Recipe;
import com.querydsl.core.types.dsl.BooleanExpression;
import com.querydsl.jpa.JPAExpressions;
import com.querydsl.jpa.impl.JPAQueryFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.util.List;

@RequiredArgsConstructor
public class RecipeQueryRepositoryImpl implements RecipeQueryRepository {

    private final JPAQueryFactory queryFactory;

    @Override
    public Page<Recipe> search(RecipeSearchCondition cond, Pageable pageable, Long currentUserId) {
        QRecipe recipe = QRecipe.recipe;

        BooleanExpression[] conditions = {
                authorEq(cond.getAuthorId()),
                tagSlugIn(cond.getTags()),
                favoritedBy(cond.isFavoritedOnly(), currentUserId),
                inShoppingCartOf(cond.isInShoppingCartOnly(), currentUserId)
        };

        List<Recipe> content = queryFactory
                .selectFrom(recipe)
                .join(recipe.author).fetchJoin()
                .where(conditions)
                .orderBy(recipe.createdAt.desc(), recipe.id.desc())
                .offset(pageable.getOffset())
                .limit(pageable.getPageSize())
                .fetch();

        Long total = queryFactory
                .select(recipe.count())
                .from(recipe)
                .where(conditions)
                .fetchOne();

        return new PageImpl<>(content, pageable, total != null ? total : 0L);
    }

    private BooleanExpression authorEq(Long authorId) {
        return authorId != null ? QRecipe.recipe.author.id.eq(authorId) : null;
    }

    private BooleanExpression tagSlugIn(List<String> slugs) {
        if (slugs == null || slugs.isEmpty()) {
            return null;
        }
        // any()는 EXISTS 서브쿼리로 풀려서 태그 여러 개가 맞아도 레시피가 중복되지 않는다
        return QRecipe.recipe.tags.any().slug.in(slugs);
    }

    private BooleanExpression favoritedBy(boolean enabled, Long userId) {
        if (!enabled || userId == null) {
            return null;
        }
        QFavorite favorite = QFavorite.favorite;
        return JPAExpressions.selectOne()
                .from(favorite)
                .where(favorite.recipe.eq(QRecipe.recipe), favorite.user.id.eq(userId))
                .exists();
    }

    private BooleanExpression inShoppingCartOf(boolean enabled, Long userId) {
        if (!enabled || userId == null) {
            return null;
        }
        QShoppingCart cart = QShoppingCart.shoppingCart;
        return JPAExpressions.selectOne()
                .from(cart)
                .where(cart.recipe.eq(QRecipe.recipe), cart.user.id.eq(userId))
                .exists();
    }
}
