package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.RecipeSearchCondition;
import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeRequestDto;
import com.jdc.foodgram.domain.entity.Ingredient;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.RecipeIngredient;
import com.jdc.foodgram.domain.entity.Tag;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.FavoriteRepository;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.ShoppingCartRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.domain.repository.user.SubscriptionRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import com.jdc.foodgram.mapper.UserMapper;
import com.jdc.foodgram.storage.LocalImageStorage;
import com.jdc.foodgram.util.ShortLinkGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;
    private final FavoriteRepository favoriteRepository;
    private final ShoppingCartRepository shoppingCartRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final RecipeTagService recipeTagService;
    private final RecipeIngredientService recipeIngredientService;
    private final ShortLinkGenerator shortLinkGenerator;
    private final LocalImageStorage imageStorage;

    /**
     * 레시피, 태그 연결, 재료 목록을 한 트랜잭션에서 저장한다.
     * 요청은 {@link RecipeRequestValidator}를 통과했고 이미지는 이미 저장된 상태여야 한다.
     */
    @Transactional
    public RecipeDetailDto createRecipe(Long userId, RecipeRequestDto dto, String imageUrl) {
        User author = getUserOrThrow(userId);
        List<Tag> tags = recipeTagService.resolveTags(dto.getTags());
        Map<Long, Ingredient> ingredientMap = recipeIngredientService.resolveIngredients(dto.getIngredients());

        String shortLink = shortLinkGenerator.generateUnique();
        Recipe recipe = RecipeMapper.toEntity(dto, author, imageUrl, shortLink);
        recipe.replaceTags(tags);
        recipe = recipeRepository.saveAndFlush(recipe);

        List<RecipeIngredient> lines = recipeIngredientService.saveAll(recipe, dto.getIngredients(), ingredientMap);

        log.info("레시피 생성: recipeId={}, authorId={}, shortLink={}", recipe.getId(), userId, shortLink);
        return RecipeMapper.toDetailDto(recipe, lines, UserMapper.toDto(author, false), false, false);
    }

    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipe(Long recipeId, Long currentUserId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        List<RecipeIngredient> lines = recipeIngredientService.findByRecipeId(recipeId);
        return toDetailDto(recipe, lines, currentUserId);
    }

    @Transactional(readOnly = true)
    public Page<RecipeDetailDto> getRecipes(RecipeSearchCondition cond, Pageable pageable, Long currentUserId) {
        Page<Recipe> page = recipeRepository.search(cond, pageable, currentUserId);

        if (currentUserId == null || page.isEmpty()) {
            return page.map(recipe -> RecipeMapper.toDetailDto(
                    recipe, recipe.getIngredients(), UserMapper.toDto(recipe.getAuthor(), false), false, false));
        }

        List<Long> recipeIds = page.getContent().stream().map(Recipe::getId).toList();
        List<Long> authorIds = page.getContent().stream().map(r -> r.getAuthor().getId()).distinct().toList();

        Set<Long> favoritedIds = favoriteRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
        Set<Long> cartIds = shoppingCartRepository.findRecipeIdsByUserIdAndRecipeIdIn(currentUserId, recipeIds);
        Set<Long> subscribedAuthorIds = subscriptionRepository.findAuthorIdsByUserIdAndAuthorIdIn(currentUserId, authorIds);

        return page.map(recipe -> RecipeMapper.toDetailDto(
                recipe,
                recipe.getIngredients(),
                UserMapper.toDto(recipe.getAuthor(), subscribedAuthorIds.contains(recipe.getAuthor().getId())),
                favoritedIds.contains(recipe.getId()),
                cartIds.contains(recipe.getId())
        ));
    }

    /**
     * 태그는 통째로 교체하고 재료 목록은 모두 지운 뒤 다시 넣는다.
     * newImageUrl이 null이면 기존 이미지를 유지한다.
     */
    @Transactional
    public RecipeDetailDto updateRecipe(Long userId, Long recipeId, RecipeRequestDto dto, String newImageUrl) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);

        List<Tag> tags = recipeTagService.resolveTags(dto.getTags());
        Map<Long, Ingredient> ingredientMap = recipeIngredientService.resolveIngredients(dto.getIngredients());

        // 벌크 삭제가 영속성 컨텍스트를 비우므로 레시피를 다시 읽는다
        recipeIngredientService.deleteByRecipeId(recipeId);
        recipe = getRecipeOrThrow(recipeId);

        String oldImageUrl = recipe.getImage();
        recipe.update(dto.getName(), dto.getText(), dto.getCookingTime());
        recipe.replaceTags(tags);
        if (newImageUrl != null) {
            recipe.updateImage(newImageUrl);
            runAfterCommit(() -> imageStorage.deleteByUrlQuietly(oldImageUrl));
        }
        recipeRepository.flush();

        List<RecipeIngredient> lines = recipeIngredientService.saveAll(recipe, dto.getIngredients(), ingredientMap);

        log.info("레시피 수정: recipeId={}, userId={}", recipeId, userId);
        return toDetailDto(recipe, lines, userId);
    }

    /**
     * 요청 본문을 검증하거나 이미지를 저장하기 전에 작성자인지 먼저 확인한다.
     */
    @Transactional(readOnly = true)
    public void checkAuthor(Long userId, Long recipeId) {
        Long authorId = recipeRepository.findAuthorIdById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
        if (!authorId.equals(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
    }

    @Transactional
    public void deleteRecipe(Long userId, Long recipeId) {
        Recipe recipe = getRecipeOrThrow(recipeId);
        validateOwnership(recipe, userId);

        String imageUrl = recipe.getImage();

        recipeIngredientService.deleteByRecipeId(recipeId);
        favoriteRepository.deleteByRecipeId(recipeId);
        shoppingCartRepository.deleteByRecipeId(recipeId);
        recipeRepository.deleteById(recipeId);

        runAfterCommit(() -> imageStorage.deleteByUrlQuietly(imageUrl));
        log.info("레시피 삭제: recipeId={}, userId={}", recipeId, userId);
    }

    private RecipeDetailDto toDetailDto(Recipe recipe, List<RecipeIngredient> lines, Long currentUserId) {
        if (currentUserId == null) {
            return RecipeMapper.toDetailDto(recipe, lines, UserMapper.toDto(recipe.getAuthor(), false), false, false);
        }
        Long recipeId = recipe.getId();
        boolean subscribed = subscriptionRepository.existsByUserIdAndAuthorId(currentUserId, recipe.getAuthor().getId());
        boolean favorited = favoriteRepository.existsByUserIdAndRecipeId(currentUserId, recipeId);
        boolean inCart = shoppingCartRepository.existsByUserIdAndRecipeId(currentUserId, recipeId);
        return RecipeMapper.toDetailDto(recipe, lines, UserMapper.toDto(recipe.getAuthor(), subscribed), favorited, inCart);
    }

    private void runAfterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private Recipe getRecipeOrThrow(Long recipeId) {
        return recipeRepository.findDetailById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    private User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }

    private void validateOwnership(Recipe recipe, Long userId) {
        if (!recipe.getAuthor().getId().equals(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
    }
}
