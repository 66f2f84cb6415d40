package com.jdc.foodgram.service.user;

import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.domain.entity.Recipe;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.entity.user.Subscription;
import com.jdc.foodgram.domain.repository.RecipeRepository;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.domain.repository.user.SubscriptionRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.RecipeMapper;
import com.jdc.foodgram.mapper.UserMapper;
import com.jdc.foodgram.util.ConstraintViolations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;

    @Transactional
    public UserWithRecipesDto subscribe(Long userId, Long authorId, String recipesLimit) {
        User author = userRepository.findById(authorId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        if (userId.equals(authorId)) {
            throw new CustomException(ErrorCode.CANNOT_SUBSCRIBE_TO_SELF);
        }
        if (subscriptionRepository.existsByUserIdAndAuthorId(userId, authorId)) {
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        try {
            subscriptionRepository.saveAndFlush(Subscription.builder().user(user).author(author).build());
        } catch (DataIntegrityViolationException e) {
            if (!ConstraintViolations.isViolationOf(e, Subscription.UK_USER_AUTHOR)) {
                throw e;
            }
            log.warn("구독 중복 저장 감지: userId={}, authorId={}", userId, authorId);
            throw new CustomException(ErrorCode.ALREADY_SUBSCRIBED);
        }

        log.info("구독: userId={}, authorId={}", userId, authorId);
        long count = recipeRepository.findRecipeCountsMapByAuthorIds(List.of(authorId)).getOrDefault(authorId, 0L);
        return UserMapper.toWithRecipesDto(author, true, previews(authorId, parseRecipesLimit(recipesLimit)), count);
    }

    @Transactional
    public void unsubscribe(Long userId, Long authorId) {
        if (!userRepository.existsById(authorId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        int deleted = subscriptionRepository.deleteByUserIdAndAuthorId(userId, authorId);
        if (deleted == 0) {
            throw new CustomException(ErrorCode.NOT_SUBSCRIBED);
        }
        log.info("구독 취소: userId={}, authorId={}", userId, authorId);
    }

    @Transactional(readOnly = true)
    public Page<UserWithRecipesDto> getSubscriptions(Long userId, Pageable pageable, String recipesLimit) {
        Integer limit = parseRecipesLimit(recipesLimit);
        Page<User> authors = subscriptionRepository.findAuthorsBySubscriberId(
                userId, PageRequest.of(pageable.getPageNumber(), pageable.getPageSize()));

        List<Long> authorIds = authors.getContent().stream().map(User::getId).toList();
        Map<Long, Long> counts = recipeRepository.findRecipeCountsMapByAuthorIds(authorIds);

        return authors.map(author -> UserMapper.toWithRecipesDto(
                author,
                true,
                previews(author.getId(), limit),
                counts.getOrDefault(author.getId(), 0L)
        ));
    }

    /**
     * 숫자로만 이루어진 값일 때만 제한으로 쓴다. 그 외(음수, 문자, 빈 값)는 제한 없음(null).
     */
    static Integer parseRecipesLimit(String raw) {
        if (raw == null || raw.isEmpty() || !raw.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return null;
        }
        try {
            return Integer.valueOf(raw);
        } catch (NumberFormatException e) {
            // int 범위를 넘는 숫자열은 사실상 무제한
            return null;
        }
    }

    private List<RecipeSimpleDto> previews(Long authorId, Integer limit) {
        List<Recipe> recipes;
        if (limit == null) {
            recipes = recipeRepository.findAllByAuthorIdOrderByNewest(authorId);
        } else if (limit == 0) {
            recipes = List.of();
        } else {
            recipes = recipeRepository.findByAuthorIdOrderByNewest(authorId, PageRequest.of(0, limit));
        }
        return recipes.stream().map(RecipeMapper::toSimpleDto).toList();
    }
}
