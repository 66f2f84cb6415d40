package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.user.SubscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@Tag(name = "구독 API", description = "작성자 구독/구독 취소와 구독 목록 조회 API입니다.")
public class SubscriptionController {

    private final SubscriptionService subscriptionService;

    @GetMapping("/subscriptions")
    @Operation(summary = "구독 목록", description = "구독 중인 작성자와 레시피 미리보기를 조회합니다. recipes_limit이 숫자일 때만 미리보기 개수를 제한합니다.")
    public ResponseEntity<Page<UserWithRecipesDto>> getSubscriptions(
            @Parameter(description = "작성자별 레시피 미리보기 개수") @RequestParam(value = "recipes_limit", required = false) String recipesLimit,
            @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(subscriptionService.getSubscriptions(userDetails.getUser().getId(), pageable, recipesLimit));
    }

    @PostMapping("/{id}/subscribe")
    @Operation(summary = "구독", description = "작성자를 구독합니다. 자기 자신이나 이미 구독한 작성자는 구독할 수 없습니다.")
    public ResponseEntity<UserWithRecipesDto> subscribe(
            @Parameter(description = "작성자 ID") @PathVariable Long id,
            @Parameter(description = "레시피 미리보기 개수") @RequestParam(value = "recipes_limit", required = false) String recipesLimit,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        UserWithRecipesDto response = subscriptionService.subscribe(userDetails.getUser().getId(), id, recipesLimit);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{id}/subscribe")
    @Operation(summary = "구독 취소")
    public ResponseEntity<Void> unsubscribe(
            @Parameter(description = "작성자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        subscriptionService.unsubscribe(userDetails.getUser().getId(), id);
        return ResponseEntity.noContent().build();
    }
}
