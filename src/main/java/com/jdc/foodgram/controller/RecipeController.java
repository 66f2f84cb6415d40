package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.RecipeSearchCondition;
import com.jdc.foodgram.domain.dto.recipe.RecipeDetailDto;
import com.jdc.foodgram.domain.dto.recipe.RecipeRequestDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.facade.RecipeFacade;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.RecipeService;
import com.jdc.foodgram.service.ShortLinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 API", description = "레시피 목록/상세 조회, 생성, 수정, 삭제와 짧은 링크 발급 API입니다.")
public class RecipeController {

    private final RecipeService recipeService;
    private final RecipeFacade recipeFacade;
    private final ShortLinkService shortLinkService;

    @GetMapping
    @Operation(summary = "레시피 목록", description = "최신순 레시피 목록. author, tags(slug, 여러 개 가능), is_favorited, is_in_shopping_cart로 필터링합니다. 즐겨찾기/장바구니 필터는 로그인한 경우에만 적용됩니다.")
    public ResponseEntity<Page<RecipeDetailDto>> getRecipes(
            @Parameter(description = "작성자 ID") @RequestParam(value = "author", required = false) Long author,
            @Parameter(description = "태그 slug 목록") @RequestParam(value = "tags", required = false) List<String> tags,
            @Parameter(description = "즐겨찾기만 (1/true)") @RequestParam(value = "is_favorited", required = false) Boolean isFavorited,
            @Parameter(description = "장바구니만 (1/true)") @RequestParam(value = "is_in_shopping_cart", required = false) Boolean isInShoppingCart,
            @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails) {

        Long currentUserId = userDetails != null ? userDetails.getUser().getId() : null;
        RecipeSearchCondition cond = RecipeSearchCondition.builder()
                .authorId(author)
                .tags(tags)
                .favoritedOnly(Boolean.TRUE.equals(isFavorited))
                .inShoppingCartOnly(Boolean.TRUE.equals(isInShoppingCart))
                .build();

        return ResponseEntity.ok(recipeService.getRecipes(cond, pageable, currentUserId));
    }

    @PostMapping
    @Operation(summary = "레시피 생성", description = "태그, 재료(id, amount), base64 이미지와 함께 레시피를 생성합니다.")
    public ResponseEntity<RecipeDetailDto> createRecipe(
            @RequestBody @Valid RecipeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        RecipeDetailDto response = recipeFacade.createRecipe(userDetails.getUser().getId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{id}")
    @Operation(summary = "레시피 상세 조회")
    public ResponseEntity<RecipeDetailDto> getRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        Long currentUserId = userDetails != null ? userDetails.getUser().getId() : null;
        return ResponseEntity.ok(recipeService.getRecipe(id, currentUserId));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "레시피 수정", description = "작성자만 수정할 수 있습니다. 태그와 재료 목록은 통째로 교체되고, 이미지는 생략하면 유지됩니다.")
    public ResponseEntity<RecipeDetailDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @RequestBody @Valid RecipeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(recipeFacade.updateRecipe(userDetails.getUser().getId(), id, request));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "레시피 삭제", description = "작성자만 삭제할 수 있습니다.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        recipeFacade.deleteRecipe(userDetails.getUser().getId(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/get-link")
    @Operation(summary = "짧은 링크 조회", description = "레시피의 공유용 짧은 링크(절대 URL)를 돌려줍니다.")
    public ResponseEntity<Map<String, String>> getLink(@Parameter(description = "레시피 ID") @PathVariable Long id) {
        String code = shortLinkService.getShortLink(id);
        String url = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/s/{code}/")
                .buildAndExpand(code)
                .toUriString();
        return ResponseEntity.ok(Map.of("short-link", url));
    }
}
