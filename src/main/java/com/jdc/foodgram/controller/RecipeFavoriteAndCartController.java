package com.jdc.foodgram.controller;

import com.jdc.foodgram.config.ShoppingListProperties;
import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.RecipeFavoriteService;
import com.jdc.foodgram.service.shopping.ShoppingCartService;
import com.jdc.foodgram.service.shopping.ShoppingListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/recipes")
@Tag(name = "즐겨찾기/장바구니 API", description = "레시피 즐겨찾기와 장바구니 추가/삭제, 장바구니 목록 내려받기 API입니다.")
public class RecipeFavoriteAndCartController {

    private final RecipeFavoriteService favoriteService;
    private final ShoppingCartService shoppingCartService;
    private final ShoppingListService shoppingListService;
    private final ShoppingListProperties shoppingListProperties;

    @PostMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 추가", description = "이미 추가된 레시피면 400을 반환합니다.")
    public ResponseEntity<RecipeSimpleDto> addFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        RecipeSimpleDto response = favoriteService.addFavorite(userDetails.getUser().getId(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{id}/favorite")
    @Operation(summary = "즐겨찾기 삭제", description = "추가되지 않은 레시피면 400을 반환합니다.")
    public ResponseEntity<Void> removeFavorite(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        favoriteService.removeFavorite(userDetails.getUser().getId(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니 추가", description = "이미 담긴 레시피면 400을 반환합니다.")
    public ResponseEntity<RecipeSimpleDto> addToShoppingCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        RecipeSimpleDto response = shoppingCartService.addToShoppingCart(userDetails.getUser().getId(), id);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/{id}/shopping_cart")
    @Operation(summary = "장바구니 삭제", description = "담기지 않은 레시피면 400을 반환합니다.")
    public ResponseEntity<Void> removeFromShoppingCart(
            @Parameter(description = "레시피 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        shoppingCartService.removeFromShoppingCart(userDetails.getUser().getId(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/download_shopping_cart")
    @Operation(summary = "장바구니 목록 내려받기", description = "장바구니 레시피의 재료를 이름/단위별로 합산한 PDF를 내려받습니다.")
    public ResponseEntity<byte[]> downloadShoppingCart(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        byte[] document = shoppingListService.renderShoppingList(userDetails.getUser().getId());

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(shoppingListService.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(shoppingListProperties.getFileName())
                        .build()
                        .toString())
                .body(document);
    }
}
