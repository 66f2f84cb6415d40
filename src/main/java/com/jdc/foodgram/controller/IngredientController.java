package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.ingredient.IngredientDto;
import com.jdc.foodgram.service.IngredientService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/ingredients")
@Tag(name = "재료 API", description = "재료 사전 조회 API입니다.")
public class IngredientController {

    private final IngredientService ingredientService;

    @GetMapping
    @Operation(summary = "재료 목록", description = "이름 접두어(대소문자 무시)로 재료를 검색합니다. 페이지네이션 없음.")
    public ResponseEntity<List<IngredientDto>> search(
            @Parameter(description = "재료 이름 접두어") @RequestParam(value = "name", required = false) String name) {
        return ResponseEntity.ok(ingredientService.search(name));
    }

    @GetMapping("/{id}")
    @Operation(summary = "재료 조회")
    public ResponseEntity<IngredientDto> getIngredient(@PathVariable Long id) {
        return ResponseEntity.ok(ingredientService.getIngredient(id));
    }
}
