package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.TagDto;
import com.jdc.foodgram.service.TagService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tags")
@Tag(name = "태그 API", description = "레시피 태그 목록 조회 API입니다.")
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "태그 목록", description = "이름 순으로 모든 태그를 조회합니다. 페이지네이션 없음.")
    public ResponseEntity<List<TagDto>> getTags() {
        return ResponseEntity.ok(tagService.getTags());
    }

    @GetMapping("/{id}")
    @Operation(summary = "태그 조회")
    public ResponseEntity<TagDto> getTag(@PathVariable Long id) {
        return ResponseEntity.ok(tagService.getTag(id));
    }
}
