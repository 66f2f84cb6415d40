package com.jdc.foodgram.controller;

import com.jdc.foodgram.service.ShortLinkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequiredArgsConstructor
@Tag(name = "짧은 링크", description = "짧은 링크를 레시피 페이지로 리다이렉트합니다.")
public class ShortLinkController {

    private final ShortLinkService shortLinkService;

    @GetMapping({"/s/{code}", "/s/{code}/"})
    @Operation(summary = "짧은 링크 이동", description = "/recipes/{id}/ 로 302 리다이렉트합니다. 없는 코드는 404.")
    public ResponseEntity<Void> redirect(@PathVariable String code) {
        Long recipeId = shortLinkService.resolve(code);
        return ResponseEntity.status(HttpStatus.FOUND)
                .location(URI.create("/recipes/" + recipeId + "/"))
                .build();
    }
}
