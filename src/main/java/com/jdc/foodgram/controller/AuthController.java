package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.auth.AuthTokenDto;
import com.jdc.foodgram.domain.dto.auth.LoginRequestDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.jwt.JwtAuthenticationFilter;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth/token")
@Tag(name = "인증 API", description = "이메일/비밀번호 로그인으로 액세스 토큰을 발급합니다.")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    @Operation(summary = "로그인", description = "이메일과 비밀번호로 로그인하고 auth_token을 발급합니다.")
    public ResponseEntity<AuthTokenDto> login(@RequestBody @Valid LoginRequestDto request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/logout")
    @Operation(summary = "로그아웃", description = "토큰은 서버에 저장하지 않으므로 쿠키만 만료시킵니다.")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        ResponseCookie expired = ResponseCookie.from(JwtAuthenticationFilter.ACCESS_TOKEN_COOKIE, "")
                .path("/")
                .maxAge(0)
                .httpOnly(true)
                .build();
        return ResponseEntity.noContent()
                .header(HttpHeaders.SET_COOKIE, expired.toString())
                .build();
    }
}
