package com.jdc.foodgram.controller;

import com.jdc.foodgram.domain.dto.user.AvatarDto;
import com.jdc.foodgram.domain.dto.user.PasswordChangeRequestDto;
import com.jdc.foodgram.domain.dto.user.UserCreateRequestDto;
import com.jdc.foodgram.domain.dto.user.UserCreatedDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.security.CustomUserDetails;
import com.jdc.foodgram.service.user.UserService;
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

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users")
@Tag(name = "사용자 API", description = "회원 가입, 사용자 조회, 아바타와 비밀번호 관리 API입니다.")
public class UserController {

    private final UserService userService;

    @PostMapping
    @Operation(summary = "회원 가입", description = "이메일, 사용자 이름, 이름, 성, 비밀번호로 가입합니다.")
    public ResponseEntity<UserCreatedDto> register(@RequestBody @Valid UserCreateRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    @GetMapping
    @Operation(summary = "사용자 목록", description = "이메일 순으로 사용자 목록을 페이지 단위로 조회합니다.")
    public ResponseEntity<Page<UserDto>> getUsers(
            @PageableDefault(size = 6) Pageable pageable,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        Long currentUserId = userDetails != null ? userDetails.getUser().getId() : null;
        return ResponseEntity.ok(userService.getUsers(pageable, currentUserId));
    }

    @GetMapping("/{id}")
    @Operation(summary = "사용자 조회", description = "사용자 정보와 현재 사용자의 구독 여부를 조회합니다.")
    public ResponseEntity<UserDto> getUser(
            @Parameter(description = "사용자 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        Long currentUserId = userDetails != null ? userDetails.getUser().getId() : null;
        return ResponseEntity.ok(userService.getUser(id, currentUserId));
    }

    @GetMapping("/me")
    @Operation(summary = "내 정보 조회")
    public ResponseEntity<UserDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(userService.getMe(userDetails.getUser().getId()));
    }

    @PutMapping("/me/avatar")
    @Operation(summary = "아바타 등록", description = "data:image/<형식>;base64,<데이터> 형식의 이미지를 아바타로 저장합니다.")
    public ResponseEntity<AvatarDto> updateAvatar(
            @RequestBody @Valid AvatarDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return ResponseEntity.ok(userService.updateAvatar(userDetails.getUser().getId(), request.getAvatar()));
    }

    @DeleteMapping("/me/avatar")
    @Operation(summary = "아바타 삭제")
    public ResponseEntity<Void> deleteAvatar(@AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        userService.deleteAvatar(userDetails.getUser().getId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/set_password")
    @Operation(summary = "비밀번호 변경", description = "현재 비밀번호를 확인한 뒤 새 비밀번호로 변경합니다.")
    public ResponseEntity<Void> changePassword(
            @RequestBody @Valid PasswordChangeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        userService.changePassword(userDetails.getUser().getId(), request);
        return ResponseEntity.noContent().build();
    }
}
