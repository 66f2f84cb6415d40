package com.jdc.foodgram.service;

import com.jdc.foodgram.domain.dto.auth.AuthTokenDto;
import com.jdc.foodgram.domain.dto.auth.LoginRequestDto;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.jwt.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional(readOnly = true)
    public AuthTokenDto login(LoginRequestDto dto) {
        User user = userRepository.findByEmail(dto.getEmail())
                .filter(u -> passwordEncoder.matches(dto.getPassword(), u.getPassword()))
                .orElseThrow(() -> {
                    log.warn("로그인 실패: email={}", dto.getEmail());
                    return new CustomException(ErrorCode.INVALID_CREDENTIALS);
                });

        return new AuthTokenDto(jwtTokenProvider.createAccessToken(user));
    }
}
