package com.jdc.foodgram.service.user;

import com.jdc.foodgram.domain.dto.user.AvatarDto;
import com.jdc.foodgram.domain.dto.user.PasswordChangeRequestDto;
import com.jdc.foodgram.domain.dto.user.UserCreateRequestDto;
import com.jdc.foodgram.domain.dto.user.UserCreatedDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.entity.User;
import com.jdc.foodgram.domain.repository.UserRepository;
import com.jdc.foodgram.domain.repository.user.SubscriptionRepository;
import com.jdc.foodgram.exception.CustomException;
import com.jdc.foodgram.exception.ErrorCode;
import com.jdc.foodgram.mapper.UserMapper;
import com.jdc.foodgram.storage.LocalImageStorage;
import com.jdc.foodgram.util.Base64ImageDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final PasswordEncoder passwordEncoder;
    private final Base64ImageDecoder imageDecoder;
    private final LocalImageStorage imageStorage;

    @Transactional
    public UserCreatedDto register(UserCreateRequestDto dto) {
        if (userRepository.existsByEmail(dto.getEmail())) {
            throw new CustomException(ErrorCode.DUPLICATE_EMAIL, ErrorCode.DUPLICATE_EMAIL.getMessage(), "email");
        }
        if (userRepository.existsByUsername(dto.getUsername())) {
            throw new CustomException(ErrorCode.DUPLICATE_USERNAME, ErrorCode.DUPLICATE_USERNAME.getMessage(), "username");
        }

        User user = userRepository.save(UserMapper.toEntity(dto, passwordEncoder.encode(dto.getPassword())));
        log.info("회원 가입: userId={}, username={}", user.getId(), user.getUsername());
        return UserMapper.toCreatedDto(user);
    }

    @Transactional(readOnly = true)
    public Page<UserDto> getUsers(Pageable pageable, Long currentUserId) {
        Page<User> users = userRepository.findAll(
                PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by("email")));

        if (currentUserId == null || users.isEmpty()) {
            return users.map(user -> UserMapper.toDto(user, false));
        }
        List<Long> ids = users.getContent().stream().map(User::getId).toList();
        Set<Long> subscribed = subscriptionRepository.findAuthorIdsByUserIdAndAuthorIdIn(currentUserId, ids);
        return users.map(user -> UserMapper.toDto(user, subscribed.contains(user.getId())));
    }

    @Transactional(readOnly = true)
    public UserDto getUser(Long userId, Long currentUserId) {
        User user = getUserOrThrow(userId);
        boolean subscribed = currentUserId != null
                && subscriptionRepository.existsByUserIdAndAuthorId(currentUserId, userId);
        return UserMapper.toDto(user, subscribed);
    }

    @Transactional(readOnly = true)
    public UserDto getMe(Long userId) {
        return UserMapper.toDto(getUserOrThrow(userId), false);
    }

    @Transactional
    public AvatarDto updateAvatar(Long userId, String dataUri) {
        User user = getUserOrThrow(userId);
        String oldAvatar = user.getAvatar();

        String url = imageStorage.save(LocalImageStorage.AVATARS, imageDecoder.decode(dataUri, "avatar"));
        user.updateAvatar(url);
        if (oldAvatar != null) {
            imageStorage.deleteByUrlQuietly(oldAvatar);
        }
        return new AvatarDto(url);
    }

    @Transactional
    public void deleteAvatar(Long userId) {
        User user = getUserOrThrow(userId);
        String oldAvatar = user.getAvatar();
        user.updateAvatar(null);
        if (oldAvatar != null) {
            imageStorage.deleteByUrlQuietly(oldAvatar);
        }
    }

    @Transactional
    public void changePassword(Long userId, PasswordChangeRequestDto dto) {
        User user = getUserOrThrow(userId);
        if (!passwordEncoder.matches(dto.getCurrentPassword(), user.getPassword())) {
            throw new CustomException(ErrorCode.INVALID_CURRENT_PASSWORD,
                    ErrorCode.INVALID_CURRENT_PASSWORD.getMessage(), "current_password");
        }
        user.changePassword(passwordEncoder.encode(dto.getNewPassword()));
        log.info("비밀번호 변경: userId={}", userId);
    }

    private User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }
}
