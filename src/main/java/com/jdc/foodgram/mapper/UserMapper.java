package com.jdc.foodgram.mapper;

import com.jdc.foodgram.domain.dto.recipe.RecipeSimpleDto;
import com.jdc.foodgram.domain.dto.user.UserCreateRequestDto;
import com.jdc.foodgram.domain.dto.user.UserCreatedDto;
import com.jdc.foodgram.domain.dto.user.UserDto;
import com.jdc.foodgram.domain.dto.user.UserWithRecipesDto;
import com.jdc.foodgram.domain.entity.User;

import java.util.List;

public class UserMapper {

    // 회원가입: 비밀번호는 이미 인코딩된 값을 받는다
    public static User toEntity(UserCreateRequestDto dto, String encodedPassword) {
        if (dto == null) return null;
        return User.builder()
                .email(dto.getEmail())
                .username(dto.getUsername())
                .firstName(dto.getFirstName())
                .lastName(dto.getLastName())
                .password(encodedPassword)
                .build();
    }

    public static UserCreatedDto toCreatedDto(User user) {
        if (user == null) return null;
        return UserCreatedDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .build();
    }

    public static UserDto toDto(User user, boolean subscribed) {
        if (user == null) return null;
        return UserDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(subscribed)
                .avatar(user.getAvatar())
                .build();
    }

    // 구독 목록용
    public static UserWithRecipesDto toWithRecipesDto(User user, boolean subscribed,
                                                      List<RecipeSimpleDto> recipes, long recipesCount) {
        if (user == null) return null;
        return UserWithRecipesDto.builder()
                .email(user.getEmail())
                .id(user.getId())
                .username(user.getUsername())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .isSubscribed(subscribed)
                .avatar(user.getAvatar())
                .recipes(recipes)
                .recipesCount(recipesCount)
                .build();
    }
}
