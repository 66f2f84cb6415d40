package com.jdc.foodgram.domain.dto.user;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 요청 시에는 data URI, 응답 시에는 저장된 이미지 URL.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class AvatarDto {

    @NotBlank(message = "아바타 이미지는 필수입니다.")
    private String avatar;
}
