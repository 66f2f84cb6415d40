package com.jdc.foodgram.domain.dto.user;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PasswordChangeRequestDto {

    @NotBlank(message = "새 비밀번호는 필수입니다.")
    @Size(max = 128, message = "비밀번호는 128자를 넘을 수 없습니다.")
    private String newPassword;

    @NotBlank(message = "현재 비밀번호는 필수입니다.")
    private String currentPassword;
}
