package com.jdc.foodgram.domain.dto.user;

import com.jdc.foodgram.domain.entity.User;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserCreateRequestDto {

    @NotBlank(message = "이메일은 필수입니다.")
    @Email(message = "이메일 형식이 올바르지 않습니다.")
    @Size(max = 254, message = "이메일은 254자를 넘을 수 없습니다.")
    private String email;

    @NotBlank(message = "사용자 이름은 필수입니다.")
    @Size(max = 150, message = "사용자 이름은 150자를 넘을 수 없습니다.")
    @Pattern(regexp = User.USERNAME_PATTERN, message = "사용자 이름에 허용되지 않는 문자가 포함되어 있습니다.")
    private String username;

    @NotBlank(message = "이름은 필수입니다.")
    @Size(max = 150, message = "이름은 150자를 넘을 수 없습니다.")
    private String firstName;

    @NotBlank(message = "성은 필수입니다.")
    @Size(max = 150, message = "성은 150자를 넘을 수 없습니다.")
    private String lastName;

    @NotBlank(message = "비밀번호는 필수입니다.")
    @Size(max = 128, message = "비밀번호는 128자를 넘을 수 없습니다.")
    private String password;
}
