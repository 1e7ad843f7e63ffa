package com.jdc.recipe_api.domain.dto.user;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UserCreateRequestDto {
    @NotBlank(message = "이메일은 비어 있을 수 없습니다.")
    @Email(message = "이메일 형식이 올바르지 않습니다.")
    @Size(max = 255)
    private String email;

    @NotBlank(message = "비밀번호는 비어 있을 수 없습니다.")
    @Size(min = 5, max = 128, message = "비밀번호는 5자 이상이어야 합니다.")
    private String password;

    @Size(max = 255)
    private String name;
}
