package com.jdc.recipe_api.domain.dto.user;

import jakarta.validation.constraints.Size;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserPatchDto {
    @Size(max = 255)
    private String name;

    @Size(min = 5, max = 128, message = "비밀번호는 5자 이상이어야 합니다.")
    private String password;
}
