package com.jdc.recipe_api.domain.dto.tag;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class TagRequestDto {
    @NotBlank(message = "태그 이름은 비어 있을 수 없습니다.")
    @Size(max = 255)
    private String name;
}
