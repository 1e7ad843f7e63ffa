package com.jdc.recipe_api.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * 레시피 생성(POST) / 전체 수정(PUT) 요청.
 * <p>PUT 에서 tags, ingredients 를 생략하면 연결이 모두 해제된다.</p>
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeRequestDto {

    @NotBlank(message = "레시피 제목은 비어 있을 수 없습니다.")
    @Size(max = 255)
    private String title;

    @NotNull(message = "조리 시간은 필수입니다.")
    @PositiveOrZero(message = "조리 시간은 0 이상이어야 합니다.")
    @JsonProperty("time_minutes")
    private Integer timeMinutes;

    @NotNull(message = "비용은 필수입니다.")
    @DecimalMin(value = "0.00", message = "비용은 0 이상이어야 합니다.")
    @Digits(integer = 3, fraction = 2, message = "비용은 소수점 둘째 자리까지, 999.99 이하로 입력해주세요.")
    private BigDecimal cost;

    @Size(max = 255)
    private String link;

    private List<@NotNull Long> tags;

    private List<@NotNull Long> ingredients;
}
