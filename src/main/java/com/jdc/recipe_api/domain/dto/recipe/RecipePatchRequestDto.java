package com.jdc.recipe_api.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.List;

/**
 * 레시피 부분 수정(PATCH) 요청. null 인 필드는 변경하지 않는다.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipePatchRequestDto {

    @Pattern(regexp = "(?s).*\\S.*", message = "레시피 제목은 비어 있을 수 없습니다.")
    @Size(max = 255)
    private String title;

    @PositiveOrZero(message = "조리 시간은 0 이상이어야 합니다.")
    @JsonProperty("time_minutes")
    private Integer timeMinutes;

    @DecimalMin(value = "0.00", message = "비용은 0 이상이어야 합니다.")
    @Digits(integer = 3, fraction = 2, message = "비용은 소수점 둘째 자리까지, 999.99 이하로 입력해주세요.")
    private BigDecimal cost;

    @Size(max = 255)
    private String link;

    private List<@NotNull Long> tags;

    private List<@NotNull Long> ingredients;
}
