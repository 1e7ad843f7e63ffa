package com.jdc.recipe_api.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.math.BigDecimal;
import java.util.List;

/** 목록/생성 응답용. 태그와 재료는 id 목록으로 내려간다. */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class RecipeDto {
    private Long id;
    private String title;

    @JsonProperty("time_minutes")
    private Integer timeMinutes;

    private BigDecimal cost;
    private String link;
    private List<Long> tags;
    private List<Long> ingredients;
}
