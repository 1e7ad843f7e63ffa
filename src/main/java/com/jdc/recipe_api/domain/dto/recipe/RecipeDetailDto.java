package com.jdc.recipe_api.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jdc.recipe_api.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_api.domain.dto.tag.TagDto;
import lombok.*;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecipeDetailDto {
    private Long id;
    private String title;

    @JsonProperty("time_minutes")
    private Integer timeMinutes;

    private BigDecimal cost;
    private String link;
    private List<TagDto> tags;
    private List<IngredientDto> ingredients;
}
