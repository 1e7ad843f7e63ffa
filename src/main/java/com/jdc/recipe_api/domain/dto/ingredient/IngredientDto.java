package com.jdc.recipe_api.domain.dto.ingredient;

import lombok.*;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class IngredientDto {
    private Long id;
    private String name;
}
