package com.jdc.recipe_api.mapper;

import com.jdc.recipe_api.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_api.domain.dto.ingredient.IngredientRequestDto;
import com.jdc.recipe_api.domain.entity.Ingredient;
import com.jdc.recipe_api.domain.entity.RecipeIngredient;
import com.jdc.recipe_api.domain.entity.User;

import java.util.List;

public class IngredientMapper {

    public static Ingredient toEntity(IngredientRequestDto dto, User user) {
        return Ingredient.builder()
                .name(dto.getName().trim())
                .user(user)
                .build();
    }

    public static IngredientDto toDto(Ingredient entity) {
        return IngredientDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .build();
    }

    public static List<IngredientDto> toDtoList(List<Ingredient> ingredients) {
        return ingredients.stream().map(IngredientMapper::toDto).toList();
    }

    public static List<IngredientDto> fromRecipeIngredients(List<RecipeIngredient> recipeIngredients) {
        return recipeIngredients.stream().map(ri -> toDto(ri.getIngredient())).toList();
    }
}
