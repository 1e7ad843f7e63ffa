package com.jdc.recipe_api.mapper;

import com.jdc.recipe_api.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeIngredient;
import com.jdc.recipe_api.domain.entity.RecipeTag;
import com.jdc.recipe_api.domain.entity.User;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

public class RecipeMapper {

    public static Recipe toEntity(RecipeRequestDto dto, User user) {
        return Recipe.builder()
                .user(user)
                .title(dto.getTitle().trim())
                .timeMinutes(dto.getTimeMinutes())
                .cost(normalizeCost(dto.getCost()))
                .link(dto.getLink())
                .build();
    }

    // 목록/생성 응답: 태그, 재료는 id 만
    public static RecipeDto toDto(Recipe recipe, List<RecipeTag> tags, List<RecipeIngredient> ingredients) {
        return RecipeDto.builder()
                .id(recipe.getId())
                .title(recipe.getTitle())
                .timeMinutes(recipe.getTimeMinutes())
                .cost(recipe.getCost())
                .link(recipe.getLink())
                .tags(tags.stream().map(rt -> rt.getTag().getId()).toList())
                .ingredients(ingredients.stream().map(ri -> ri.getIngredient().getId()).toList())
                .build();
    }

    // 상세 응답: 태그, 재료 객체를 그대로 포함
    public static RecipeDetailDto toDetailDto(Recipe recipe, List<RecipeTag> tags, List<RecipeIngredient> ingredients) {
        return RecipeDetailDto.builder()
                .id(recipe.getId())
                .title(recipe.getTitle())
                .timeMinutes(recipe.getTimeMinutes())
                .cost(recipe.getCost())
                .link(recipe.getLink())
                .tags(TagMapper.fromRecipeTags(tags))
                .ingredients(IngredientMapper.fromRecipeIngredients(ingredients))
                .build();
    }

    public static BigDecimal normalizeCost(BigDecimal cost) {
        return cost == null ? null : cost.setScale(2, RoundingMode.HALF_UP);
    }
}
