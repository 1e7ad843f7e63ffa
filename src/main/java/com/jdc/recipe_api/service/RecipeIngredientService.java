package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeIngredient;
import com.jdc.recipe_api.domain.entity.Ingredient;
import com.jdc.recipe_api.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_api.domain.repository.IngredientRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class RecipeIngredientService {

    private final RecipeIngredientRepository recipeIngredientRepository;
    private final IngredientRepository ingredientRepository;

    /**
     * 요청한 재료 id 를 소유자의 재료로 변환한다. 중복은 첫 등장 순서만 남긴다.
     * 없는 id 나 다른 사용자의 재료가 섞여 있으면 ingredients 필드 오류로 거부한다.
     */
    @Transactional(readOnly = true)
    public List<Ingredient> resolveOwnedIngredients(Long ownerId, List<Long> ingredientIds) {
        if (ingredientIds == null || ingredientIds.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> distinctIds = ingredientIds.stream().distinct().toList();
        Map<Long, Ingredient> owned = ingredientRepository.findAllByIdInAndUserId(distinctIds, ownerId).stream()
                .collect(Collectors.toMap(Ingredient::getId, Function.identity()));

        if (owned.size() != distinctIds.size()) {
            throw CustomException.onField(ErrorCode.INVALID_INGREDIENT_REFERENCE, "ingredients");
        }

        return distinctIds.stream().map(owned::get).toList();
    }

    public List<RecipeIngredient> saveAll(Recipe recipe, List<Ingredient> ingredients) {
        if (ingredients == null || ingredients.isEmpty()) {
            return Collections.emptyList();
        }

        List<RecipeIngredient> recipeIngredients = ingredients.stream()
                .map(ingredient -> RecipeIngredient.builder()
                        .recipe(recipe)
                        .ingredient(ingredient)
                        .build())
                .toList();

        return recipeIngredientRepository.saveAll(recipeIngredients);
    }

    /**
     * 레시피의 재료 구성을 주어진 목록으로 교체한다.
     * 구성과 순서가 같으면 그대로 두고, 다르면 기존 연결을 지운 뒤 요청 순서대로 다시 저장한다.
     */
    @Transactional
    public List<RecipeIngredient> replaceIngredients(Recipe recipe, List<Ingredient> ingredients) {
        List<Ingredient> newIngredients = ingredients == null ? Collections.emptyList() : ingredients;
        List<RecipeIngredient> existing = recipeIngredientRepository.findByRecipeIdOrderByIdAsc(recipe.getId());

        List<Long> existingIds = existing.stream().map(ri -> ri.getIngredient().getId()).toList();
        List<Long> newIds = newIngredients.stream().map(Ingredient::getId).toList();
        if (existingIds.equals(newIds)) {
            return existing;
        }

        if (!existing.isEmpty()) {
            recipeIngredientRepository.deleteAll(existing);
            // 같은 (recipe, ingredient) 쌍을 다시 넣기 전에 삭제를 먼저 반영한다
            recipeIngredientRepository.flush();
        }
        return saveAll(recipe, newIngredients);
    }

    @Transactional(readOnly = true)
    public List<RecipeIngredient> findByRecipeId(Long recipeId) {
        return recipeIngredientRepository.findByRecipeIdOrderByIdAsc(recipeId);
    }

    /** 레시피 id → 재료 연결 목록. 목록 조회 시 N+1 을 피하기 위해 한 번에 읽는다. */
    @Transactional(readOnly = true)
    public Map<Long, List<RecipeIngredient>> findByRecipeIds(Collection<Long> recipeIds) {
        if (recipeIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return recipeIngredientRepository.findByRecipeIdInOrderByIdAsc(recipeIds).stream()
                .collect(Collectors.groupingBy(ri -> ri.getRecipe().getId(), LinkedHashMap::new, Collectors.toList()));
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeIngredientRepository.deleteByRecipeId(recipeId);
    }
}
