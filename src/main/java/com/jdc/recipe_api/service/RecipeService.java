package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipePatchRequestDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_api.domain.entity.*;
import com.jdc.recipe_api.domain.repository.RecipeRepository;
import com.jdc.recipe_api.domain.repository.UserRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.mapper.RecipeMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecipeService {

    private final RecipeRepository recipeRepository;
    private final UserRepository userRepository;

    private final RecipeTagService recipeTagService;
    private final RecipeIngredientService recipeIngredientService;

    /** 내 레시피 목록 (id 내림차순, 태그/재료는 id 목록) */
    @Transactional(readOnly = true)
    public List<RecipeDto> getRecipes(Long userId) {
        List<Recipe> recipes = recipeRepository.findAllByUserIdOrderByIdDesc(userId);
        if (recipes.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> recipeIds = recipes.stream().map(Recipe::getId).toList();
        Map<Long, List<RecipeTag>> tagsByRecipe = recipeTagService.findByRecipeIds(recipeIds);
        Map<Long, List<RecipeIngredient>> ingredientsByRecipe = recipeIngredientService.findByRecipeIds(recipeIds);

        return recipes.stream()
                .map(recipe -> RecipeMapper.toDto(
                        recipe,
                        tagsByRecipe.getOrDefault(recipe.getId(), Collections.emptyList()),
                        ingredientsByRecipe.getOrDefault(recipe.getId(), Collections.emptyList())))
                .toList();
    }

    @Transactional
    public RecipeDto createRecipe(Long userId, RecipeRequestDto dto) {
        User user = getUserOrThrow(userId);

        // 연결 대상 검증을 저장보다 먼저 수행한다
        List<Tag> tags = recipeTagService.resolveOwnedTags(userId, dto.getTags());
        List<Ingredient> ingredients = recipeIngredientService.resolveOwnedIngredients(userId, dto.getIngredients());

        Recipe recipe = recipeRepository.save(RecipeMapper.toEntity(dto, user));
        List<RecipeTag> recipeTags = recipeTagService.saveAll(recipe, tags);
        List<RecipeIngredient> recipeIngredients = recipeIngredientService.saveAll(recipe, ingredients);

        log.info("레시피 생성: userId={}, recipeId={}, tags={}, ingredients={}",
                userId, recipe.getId(), tags.size(), ingredients.size());
        return RecipeMapper.toDto(recipe, recipeTags, recipeIngredients);
    }

    /** 레시피 상세 (태그/재료 객체 포함) */
    @Transactional(readOnly = true)
    public RecipeDetailDto getRecipe(Long userId, Long recipeId) {
        Recipe recipe = getOwnedRecipeOrThrow(userId, recipeId);
        return RecipeMapper.toDetailDto(
                recipe,
                recipeTagService.findByRecipeId(recipeId),
                recipeIngredientService.findByRecipeId(recipeId));
    }

    /** 전체 수정(PUT). 생략된 tags/ingredients 는 비운다. */
    @Transactional
    public RecipeDto updateRecipe(Long userId, Long recipeId, RecipeRequestDto dto) {
        Recipe recipe = getOwnedRecipeOrThrow(userId, recipeId);

        List<Tag> tags = recipeTagService.resolveOwnedTags(userId, dto.getTags());
        List<Ingredient> ingredients = recipeIngredientService.resolveOwnedIngredients(userId, dto.getIngredients());

        recipe.updateTitle(dto.getTitle().trim());
        recipe.updateTimeMinutes(dto.getTimeMinutes());
        recipe.updateCost(RecipeMapper.normalizeCost(dto.getCost()));
        recipe.updateLink(dto.getLink());

        List<RecipeTag> recipeTags = recipeTagService.replaceTags(recipe, tags);
        List<RecipeIngredient> recipeIngredients = recipeIngredientService.replaceIngredients(recipe, ingredients);

        log.info("레시피 전체 수정: userId={}, recipeId={}", userId, recipeId);
        return RecipeMapper.toDto(recipe, recipeTags, recipeIngredients);
    }

    /** 부분 수정(PATCH). 요청에 포함된 필드만 바꾸며, tags/ingredients 는 포함된 경우 통째로 교체한다. */
    @Transactional
    public RecipeDto patchRecipe(Long userId, Long recipeId, RecipePatchRequestDto dto) {
        Recipe recipe = getOwnedRecipeOrThrow(userId, recipeId);

        List<Tag> tags = dto.getTags() != null
                ? recipeTagService.resolveOwnedTags(userId, dto.getTags())
                : null;
        List<Ingredient> ingredients = dto.getIngredients() != null
                ? recipeIngredientService.resolveOwnedIngredients(userId, dto.getIngredients())
                : null;

        if (dto.getTitle() != null) recipe.updateTitle(dto.getTitle().trim());
        if (dto.getTimeMinutes() != null) recipe.updateTimeMinutes(dto.getTimeMinutes());
        if (dto.getCost() != null) recipe.updateCost(RecipeMapper.normalizeCost(dto.getCost()));
        if (dto.getLink() != null) recipe.updateLink(dto.getLink());

        List<RecipeTag> recipeTags = tags != null
                ? recipeTagService.replaceTags(recipe, tags)
                : recipeTagService.findByRecipeId(recipeId);
        List<RecipeIngredient> recipeIngredients = ingredients != null
                ? recipeIngredientService.replaceIngredients(recipe, ingredients)
                : recipeIngredientService.findByRecipeId(recipeId);

        log.info("레시피 부분 수정: userId={}, recipeId={}", userId, recipeId);
        return RecipeMapper.toDto(recipe, recipeTags, recipeIngredients);
    }

    // 태그/재료 자체는 남기고 연결만 삭제한다
    @Transactional
    public void deleteRecipe(Long userId, Long recipeId) {
        Recipe recipe = getOwnedRecipeOrThrow(userId, recipeId);

        recipeTagService.deleteAllByRecipeId(recipeId);
        recipeIngredientService.deleteAllByRecipeId(recipeId);
        recipeRepository.delete(recipe);

        log.info("레시피 삭제: userId={}, recipeId={}", userId, recipeId);
    }

    private User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }

    // 다른 사용자의 레시피는 존재 여부를 드러내지 않고 404 로 응답한다
    private Recipe getOwnedRecipeOrThrow(Long userId, Long recipeId) {
        return recipeRepository.findByIdAndUserId(recipeId, userId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }
}
