package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeTag;
import com.jdc.recipe_api.domain.entity.Tag;
import com.jdc.recipe_api.domain.repository.RecipeTagRepository;
import com.jdc.recipe_api.domain.repository.TagRepository;
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
public class RecipeTagService {

    private final RecipeTagRepository recipeTagRepository;
    private final TagRepository tagRepository;

    /**
     * 요청한 태그 id 를 소유자의 태그로 변환한다. 중복은 첫 등장 순서만 남긴다.
     * 없는 id 나 다른 사용자의 태그가 섞여 있으면 tags 필드 오류로 거부한다.
     */
    @Transactional(readOnly = true)
    public List<Tag> resolveOwnedTags(Long ownerId, List<Long> tagIds) {
        if (tagIds == null || tagIds.isEmpty()) {
            return Collections.emptyList();
        }

        List<Long> distinctIds = tagIds.stream().distinct().toList();
        Map<Long, Tag> owned = tagRepository.findAllByIdInAndUserId(distinctIds, ownerId).stream()
                .collect(Collectors.toMap(Tag::getId, Function.identity()));

        if (owned.size() != distinctIds.size()) {
            throw CustomException.onField(ErrorCode.INVALID_TAG_REFERENCE, "tags");
        }

        return distinctIds.stream().map(owned::get).toList();
    }

    public List<RecipeTag> saveAll(Recipe recipe, List<Tag> tags) {
        if (tags == null || tags.isEmpty()) {
            return Collections.emptyList();
        }

        List<RecipeTag> recipeTags = tags.stream()
                .map(tag -> RecipeTag.builder()
                        .recipe(recipe)
                        .tag(tag)
                        .build())
                .toList();

        return recipeTagRepository.saveAll(recipeTags);
    }

    /**
     * 레시피의 태그 구성을 주어진 목록으로 교체한다.
     * 구성과 순서가 같으면 그대로 두고, 다르면 기존 연결을 지운 뒤 요청 순서대로 다시 저장한다.
     */
    @Transactional
    public List<RecipeTag> replaceTags(Recipe recipe, List<Tag> tags) {
        List<Tag> newTags = tags == null ? Collections.emptyList() : tags;
        List<RecipeTag> existing = recipeTagRepository.findByRecipeIdOrderByIdAsc(recipe.getId());

        List<Long> existingIds = existing.stream().map(rt -> rt.getTag().getId()).toList();
        List<Long> newIds = newTags.stream().map(Tag::getId).toList();
        if (existingIds.equals(newIds)) {
            return existing;
        }

        if (!existing.isEmpty()) {
            recipeTagRepository.deleteAll(existing);
            // 같은 (recipe, tag) 쌍을 다시 넣기 전에 삭제를 먼저 반영한다
            recipeTagRepository.flush();
        }
        return saveAll(recipe, newTags);
    }

    @Transactional(readOnly = true)
    public List<RecipeTag> findByRecipeId(Long recipeId) {
        return recipeTagRepository.findByRecipeIdOrderByIdAsc(recipeId);
    }

    /** 레시피 id → 태그 연결 목록. 목록 조회 시 N+1 을 피하기 위해 한 번에 읽는다. */
    @Transactional(readOnly = true)
    public Map<Long, List<RecipeTag>> findByRecipeIds(Collection<Long> recipeIds) {
        if (recipeIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return recipeTagRepository.findByRecipeIdInOrderByIdAsc(recipeIds).stream()
                .collect(Collectors.groupingBy(rt -> rt.getRecipe().getId(), LinkedHashMap::new, Collectors.toList()));
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeTagRepository.deleteByRecipeId(recipeId);
    }
}
