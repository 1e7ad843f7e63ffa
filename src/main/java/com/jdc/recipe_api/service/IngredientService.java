package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_api.domain.dto.ingredient.IngredientRequestDto;
import com.jdc.recipe_api.domain.entity.Ingredient;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.IngredientRepository;
import com.jdc.recipe_api.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_api.domain.repository.UserRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.mapper.IngredientMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class IngredientService {

    private final IngredientRepository ingredientRepository;
    private final RecipeIngredientRepository recipeIngredientRepository;
    private final UserRepository userRepository;

    /** 내 재료 목록 (이름 내림차순) */
    @Transactional(readOnly = true)
    public List<IngredientDto> getIngredients(Long userId) {
        return IngredientMapper.toDtoList(ingredientRepository.findAllByUserIdOrderByNameDescIdDesc(userId));
    }

    public IngredientDto createIngredient(Long userId, IngredientRequestDto dto) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        Ingredient ingredient = ingredientRepository.save(IngredientMapper.toEntity(dto, user));
        log.info("재료 생성: userId={}, ingredientId={}", userId, ingredient.getId());
        return IngredientMapper.toDto(ingredient);
    }

    @Transactional(readOnly = true)
    public IngredientDto getIngredient(Long userId, Long ingredientId) {
        return IngredientMapper.toDto(getOwnedIngredientOrThrow(userId, ingredientId));
    }

    public IngredientDto updateIngredient(Long userId, Long ingredientId, IngredientRequestDto dto) {
        Ingredient ingredient = getOwnedIngredientOrThrow(userId, ingredientId);
        ingredient.rename(dto.getName().trim());
        return IngredientMapper.toDto(ingredient);
    }

    // 레시피와의 연결만 끊고 레시피는 남긴다
    public void deleteIngredient(Long userId, Long ingredientId) {
        Ingredient ingredient = getOwnedIngredientOrThrow(userId, ingredientId);
        recipeIngredientRepository.deleteByIngredientId(ingredient.getId());
        ingredientRepository.delete(ingredient);
        log.info("재료 삭제: userId={}, ingredientId={}", userId, ingredientId);
    }

    // 다른 사용자의 재료는 존재하지 않는 것과 동일하게 처리한다
    private Ingredient getOwnedIngredientOrThrow(Long userId, Long ingredientId) {
        return ingredientRepository.findByIdAndUserId(ingredientId, userId)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
    }
}
