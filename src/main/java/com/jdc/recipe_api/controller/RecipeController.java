package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.domain.dto.recipe.RecipeDetailDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipePatchRequestDto;
import com.jdc.recipe_api.domain.dto.recipe.RecipeRequestDto;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.security.CustomUserDetails;
import com.jdc.recipe_api.service.RecipeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/recipe/recipes")
@RequiredArgsConstructor
@Tag(name = "레시피 관리 API", description = "내 레시피의 생성, 조회, 수정, 삭제를 위한 API입니다.")
public class RecipeController {

    private final RecipeService recipeService;

    @GetMapping
    @Operation(summary = "내 레시피 목록", description = "최신순(id 내림차순)으로 정렬된 레시피 목록을 반환합니다. 태그와 재료는 id 목록으로 표시됩니다.")
    public ResponseEntity<List<RecipeDto>> getRecipes(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(recipeService.getRecipes(currentUserId(userDetails)));
    }

    @PostMapping
    @Operation(summary = "레시피 생성", description = "레시피를 생성합니다. tags/ingredients 에는 내가 만든 태그와 재료의 id만 사용할 수 있습니다.")
    public ResponseEntity<RecipeDto> createRecipe(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "레시피 생성 요청 DTO")
            @RequestBody @Valid RecipeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        RecipeDto created = recipeService.createRecipe(currentUserId(userDetails), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{recipeId}")
    @Operation(summary = "레시피 상세 조회", description = "태그와 재료를 {id, name} 객체로 포함한 상세 정보를 반환합니다.")
    public ResponseEntity<RecipeDetailDto> getRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long recipeId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(recipeService.getRecipe(currentUserId(userDetails), recipeId));
    }

    @PutMapping("/{recipeId}")
    @Operation(summary = "레시피 전체 수정", description = "모든 필드를 덮어씁니다. 생략된 tags/ingredients 는 비워집니다.")
    public ResponseEntity<RecipeDto> updateRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long recipeId,
            @RequestBody @Valid RecipeRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(recipeService.updateRecipe(currentUserId(userDetails), recipeId, request));
    }

    @PatchMapping("/{recipeId}")
    @Operation(summary = "레시피 부분 수정", description = "요청에 포함된 필드만 수정합니다. tags/ingredients 를 보내면 목록 전체가 교체됩니다. "
            + "null 이나 생략된 필드는 변경하지 않으므로 link 를 지우려면 PUT 을 사용해야 합니다.")
    public ResponseEntity<RecipeDto> patchRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long recipeId,
            @RequestBody @Valid RecipePatchRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(recipeService.patchRecipe(currentUserId(userDetails), recipeId, request));
    }

    @DeleteMapping("/{recipeId}")
    @Operation(summary = "레시피 삭제", description = "레시피를 삭제합니다. 연결된 태그와 재료는 유지됩니다.")
    public ResponseEntity<Void> deleteRecipe(
            @Parameter(description = "레시피 ID") @PathVariable Long recipeId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        recipeService.deleteRecipe(currentUserId(userDetails), recipeId);
        return ResponseEntity.noContent().build();
    }

    private Long currentUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
