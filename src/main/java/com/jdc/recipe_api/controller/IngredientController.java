package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.domain.dto.ingredient.IngredientDto;
import com.jdc.recipe_api.domain.dto.ingredient.IngredientRequestDto;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.security.CustomUserDetails;
import com.jdc.recipe_api.service.IngredientService;
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
@RequestMapping("/api/recipe/ingredients")
@RequiredArgsConstructor
@Tag(name = "재료 API", description = "로그인한 사용자의 재료를 관리합니다.")
public class IngredientController {

    private final IngredientService service;

    /** 1) 내 재료 전체 조회 (이름 내림차순) */
    @GetMapping
    public ResponseEntity<List<IngredientDto>> getIngredients(
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(service.getIngredients(currentUserId(userDetails)));
    }

    /** 2) 생성 */
    @PostMapping
    public ResponseEntity<IngredientDto> create(
            @RequestBody @Valid IngredientRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        IngredientDto created = service.createIngredient(currentUserId(userDetails), dto);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /** 3) 단건 조회 */
    @GetMapping("/{id}")
    public ResponseEntity<IngredientDto> get(
            @Parameter(description = "재료 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(service.getIngredient(currentUserId(userDetails), id));
    }

    /** 4) 수정 */
    @RequestMapping(value = "/{id}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "재료 이름 수정")
    public ResponseEntity<IngredientDto> update(
            @Parameter(description = "재료 ID") @PathVariable Long id,
            @RequestBody @Valid IngredientRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(service.updateIngredient(currentUserId(userDetails), id, dto));
    }

    /** 5) 삭제 - 연결된 레시피는 유지 */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @Parameter(description = "재료 ID") @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        service.deleteIngredient(currentUserId(userDetails), id);
        return ResponseEntity.noContent().build();
    }

    private Long currentUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
