package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.domain.dto.tag.TagDto;
import com.jdc.recipe_api.domain.dto.tag.TagRequestDto;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.security.CustomUserDetails;
import com.jdc.recipe_api.service.TagService;
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
@RequestMapping("/api/recipe/tags")
@RequiredArgsConstructor
@Tag(name = "태그 API", description = "로그인한 사용자의 태그를 조회, 생성, 수정, 삭제합니다.")
public class TagController {

    private final TagService tagService;

    @GetMapping
    @Operation(summary = "내 태그 목록", description = "이름 내림차순으로 정렬된 내 태그 목록을 반환합니다.")
    public ResponseEntity<List<TagDto>> getTags(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(tagService.getTags(currentUserId(userDetails)));
    }

    @PostMapping
    @Operation(summary = "태그 생성")
    public ResponseEntity<TagDto> createTag(
            @RequestBody @Valid TagRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        TagDto created = tagService.createTag(currentUserId(userDetails), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{tagId}")
    @Operation(summary = "태그 단건 조회")
    public ResponseEntity<TagDto> getTag(
            @Parameter(description = "태그 ID") @PathVariable Long tagId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(tagService.getTag(currentUserId(userDetails), tagId));
    }

    @RequestMapping(value = "/{tagId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    @Operation(summary = "태그 이름 수정")
    public ResponseEntity<TagDto> updateTag(
            @Parameter(description = "태그 ID") @PathVariable Long tagId,
            @RequestBody @Valid TagRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(tagService.updateTag(currentUserId(userDetails), tagId, request));
    }

    @DeleteMapping("/{tagId}")
    @Operation(summary = "태그 삭제", description = "태그를 삭제하고 레시피와의 연결을 해제합니다. 레시피는 유지됩니다.")
    public ResponseEntity<Void> deleteTag(
            @Parameter(description = "태그 ID") @PathVariable Long tagId,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        tagService.deleteTag(currentUserId(userDetails), tagId);
        return ResponseEntity.noContent().build();
    }

    private Long currentUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
