package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.domain.dto.user.UserCreateRequestDto;
import com.jdc.recipe_api.domain.dto.user.UserPatchDto;
import com.jdc.recipe_api.domain.dto.user.UserResponseDto;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.security.CustomUserDetails;
import com.jdc.recipe_api.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/user")
@RequiredArgsConstructor
@Tag(name = "사용자 API", description = "회원가입과 내 정보 조회/수정/탈퇴 API입니다.")
public class UserController {

    private final UserService userService;

    @PostMapping("/create")
    @Operation(summary = "회원가입", description = "이메일은 소문자로 저장되며, 이미 사용 중이면 409를 반환합니다.")
    public ResponseEntity<UserResponseDto> createUser(@RequestBody @Valid UserCreateRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    @GetMapping("/me")
    @Operation(summary = "내 정보 조회")
    public ResponseEntity<UserResponseDto> getMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.getMe(currentUserId(userDetails)));
    }

    @PatchMapping("/me")
    @Operation(summary = "내 정보 수정", description = "이름과 비밀번호 중 요청에 포함된 값만 수정합니다.")
    public ResponseEntity<UserResponseDto> updateMe(
            @RequestBody @Valid UserPatchDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(userService.updateMe(currentUserId(userDetails), request));
    }

    @DeleteMapping("/me")
    @Operation(summary = "회원 탈퇴", description = "계정과 내가 만든 레시피, 태그, 재료를 모두 삭제합니다.")
    public ResponseEntity<Void> deleteMe(@AuthenticationPrincipal CustomUserDetails userDetails) {
        userService.deleteUser(currentUserId(userDetails));
        return ResponseEntity.noContent().build();
    }

    private Long currentUserId(CustomUserDetails userDetails) {
        if (userDetails == null) {
            throw new CustomException(ErrorCode.UNAUTHORIZED);
        }
        return userDetails.getUserId();
    }
}
