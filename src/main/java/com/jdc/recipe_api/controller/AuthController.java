package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.domain.dto.auth.LoginRequestDto;
import com.jdc.recipe_api.domain.dto.auth.TokenResponseDto;
import com.jdc.recipe_api.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;

@RestController
@RequestMapping("/api/user")
@RequiredArgsConstructor
@Tag(name = "인증 API", description = "이메일/비밀번호로 Access Token 을 발급합니다.")
public class AuthController {

    private final AuthService authService;
    private final Environment env;

    private boolean isLocal() {
        return Arrays.asList(env.getActiveProfiles()).contains("local");
    }

    @PostMapping("/token")
    @Operation(
            summary = "Access Token 발급",
            description = "인증에 성공하면 토큰을 응답 본문으로 반환하고 accessToken 쿠키로도 설정합니다."
    )
    public ResponseEntity<TokenResponseDto> createToken(
            @RequestBody @Valid LoginRequestDto request,
            HttpServletResponse response) {
        TokenResponseDto token = authService.login(request);

        ResponseCookie accessCookie = ResponseCookie.from("accessToken", token.getToken())
                .path("/")
                .httpOnly(true)
                .secure(!isLocal())
                .maxAge(authService.getAccessTokenMaxAgeSeconds())
                .sameSite("Lax")
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, accessCookie.toString());

        return ResponseEntity.ok(token);
    }
}
