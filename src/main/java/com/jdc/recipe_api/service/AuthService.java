package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.auth.LoginRequestDto;
import com.jdc.recipe_api.domain.dto.auth.TokenResponseDto;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.jwt.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserService userService;
    private final JwtTokenProvider jwtTokenProvider;

    public TokenResponseDto login(LoginRequestDto dto) {
        User user = userService.authenticate(dto.getEmail(), dto.getPassword());
        String accessToken = jwtTokenProvider.createAccessToken(user);
        log.info("[AuthService] 토큰 발급: userId={}", user.getId());
        return new TokenResponseDto(accessToken);
    }

    public long getAccessTokenMaxAgeSeconds() {
        return jwtTokenProvider.getAccessTokenValidityInSeconds();
    }
}
