package com.jdc.recipe_api.mapper;

import com.jdc.recipe_api.domain.dto.user.UserResponseDto;
import com.jdc.recipe_api.domain.entity.User;

public class UserMapper {

    public static UserResponseDto toDto(User user) {
        if (user == null) return null;
        return UserResponseDto.builder()
                .email(user.getEmail())
                .name(user.getName())
                .build();
    }
}
