package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.user.UserCreateRequestDto;
import com.jdc.recipe_api.domain.dto.user.UserPatchDto;
import com.jdc.recipe_api.domain.dto.user.UserResponseDto;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.UserRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    private volatile String dummyPasswordHash;

    public User createUser(String email, String password) {
        return createUser(email, password, null, false);
    }

    public User createSuperuser(String email, String password) {
        return createUser(email, password, null, true);
    }

    // 회원가입 (공개 API)
    public UserResponseDto register(UserCreateRequestDto dto) {
        User user = createUser(dto.getEmail(), dto.getPassword(), dto.getName(), false);
        return UserMapper.toDto(user);
    }

    /**
     * 이메일/비밀번호로 사용자를 확인한다.
     * 이메일이 없는 경우와 비밀번호가 틀린 경우를 구분하지 않는다.
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String password) {
        if (email == null || email.isBlank() || password == null) {
            throw new CustomException(ErrorCode.INVALID_CREDENTIALS);
        }

        Optional<User> found = userRepository.findByEmail(normalizeEmail(email))
                .filter(User::isActive);
        if (found.isEmpty()) {
            // 없는 계정도 해시 비교를 한 번 수행해 응답 시간을 맞춘다
            passwordEncoder.matches(password, dummyPasswordHash());
            throw new CustomException(ErrorCode.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!passwordEncoder.matches(password, user.getPassword())) {
            throw new CustomException(ErrorCode.INVALID_CREDENTIALS);
        }
        return user;
    }

    @Transactional(readOnly = true)
    public UserResponseDto getMe(Long userId) {
        return UserMapper.toDto(getUserOrThrow(userId));
    }

    // 내 정보 부분 수정 (이름, 비밀번호)
    public UserResponseDto updateMe(Long userId, UserPatchDto dto) {
        User user = getUserOrThrow(userId);

        if (dto.getPassword() != null) {
            user.changePassword(passwordEncoder.encode(dto.getPassword()));
        }
        user.updateProfile(dto.getName());

        log.info("사용자 정보 수정: userId={}", userId);
        return UserMapper.toDto(user);
    }

    // 태그, 재료, 레시피는 DB 의 ON DELETE CASCADE 로 함께 삭제된다
    public void deleteUser(Long userId) {
        User user = getUserOrThrow(userId);
        userRepository.delete(user);
        log.info("사용자 삭제: userId={}", userId);
    }

    @Transactional(readOnly = true)
    public User getUserOrThrow(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));
    }

    /** 이메일 전체를 소문자로 정규화한다. 비어 있으면 null. */
    public static String normalizeEmail(String email) {
        if (email == null || email.isBlank()) {
            return null;
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private User createUser(String email, String password, String name, boolean superuser) {
        String normalized = normalizeEmail(email);
        if (normalized == null) {
            throw CustomException.onField(ErrorCode.MISSING_EMAIL, "email");
        }
        if (password == null) {
            throw CustomException.onField(ErrorCode.INVALID_PASSWORD, "password");
        }

        if (userRepository.existsByEmail(normalized)) {
            throw CustomException.onField(ErrorCode.DUPLICATE_EMAIL, "email");
        }

        User user = User.builder()
                .email(normalized)
                .password(passwordEncoder.encode(password))
                .name(name)
                .build();
        if (superuser) {
            user.grantSuperuser();
        }

        userRepository.save(user);
        log.info("사용자 생성: userId={}, superuser={}", user.getId(), superuser);
        return user;
    }

    private String dummyPasswordHash() {
        String hash = dummyPasswordHash;
        if (hash == null) {
            hash = passwordEncoder.encode(UUID.randomUUID().toString());
            dummyPasswordHash = hash;
        }
        return hash;
    }
}
