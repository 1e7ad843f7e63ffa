package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.user.UserPatchDto;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.UserRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder();

    private UserService userService;

    @BeforeEach
    void setUp() {
        userService = new UserService(userRepository, passwordEncoder);
    }

    @Test
    @DisplayName("이메일은 전체가 소문자로 정규화되어 저장된다")
    void createUser_normalizesEmail() {
        String[][] samples = {
                {"test1@EXAMPLE.com", "test1@example.com"},
                {"Test2@Example.com", "test2@example.com"},
                {"TEST3@EXAMPLE.COM", "test3@example.com"},
                {"test4@example.COM", "test4@example.com"},
        };

        for (String[] sample : samples) {
            User user = userService.createUser(sample[0], "sample123");
            assertThat(user.getEmail()).isEqualTo(sample[1]);
        }
        verify(userRepository, times(samples.length)).save(any(User.class));
    }

    @Test
    @DisplayName("이메일이 비어 있으면 email 필드 오류로 거부한다")
    void createUser_blankEmail_rejected() {
        for (String email : new String[]{null, "", "   "}) {
            assertThatThrownBy(() -> userService.createUser(email, "test123"))
                    .isInstanceOf(CustomException.class)
                    .satisfies(ex -> {
                        CustomException ce = (CustomException) ex;
                        assertThat(ce.getErrorCode()).isEqualTo(ErrorCode.MISSING_EMAIL);
                        assertThat(ce.getFieldErrors()).containsKey("email");
                    });
        }
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("대소문자만 다른 이메일도 중복으로 본다")
    void createUser_duplicateIgnoringCase() {
        when(userRepository.existsByEmail("test@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.createUser("Test@Example.com", "test123"))
                .isInstanceOf(CustomException.class)
                .extracting(ex -> ((CustomException) ex).getErrorCode())
                .isEqualTo(ErrorCode.DUPLICATE_EMAIL);
    }

    @Test
    @DisplayName("비밀번호는 해시로 저장되고 인코더로 검증된다")
    void createUser_hashesPassword() {
        User user = userService.createUser("test@example.com", "testpass123");

        assertThat(user.getPassword()).isNotEqualTo("testpass123");
        assertThat(passwordEncoder.matches("testpass123", user.getPassword())).isTrue();
        assertThat(user.isStaff()).isFalse();
        assertThat(user.isSuperuser()).isFalse();
    }

    @Test
    @DisplayName("길이 제한은 API 요청에서만 검사하며 짧은 비밀번호로도 슈퍼유저를 만들 수 있다")
    void createSuperuser_shortPassword_allowed() {
        User user = userService.createSuperuser("admin@test.com", "pw");

        assertThat(user.isStaff()).isTrue();
        assertThat(user.isSuperuser()).isTrue();
        assertThat(passwordEncoder.matches("pw", user.getPassword())).isTrue();
    }

    @Test
    @DisplayName("비밀번호가 null 이면 password 필드 오류로 거부한다")
    void createUser_nullPassword_rejected() {
        assertThatThrownBy(() -> userService.createUser("test@example.com", null))
                .isInstanceOf(CustomException.class)
                .extracting(ex -> ((CustomException) ex).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PASSWORD);
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("슈퍼유저는 staff, superuser 플래그가 모두 켜진다")
    void createSuperuser_setsFlags() {
        User user = userService.createSuperuser("admin@example.com", "test123");

        assertThat(user.isStaff()).isTrue();
        assertThat(user.isSuperuser()).isTrue();
    }

    @Test
    @DisplayName("비밀번호가 틀리면 어떤 부분이 틀렸는지 알리지 않고 거부한다")
    void authenticate_wrongPassword() {
        User user = User.builder()
                .id(1L)
                .email("test@example.com")
                .password(passwordEncoder.encode("right-pass"))
                .build();
        when(userRepository.findByEmail("test@example.com")).thenReturn(Optional.of(user));

        assertThatThrownBy(() -> userService.authenticate("TEST@example.com", "wrong-pass"))
                .isInstanceOf(CustomException.class)
                .extracting(ex -> ((CustomException) ex).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_CREDENTIALS);

        assertThat(userService.authenticate("test@example.com", "right-pass")).isSameAs(user);
    }

    @Test
    @DisplayName("없는 이메일로 로그인해도 해시 비교를 수행한 뒤 같은 오류로 거부한다")
    void authenticate_unknownEmail_stillMatchesHash() {
        PasswordEncoder encoder = mock(PasswordEncoder.class);
        when(encoder.encode(anyString())).thenReturn("$2a$10$dummy");
        UserService service = new UserService(userRepository, encoder);
        when(userRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.authenticate("nobody@example.com", "some-pass"))
                .isInstanceOf(CustomException.class)
                .extracting(ex -> ((CustomException) ex).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_CREDENTIALS);

        verify(encoder).matches("some-pass", "$2a$10$dummy");
    }

    @Test
    @DisplayName("내 정보 수정: 보낸 값만 바뀐다")
    void updateMe_partial() {
        User user = User.builder()
                .id(1L)
                .email("test@example.com")
                .password(passwordEncoder.encode("old-pass"))
                .name("이전 이름")
                .build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));

        userService.updateMe(1L, UserPatchDto.builder().password("new-pass").build());

        assertThat(user.getName()).isEqualTo("이전 이름");
        assertThat(passwordEncoder.matches("new-pass", user.getPassword())).isTrue();
    }
}
