package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.AbstractApiTest;
import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeTag;
import com.jdc.recipe_api.domain.entity.Tag;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.RecipeRepository;
import com.jdc.recipe_api.domain.repository.RecipeTagRepository;
import com.jdc.recipe_api.domain.repository.UserRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class UserApiTest extends AbstractApiTest {

    @Autowired UserRepository userRepository;
    @Autowired RecipeRepository recipeRepository;
    @Autowired RecipeTagRepository recipeTagRepository;

    @Test
    @DisplayName("회원가입: 이메일은 소문자로 저장되고 비밀번호는 응답에 포함되지 않는다")
    void createUser() throws Exception {
        mockMvc.perform(post("/api/user/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "New@Example.com", "password", "testpass123", "name", "Test Name"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.email").value("new@example.com"))
                .andExpect(jsonPath("$.name").value("Test Name"))
                .andExpect(jsonPath("$.password").doesNotExist());

        assertThat(userRepository.existsByEmail("new@example.com")).isTrue();
    }

    @Test
    @DisplayName("회원가입: 대소문자만 다른 이메일은 409")
    void createUser_duplicate() throws Exception {
        createUser("test@example.com");

        mockMvc.perform(post("/api/user/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "TEST@example.com", "password", "testpass123"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("102"));
    }

    @Test
    @DisplayName("회원가입: 이메일이 비어 있으면 400, 사용자는 생성되지 않는다")
    void createUser_blankEmail() throws Exception {
        long before = userRepository.count();

        mockMvc.perform(post("/api/user/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "", "password", "testpass123"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.email").exists());

        assertThat(userRepository.count()).isEqualTo(before);
    }

    @Test
    @DisplayName("회원가입: 5자 미만 비밀번호는 400, 사용자는 생성되지 않는다")
    void createUser_shortPassword() throws Exception {
        mockMvc.perform(post("/api/user/create")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "short@example.com", "password", "pw"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.password").exists());

        assertThat(userRepository.existsByEmail("short@example.com")).isFalse();
    }

    @Test
    @DisplayName("토큰 발급: 본문 토큰과 accessToken 쿠키를 함께 준다")
    void createToken() throws Exception {
        createUser("test@example.com");

        mockMvc.perform(post("/api/user/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "Test@Example.com", "password", "testpass123"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token").isNotEmpty())
                .andExpect(header().string("Set-Cookie", containsString("accessToken=")))
                .andExpect(header().string("Set-Cookie", containsString("HttpOnly")));
    }

    @Test
    @DisplayName("토큰 발급: 잘못된 비밀번호는 401, 토큰 없음")
    void createToken_badCredentials() throws Exception {
        createUser("test@example.com");

        mockMvc.perform(post("/api/user/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "test@example.com", "password", "wrong"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.token").doesNotExist());
    }

    @Test
    @DisplayName("발급받은 토큰을 쿠키로 보내도 인증된다")
    void me_withCookie() throws Exception {
        User user = createUser("test@example.com");
        String token = jwtTokenProvider.createAccessToken(user);

        mockMvc.perform(get("/api/user/me").cookie(new jakarta.servlet.http.Cookie("accessToken", token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("test@example.com"));
    }

    @Test
    @DisplayName("인증 없이 내 정보 조회는 401")
    void me_unauthenticated() throws Exception {
        mockMvc.perform(get("/api/user/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").exists());
    }

    @Test
    @DisplayName("잘못된 토큰은 401")
    void me_invalidToken() throws Exception {
        mockMvc.perform(get("/api/user/me").header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("회원 탈퇴 시 레시피, 태그, 연결이 DB Cascade 로 함께 삭제된다")
    void deleteMe_cascades() throws Exception {
        User target = createUser("target@example.com");
        User other = createUser("other@example.com");

        Tag tag = createTag(target, "Vegan");
        Recipe recipe = recipeRepository.save(Recipe.builder()
                .user(target).title("삭제될 레시피").timeMinutes(5).cost(new BigDecimal("1.00")).build());
        RecipeTag link = recipeTagRepository.save(RecipeTag.builder().recipe(recipe).tag(tag).build());
        Tag otherTag = createTag(other, "Dessert");

        em.flush();
        em.clear();

        mockMvc.perform(delete("/api/user/me").with(auth(target)))
                .andExpect(status().isNoContent());

        em.flush();
        em.clear();

        assertThat(userRepository.findById(target.getId())).isEmpty();
        assertThat(recipeRepository.findById(recipe.getId())).isEmpty();
        assertThat(tagRepository.findById(tag.getId())).isEmpty();
        assertThat(recipeTagRepository.findById(link.getId())).isEmpty();
        assertThat(tagRepository.findById(otherTag.getId())).isPresent();
    }
}
