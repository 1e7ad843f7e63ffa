package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.AbstractApiTest;
import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeTag;
import com.jdc.recipe_api.domain.entity.Tag;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.RecipeRepository;
import com.jdc.recipe_api.domain.repository.RecipeTagRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TagApiTest extends AbstractApiTest {

    @Autowired RecipeRepository recipeRepository;
    @Autowired RecipeTagRepository recipeTagRepository;

    private User user;

    @BeforeEach
    void setUp() {
        user = createUser("user@example.com");
    }

    @Test
    @DisplayName("인증 없이 태그 API 를 호출하면 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get("/api/recipe/tags")).andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/recipe/tags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Vegan"))))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/api/recipe/tags/1")).andExpect(status().isUnauthorized());

        assertThat(tagRepository.countByUserId(user.getId())).isZero();
    }

    @Test
    @DisplayName("태그 목록은 이름 내림차순이며 다른 사용자의 태그는 보이지 않는다")
    void listTags_ownedOnly_nameDesc() throws Exception {
        User other = createUser("other@example.com");
        createTag(user, "Dessert");
        createTag(user, "Vegan");
        createTag(other, "Fruity");

        mockMvc.perform(get("/api/recipe/tags").with(auth(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("Vegan"))
                .andExpect(jsonPath("$[1].name").value("Dessert"));
    }

    @Test
    @DisplayName("태그 생성: 소유자는 요청자로 지정되고 body 의 user 는 무시된다")
    void createTag_stampsOwner() throws Exception {
        User other = createUser("other@example.com");

        mockMvc.perform(post("/api/recipe/tags").with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Breakfast", "user", other.getId()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.name").value("Breakfast"));

        assertThat(tagRepository.countByUserId(user.getId())).isEqualTo(1);
        assertThat(tagRepository.countByUserId(other.getId())).isZero();
    }

    @Test
    @DisplayName("빈 이름으로 생성하면 400, 태그 수는 그대로")
    void createTag_blankName() throws Exception {
        mockMvc.perform(post("/api/recipe/tags").with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", ""))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").exists());

        assertThat(tagRepository.countByUserId(user.getId())).isZero();
    }

    @Test
    @DisplayName("PATCH 로 태그 이름을 바꾼다")
    void patchTag() throws Exception {
        Tag tag = createTag(user, "After Dinner");

        mockMvc.perform(patch("/api/recipe/tags/" + tag.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "New Tag Name"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("New Tag Name"));

        em.flush();
        em.clear();
        assertThat(tagRepository.findById(tag.getId()).orElseThrow().getName()).isEqualTo("New Tag Name");
    }

    @Test
    @DisplayName("다른 사용자의 태그는 조회, 수정, 삭제 모두 404")
    void otherUsersTag_notFound() throws Exception {
        User other = createUser("other@example.com");
        Tag foreign = createTag(other, "Comfort Food");

        mockMvc.perform(get("/api/recipe/tags/" + foreign.getId()).with(auth(user)))
                .andExpect(status().isNotFound());
        mockMvc.perform(put("/api/recipe/tags/" + foreign.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Hijacked"))))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete("/api/recipe/tags/" + foreign.getId()).with(auth(user)))
                .andExpect(status().isNotFound());

        assertThat(tagRepository.findById(foreign.getId())).isPresent();
    }

    @Test
    @DisplayName("태그를 삭제해도 연결된 레시피는 남는다")
    void deleteTag_keepsRecipe() throws Exception {
        Tag tag = createTag(user, "Breakfast");
        Recipe recipe = recipeRepository.save(Recipe.builder()
                .user(user).title("Pancakes").timeMinutes(10).cost(new BigDecimal("3.00")).build());
        recipeTagRepository.save(RecipeTag.builder().recipe(recipe).tag(tag).build());

        mockMvc.perform(delete("/api/recipe/tags/" + tag.getId()).with(auth(user)))
                .andExpect(status().isNoContent());

        em.flush();
        em.clear();
        assertThat(tagRepository.findById(tag.getId())).isEmpty();
        assertThat(recipeRepository.findById(recipe.getId())).isPresent();
        assertThat(recipeTagRepository.findByRecipeIdOrderByIdAsc(recipe.getId())).isEmpty();
    }
}
