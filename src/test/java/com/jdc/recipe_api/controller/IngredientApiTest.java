package com.jdc.recipe_api.controller;

import com.jdc.recipe_api.AbstractApiTest;
import com.jdc.recipe_api.domain.entity.Ingredient;
import com.jdc.recipe_api.domain.entity.Recipe;
import com.jdc.recipe_api.domain.entity.RecipeIngredient;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.RecipeIngredientRepository;
import com.jdc.recipe_api.domain.repository.RecipeRepository;
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

class IngredientApiTest extends AbstractApiTest {

    private static final String INGREDIENTS_URL = "/api/recipe/ingredients";

    @Autowired RecipeRepository recipeRepository;
    @Autowired RecipeIngredientRepository recipeIngredientRepository;

    private User user;

    @BeforeEach
    void setUp() {
        user = createUser("user@example.com");
    }

    @Test
    @DisplayName("인증 없이 재료 API 를 호출하면 401")
    void unauthenticated() throws Exception {
        mockMvc.perform(get(INGREDIENTS_URL)).andExpect(status().isUnauthorized());
        mockMvc.perform(post(INGREDIENTS_URL)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Kale"))))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(put(INGREDIENTS_URL + "/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Kale"))))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(delete(INGREDIENTS_URL + "/1")).andExpect(status().isUnauthorized());

        assertThat(ingredientRepository.countByUserId(user.getId())).isZero();
    }

    @Test
    @DisplayName("재료 목록은 이름 내림차순이며 내 재료만 보인다")
    void listIngredients_ownedOnly_nameDesc() throws Exception {
        User other = createUser("other@example.com");
        createIngredient(user, "Kale");
        createIngredient(user, "Salt");
        createIngredient(other, "Pepper");

        mockMvc.perform(get(INGREDIENTS_URL).with(auth(user)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].name").value("Salt"))
                .andExpect(jsonPath("$[1].name").value("Kale"));
    }

    @Test
    @DisplayName("재료 생성: 201 과 함께 소유자는 요청자로 지정된다")
    void createIngredient_success() throws Exception {
        User other = createUser("other@example.com");

        mockMvc.perform(post(INGREDIENTS_URL).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Cabbage", "user", other.getId()))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").isNumber())
                .andExpect(jsonPath("$.name").value("Cabbage"));

        assertThat(ingredientRepository.findAllByUserIdOrderByNameDescIdDesc(user.getId()))
                .extracting(Ingredient::getName)
                .containsExactly("Cabbage");
        assertThat(ingredientRepository.countByUserId(other.getId())).isZero();
    }

    @Test
    @DisplayName("빈 이름으로 생성하면 400, 재료 수는 그대로")
    void createIngredient_blankName() throws Exception {
        mockMvc.perform(post(INGREDIENTS_URL).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "   "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors.name").exists());

        assertThat(ingredientRepository.countByUserId(user.getId())).isZero();
    }

    @Test
    @DisplayName("PATCH 와 PUT 으로 재료 이름을 바꾼다")
    void updateIngredient() throws Exception {
        Ingredient ingredient = createIngredient(user, "Cilantro");

        mockMvc.perform(patch(INGREDIENTS_URL + "/" + ingredient.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Coriander"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Coriander"));

        mockMvc.perform(put(INGREDIENTS_URL + "/" + ingredient.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Parsley"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(ingredient.getId()))
                .andExpect(jsonPath("$.name").value("Parsley"));

        em.flush();
        em.clear();
        assertThat(ingredientRepository.findById(ingredient.getId()).orElseThrow().getName()).isEqualTo("Parsley");
    }

    @Test
    @DisplayName("다른 사용자의 재료는 조회, 수정, 삭제 모두 404")
    void otherUsersIngredient_notFound() throws Exception {
        User other = createUser("other@example.com");
        Ingredient foreign = createIngredient(other, "Pepper");

        mockMvc.perform(get(INGREDIENTS_URL + "/" + foreign.getId()).with(auth(user)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("401"));
        mockMvc.perform(patch(INGREDIENTS_URL + "/" + foreign.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Hijacked"))))
                .andExpect(status().isNotFound());
        mockMvc.perform(put(INGREDIENTS_URL + "/" + foreign.getId()).with(auth(user))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("name", "Hijacked"))))
                .andExpect(status().isNotFound());
        mockMvc.perform(delete(INGREDIENTS_URL + "/" + foreign.getId()).with(auth(user)))
                .andExpect(status().isNotFound());

        em.flush();
        em.clear();
        assertThat(ingredientRepository.findById(foreign.getId()).orElseThrow().getName()).isEqualTo("Pepper");
    }

    @Test
    @DisplayName("재료를 삭제해도 연결된 레시피는 남는다")
    void deleteIngredient_keepsRecipe() throws Exception {
        Ingredient ingredient = createIngredient(user, "Flour");
        Recipe recipe = recipeRepository.save(Recipe.builder()
                .user(user).title("Pancakes").timeMinutes(10).cost(new BigDecimal("3.00")).build());
        recipeIngredientRepository.save(RecipeIngredient.builder().recipe(recipe).ingredient(ingredient).build());

        mockMvc.perform(delete(INGREDIENTS_URL + "/" + ingredient.getId()).with(auth(user)))
                .andExpect(status().isNoContent());

        em.flush();
        em.clear();
        assertThat(ingredientRepository.findById(ingredient.getId())).isEmpty();
        assertThat(recipeRepository.findById(recipe.getId())).isPresent();
        assertThat(recipeIngredientRepository.findByRecipeIdOrderByIdAsc(recipe.getId())).isEmpty();
    }
}
