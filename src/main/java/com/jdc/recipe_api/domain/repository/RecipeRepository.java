package com.jdc.recipe_api.domain.repository;

import com.jdc.recipe_api.domain.entity.Recipe;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long> {

    List<Recipe> findAllByUserIdOrderByIdDesc(Long userId);

    Optional<Recipe> findByIdAndUserId(Long id, Long userId);

    long countByUserId(Long userId);
}
