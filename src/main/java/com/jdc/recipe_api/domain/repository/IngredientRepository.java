package com.jdc.recipe_api.domain.repository;

import com.jdc.recipe_api.domain.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    List<Ingredient> findAllByUserIdOrderByNameDescIdDesc(Long userId);

    Optional<Ingredient> findByIdAndUserId(Long id, Long userId);

    List<Ingredient> findAllByIdInAndUserId(Collection<Long> ids, Long userId);

    long countByUserId(Long userId);
}
