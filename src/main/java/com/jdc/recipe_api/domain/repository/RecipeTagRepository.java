package com.jdc.recipe_api.domain.repository;

import com.jdc.recipe_api.domain.entity.RecipeTag;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecipeTagRepository extends JpaRepository<RecipeTag, Long> {

    @EntityGraph(attributePaths = {"tag"})
    List<RecipeTag> findByRecipeIdOrderByIdAsc(Long recipeId);

    @EntityGraph(attributePaths = {"tag"})
    List<RecipeTag> findByRecipeIdInOrderByIdAsc(Collection<Long> recipeIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeTag rt WHERE rt.recipe.id = :recipeId")
    void deleteByRecipeId(@Param("recipeId") Long recipeId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM RecipeTag rt WHERE rt.tag.id = :tagId")
    void deleteByTagId(@Param("tagId") Long tagId);
}
