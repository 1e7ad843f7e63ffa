package com.jdc.recipe_api.domain.repository;

import com.jdc.recipe_api.domain.entity.Tag;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TagRepository extends JpaRepository<Tag, Long> {

    List<Tag> findAllByUserIdOrderByNameDescIdDesc(Long userId);

    Optional<Tag> findByIdAndUserId(Long id, Long userId);

    List<Tag> findAllByIdInAndUserId(Collection<Long> ids, Long userId);

    long countByUserId(Long userId);
}
