package com.jdc.recipe_api.service;

import com.jdc.recipe_api.domain.dto.tag.TagDto;
import com.jdc.recipe_api.domain.dto.tag.TagRequestDto;
import com.jdc.recipe_api.domain.entity.Tag;
import com.jdc.recipe_api.domain.entity.User;
import com.jdc.recipe_api.domain.repository.RecipeTagRepository;
import com.jdc.recipe_api.domain.repository.TagRepository;
import com.jdc.recipe_api.domain.repository.UserRepository;
import com.jdc.recipe_api.exception.CustomException;
import com.jdc.recipe_api.exception.ErrorCode;
import com.jdc.recipe_api.mapper.TagMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class TagService {

    private final TagRepository tagRepository;
    private final RecipeTagRepository recipeTagRepository;
    private final UserRepository userRepository;

    /** 내 태그 목록 (이름 내림차순) */
    @Transactional(readOnly = true)
    public List<TagDto> getTags(Long userId) {
        return TagMapper.toDtoList(tagRepository.findAllByUserIdOrderByNameDescIdDesc(userId));
    }

    public TagDto createTag(Long userId, TagRequestDto dto) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        Tag tag = tagRepository.save(TagMapper.toEntity(dto, user));
        log.info("태그 생성: userId={}, tagId={}", userId, tag.getId());
        return TagMapper.toDto(tag);
    }

    @Transactional(readOnly = true)
    public TagDto getTag(Long userId, Long tagId) {
        return TagMapper.toDto(getOwnedTagOrThrow(userId, tagId));
    }

    public TagDto updateTag(Long userId, Long tagId, TagRequestDto dto) {
        Tag tag = getOwnedTagOrThrow(userId, tagId);
        tag.rename(dto.getName().trim());
        return TagMapper.toDto(tag);
    }

    // 레시피와의 연결만 끊고 레시피는 남긴다
    public void deleteTag(Long userId, Long tagId) {
        Tag tag = getOwnedTagOrThrow(userId, tagId);
        recipeTagRepository.deleteByTagId(tag.getId());
        tagRepository.delete(tag);
        log.info("태그 삭제: userId={}, tagId={}", userId, tagId);
    }

    // 다른 사용자의 태그는 존재하지 않는 것과 동일하게 처리한다
    private Tag getOwnedTagOrThrow(Long userId, Long tagId) {
        return tagRepository.findByIdAndUserId(tagId, userId)
                .orElseThrow(() -> new CustomException(ErrorCode.TAG_NOT_FOUND));
    }
}
