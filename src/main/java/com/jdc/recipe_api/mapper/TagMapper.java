package com.jdc.recipe_api.mapper;

import com.jdc.recipe_api.domain.dto.tag.TagDto;
import com.jdc.recipe_api.domain.dto.tag.TagRequestDto;
import com.jdc.recipe_api.domain.entity.RecipeTag;
import com.jdc.recipe_api.domain.entity.Tag;
import com.jdc.recipe_api.domain.entity.User;

import java.util.List;

public class TagMapper {

    public static Tag toEntity(TagRequestDto dto, User user) {
        return Tag.builder()
                .name(dto.getName().trim())
                .user(user)
                .build();
    }

    public static TagDto toDto(Tag tag) {
        return new TagDto(tag.getId(), tag.getName());
    }

    public static List<TagDto> toDtoList(List<Tag> tags) {
        return tags.stream().map(TagMapper::toDto).toList();
    }

    public static List<TagDto> fromRecipeTags(List<RecipeTag> recipeTags) {
        return recipeTags.stream().map(rt -> toDto(rt.getTag())).toList();
    }
}
