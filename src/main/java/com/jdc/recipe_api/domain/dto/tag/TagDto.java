package com.jdc.recipe_api.domain.dto.tag;

import lombok.*;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class TagDto {
    private Long id;
    private String name;
}
