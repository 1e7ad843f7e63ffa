package com.jdc.recipe_api.domain.type;

import lombok.Getter;

@Getter
public enum Role {

    USER("ROLE_USER"),
    STAFF("ROLE_STAFF"),
    ADMIN("ROLE_ADMIN");

    private final String authority;

    Role(String authority) {
        this.authority = authority;
    }
}
