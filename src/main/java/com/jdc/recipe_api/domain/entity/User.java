package com.jdc.recipe_api.domain.entity;

import com.jdc.recipe_api.domain.entity.common.BaseTimeEntity;
import com.jdc.recipe_api.domain.type.Role;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"email"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class User extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 항상 소문자로 정규화된 값
    @Column(nullable = false, length = 255)
    private String email;

    @Column(nullable = false)
    private String password;

    @Column(length = 255)
    private String name;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "is_staff", nullable = false)
    @Builder.Default
    private boolean staff = false;

    @Column(name = "is_superuser", nullable = false)
    @Builder.Default
    private boolean superuser = false;

    public List<Role> getRoles() {
        List<Role> roles = new ArrayList<>();
        roles.add(Role.USER);
        if (staff) roles.add(Role.STAFF);
        if (superuser) roles.add(Role.ADMIN);
        return roles;
    }

    public void updateProfile(String name) {
        if (name != null) this.name = name;
    }

    public void changePassword(String encodedPassword) {
        if (encodedPassword != null && !encodedPassword.isBlank()) {
            this.password = encodedPassword;
        }
    }

    public void grantSuperuser() {
        this.staff = true;
        this.superuser = true;
    }
}
