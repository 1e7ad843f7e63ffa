package com.jdc.recipe_api.domain.entity;

import com.jdc.recipe_api.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;

@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_recipe_user_id", columnList = "user_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Column(nullable = false, length = 255)
    private String title;

    @Column(name = "time_minutes", nullable = false)
    private Integer timeMinutes;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal cost;

    @Column(length = 255)
    private String link;

    public void updateTitle(String title) {
        this.title = title;
    }

    public void updateTimeMinutes(Integer timeMinutes) {
        this.timeMinutes = timeMinutes;
    }

    public void updateCost(BigDecimal cost) {
        this.cost = cost;
    }

    public void updateLink(String link) {
        this.link = link;
    }

    public boolean isOwnedBy(Long userId) {
        return user != null && user.getId().equals(userId);
    }

    @Override
    public String toString() {
        return title;
    }
}
