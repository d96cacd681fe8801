package uk.gegc.courseprogress.features.achievement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Catalog entry: one declarative rule. Unlocks once {@code triggerType} measures at least
 * {@code threshold}. Rules are evaluated in ({@code sortOrder}, {@code code}) order.
 */
@Entity
@Getter
@Setter
@Table(name = "achievements", uniqueConstraints = {
        @UniqueConstraint(name = "uq_achievements_code", columnNames = "code")
})
public class Achievement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", length = 1000)
    private String description;

    @Column(name = "icon", length = 64)
    private String icon;

    @Column(name = "category", length = 32)
    private String category;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false, length = 32)
    private AchievementTrigger triggerType;

    @Column(name = "threshold", nullable = false)
    private long threshold;

    @Column(name = "points_reward", nullable = false)
    private int pointsReward;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
