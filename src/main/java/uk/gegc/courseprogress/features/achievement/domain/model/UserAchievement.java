package uk.gegc.courseprogress.features.achievement.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "user_achievements",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_user_achievement",
                        columnNames = {"user_id", "achievement_id"}
                )
        }
)
public class UserAchievement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "achievement_id", nullable = false, updatable = false)
    private Achievement achievement;

    @Column(name = "earned_at", nullable = false, updatable = false)
    private Instant earnedAt;

    /**
     * Measured value of the trigger when the achievement was granted.
     */
    @Column(name = "progress_value", updatable = false)
    private Long progressValue;
}
