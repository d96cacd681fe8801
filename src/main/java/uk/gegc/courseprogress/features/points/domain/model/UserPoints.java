package uk.gegc.courseprogress.features.points.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Running total derived from the ledger. {@code totalPoints} always equals the sum of the
 * user's {@link PointsHistory} rows; {@code level} is a function of it.
 */
@Entity
@Table(name = "user_points", indexes = {
        @Index(name = "ix_user_points_total", columnList = "total_points")
})
@Getter
@Setter
public class UserPoints {

    @Id
    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "total_points", nullable = false)
    private long totalPoints;

    @Column(name = "level", nullable = false)
    private int level = 1;

    @Column(name = "points_to_next_level", nullable = false)
    private long pointsToNextLevel;

    @Column(name = "last_recomputed_at")
    private Instant lastRecomputedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
