package uk.gegc.courseprogress.features.points.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ledger entry. Rows are never updated or deleted.
 * <p>
 * The unique key on (user_id, reference_type, reference_id) is the idempotency key; rows
 * without a reference id are not constrained by it.
 */
@Entity
@Getter
@Setter
@Table(
        name = "points_history",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_points_history_user_reference",
                        columnNames = {"user_id", "reference_type", "reference_id"}
                )
        },
        indexes = {
                @Index(name = "ix_points_history_user_created", columnList = "user_id, created_at")
        }
)
public class PointsHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "points", nullable = false, updatable = false)
    private int points;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, updatable = false, length = 32)
    private PointsReason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "reference_type", updatable = false, length = 32)
    private PointsReferenceType referenceType;

    @Column(name = "reference_id", updatable = false)
    private UUID referenceId;

    @Column(name = "total_after", nullable = false, updatable = false)
    private long totalAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
