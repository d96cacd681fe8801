package uk.gegc.courseprogress.features.progress.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "lesson_progress",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uq_lesson_progress_user_lesson",
                        columnNames = {"user_id", "lesson_id"}
                )
        },
        indexes = {
                @Index(name = "ix_lesson_progress_user", columnList = "user_id")
        }
)
public class LessonProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "lesson_id", nullable = false, updatable = false)
    private UUID lessonId;

    @Column(name = "watched_seconds", nullable = false)
    private int watchedSeconds;

    @Column(name = "last_position_seconds", nullable = false)
    private int lastPositionSeconds;

    @Column(name = "completion_percentage", nullable = false)
    private int completionPercentage;

    @Setter(AccessLevel.NONE)
    @Column(name = "is_completed", nullable = false)
    private boolean completed;

    @Setter(AccessLevel.NONE)
    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * One-way completion transition. Once set, neither the flag nor the timestamp changes again.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean markCompleted(Instant at) {
        if (completed) {
            return false;
        }
        this.completed = true;
        this.completedAt = at;
        return true;
    }
}
