package uk.gegc.courseprogress.features.gamification.domain.event;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per (user, course) when the last lesson of the course is completed.
 * <p>
 * Listeners such as certificate issuance should use
 * {@code @TransactionalEventListener(phase = AFTER_COMMIT)} so they only see committed progress.
 * Guarding against duplicate issuance stays with the listener.
 * </p>
 */
public class CourseCompletedEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID courseId;
    private final Instant completedAt;

    public CourseCompletedEvent(Object source, UUID userId, UUID courseId, Instant completedAt) {
        super(source);
        this.userId = userId;
        this.courseId = courseId;
        this.completedAt = completedAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getCourseId() {
        return courseId;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
