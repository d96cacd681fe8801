package uk.gegc.courseprogress.features.progress.domain.model;

import java.time.Instant;

/**
 * Immutable copy of a progress row taken before it is mutated.
 */
public record LessonProgressState(
        int watchedSeconds,
        int lastPositionSeconds,
        int completionPercentage,
        boolean completed,
        Instant completedAt
) {

    public static LessonProgressState absent() {
        return new LessonProgressState(0, 0, 0, false, null);
    }

    public static LessonProgressState of(LessonProgress progress) {
        return new LessonProgressState(
                progress.getWatchedSeconds(),
                progress.getLastPositionSeconds(),
                progress.getCompletionPercentage(),
                progress.isCompleted(),
                progress.getCompletedAt()
        );
    }
}
