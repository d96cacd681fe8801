package uk.gegc.courseprogress.features.progress.application;

import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable per-(user, lesson) progress records.
 * <p>
 * Lesson existence is checked by the caller against the catalog; the store only touches the
 * single progress row. Must be called inside the activity unit of work.
 */
public interface ProgressStore {

    /**
     * Upserts the progress row, clamping the percentage to [0, 100]. The completion flag is left
     * untouched; deciding a transition is the completion evaluator's job.
     */
    ProgressChange recordActivity(UUID userId, UUID lessonId, int watchedSeconds,
                                  int lastPositionSeconds, int completionPercentage);

    Optional<LessonProgress> find(UUID userId, UUID lessonId);

    LessonProgress save(LessonProgress progress);

    long countCompletedLessons(UUID userId);

    long totalWatchedSeconds(UUID userId);

    long countCompletedLessons(UUID userId, Collection<UUID> lessonIds);

    long totalWatchedSeconds(UUID userId, Collection<UUID> lessonIds);
}
