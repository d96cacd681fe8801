package uk.gegc.courseprogress.features.progress.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgressState;
import uk.gegc.courseprogress.shared.exception.InsufficientProgressException;

import java.time.Clock;
import java.time.Instant;

/**
 * Decides lesson completion transitions.
 * <p>
 * A transition fires iff the previous state was not completed and the new percentage is at or
 * above the configured threshold. The decision and the write happen on the managed row inside the
 * same transaction as the upsert; the row's version column rejects a concurrent second writer.
 */
@Component
@RequiredArgsConstructor
public class CompletionEvaluator {

    private final GamificationProperties properties;
    private final Clock clock;

    public boolean isTransition(LessonProgressState previous, LessonProgress current) {
        return !previous.completed()
                && !current.isCompleted()
                && current.getCompletionPercentage() >= properties.getCompletionThreshold();
    }

    /**
     * Applies an implicit threshold transition.
     *
     * @return {@code true} if the lesson became completed by this update
     */
    public boolean evaluate(ProgressChange change) {
        if (!isTransition(change.previous(), change.current())) {
            return false;
        }
        return change.current().markCompleted(Instant.now(clock));
    }

    /**
     * Applies an explicit "mark complete" request.
     *
     * @return {@code true} if the lesson became completed, {@code false} if it already was
     * @throws InsufficientProgressException if the current percentage is below the threshold
     */
    public boolean completeExplicitly(LessonProgress current) {
        if (current.isCompleted()) {
            return false;
        }
        int threshold = properties.getCompletionThreshold();
        if (current.getCompletionPercentage() < threshold) {
            throw new InsufficientProgressException(current.getLessonId(), current.getCompletionPercentage(), threshold);
        }
        return current.markCompleted(Instant.now(clock));
    }

    public int threshold() {
        return properties.getCompletionThreshold();
    }
}
