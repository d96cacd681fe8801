package uk.gegc.courseprogress.shared.exception;

import java.util.UUID;

/**
 * Explicit completion was requested below the completion threshold.
 * User-correctable; never retried automatically.
 */
public class InsufficientProgressException extends RuntimeException {

    private final UUID lessonId;
    private final int currentPercentage;
    private final int requiredPercentage;

    public InsufficientProgressException(UUID lessonId, int currentPercentage, int requiredPercentage) {
        super("Lesson " + lessonId + " is at " + currentPercentage
                + "% but at least " + requiredPercentage + "% is required to mark it complete");
        this.lessonId = lessonId;
        this.currentPercentage = currentPercentage;
        this.requiredPercentage = requiredPercentage;
    }

    public UUID getLessonId() {
        return lessonId;
    }

    public int getCurrentPercentage() {
        return currentPercentage;
    }

    public int getRequiredPercentage() {
        return requiredPercentage;
    }
}
