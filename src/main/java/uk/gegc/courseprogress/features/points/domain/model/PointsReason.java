package uk.gegc.courseprogress.features.points.domain.model;

public enum PointsReason {
    LESSON_COMPLETED(true),
    COURSE_COMPLETED(false),
    ACHIEVEMENT_UNLOCKED(true),
    MANUAL_ADJUSTMENT(false);

    private final boolean exactlyOnce;

    PointsReason(boolean exactlyOnce) {
        this.exactlyOnce = exactlyOnce;
    }

    /**
     * Awards for this reason must carry a reference and are never appended twice for it.
     */
    public boolean isExactlyOnce() {
        return exactlyOnce;
    }
}
