package uk.gegc.courseprogress.features.achievement.domain.model;

import uk.gegc.courseprogress.features.achievement.application.ProgressAggregates;

import java.util.function.ToLongFunction;

/**
 * Kind of measure an achievement's threshold is compared against.
 */
public enum AchievementTrigger {
    STREAK_LENGTH(ProgressAggregates::currentStreak),
    LESSON_COUNT(ProgressAggregates::completedLessons),
    WATCH_TIME_TOTAL(ProgressAggregates::totalWatchSeconds),
    COURSE_COUNT(ProgressAggregates::completedCourses);

    private final ToLongFunction<ProgressAggregates> measure;

    AchievementTrigger(ToLongFunction<ProgressAggregates> measure) {
        this.measure = measure;
    }

    public long measure(ProgressAggregates aggregates) {
        return measure.applyAsLong(aggregates);
    }
}
