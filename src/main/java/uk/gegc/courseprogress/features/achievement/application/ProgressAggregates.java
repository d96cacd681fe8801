package uk.gegc.courseprogress.features.achievement.application;

import java.util.UUID;

/**
 * Per-user totals the achievement rules are evaluated against, read after the current event's
 * writes.
 */
public record ProgressAggregates(
        UUID userId,
        int currentStreak,
        long completedLessons,
        long totalWatchSeconds,
        long completedCourses
) {}
