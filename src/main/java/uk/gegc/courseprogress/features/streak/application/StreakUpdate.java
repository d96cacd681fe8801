package uk.gegc.courseprogress.features.streak.application;

import java.time.Instant;
import java.time.LocalDate;

public record StreakUpdate(
        StreakTransition transition,
        int currentStreak,
        int longestStreak,
        LocalDate lastActivityDate,
        Instant gracePeriodUsedAt
) {}
