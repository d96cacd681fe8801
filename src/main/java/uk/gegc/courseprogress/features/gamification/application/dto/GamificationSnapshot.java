package uk.gegc.courseprogress.features.gamification.application.dto;

import java.time.LocalDate;
import java.util.UUID;

public record GamificationSnapshot(
        UUID userId,
        long totalPoints,
        int level,
        long pointsToNextLevel,
        int currentStreak,
        int longestStreak,
        LocalDate lastActivityDate,
        boolean graceAvailable,
        int daysUntilGraceAvailable,
        long achievementsEarned,
        long achievementsAvailable
) {}
