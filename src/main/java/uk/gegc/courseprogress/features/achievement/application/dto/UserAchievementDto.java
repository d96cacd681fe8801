package uk.gegc.courseprogress.features.achievement.application.dto;

import java.time.Instant;
import java.util.UUID;

public record UserAchievementDto(
        UUID id,
        UUID userId,
        Instant earnedAt,
        Long progressValue,
        AchievementDto achievement
) {}
