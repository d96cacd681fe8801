package uk.gegc.courseprogress.features.achievement.application.dto;

import uk.gegc.courseprogress.features.achievement.domain.model.AchievementTrigger;

import java.util.UUID;

public record AchievementDto(
        UUID id,
        String code,
        String title,
        String description,
        String icon,
        String category,
        AchievementTrigger triggerType,
        long threshold,
        int pointsReward,
        boolean active
) {}
