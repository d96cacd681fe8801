package uk.gegc.courseprogress.features.progress.application.dto;

import java.time.Instant;
import java.util.UUID;

public record LessonProgressDto(
        UUID userId,
        UUID lessonId,
        int watchedSeconds,
        int lastPositionSeconds,
        int completionPercentage,
        boolean completed,
        Instant completedAt,
        Instant lastUpdatedAt
) {}
