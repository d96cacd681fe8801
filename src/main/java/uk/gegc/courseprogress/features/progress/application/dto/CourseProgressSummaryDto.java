package uk.gegc.courseprogress.features.progress.application.dto;

import java.util.UUID;

/**
 * Per-course progress of one user. {@code completed} is the signal the certificate
 * collaborator polls before issuing.
 */
public record CourseProgressSummaryDto(
        UUID courseId,
        int totalLessons,
        long completedLessons,
        int progressPercentage,
        long totalWatchTimeSeconds,
        boolean completed
) {}
