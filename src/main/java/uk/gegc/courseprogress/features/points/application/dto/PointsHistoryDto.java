package uk.gegc.courseprogress.features.points.application.dto;

import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;

import java.time.Instant;
import java.util.UUID;

public record PointsHistoryDto(
        UUID id,
        UUID userId,
        int points,
        PointsReason reason,
        PointsReferenceType referenceType,
        UUID referenceId,
        long totalAfter,
        Instant createdAt
) {}
