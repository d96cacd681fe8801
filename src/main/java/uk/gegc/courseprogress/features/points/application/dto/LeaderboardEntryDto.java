package uk.gegc.courseprogress.features.points.application.dto;

import java.util.UUID;

public record LeaderboardEntryDto(int rank, UUID userId, long totalPoints, int level) {}
