package uk.gegc.courseprogress.features.gamification.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.courseprogress.features.achievement.application.ProgressAggregates;
import uk.gegc.courseprogress.features.points.application.PointsLedger;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.progress.application.ProgressStore;
import uk.gegc.courseprogress.features.streak.application.StreakTracker;
import uk.gegc.courseprogress.features.streak.domain.model.UserStreak;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class ProgressAggregatesCollector {

    private final ProgressStore progressStore;
    private final StreakTracker streakTracker;
    private final PointsLedger pointsLedger;

    public ProgressAggregates collect(UUID userId) {
        int currentStreak = streakTracker.find(userId).map(UserStreak::getCurrentStreak).orElse(0);
        return new ProgressAggregates(
                userId,
                currentStreak,
                progressStore.countCompletedLessons(userId),
                progressStore.totalWatchedSeconds(userId),
                // one course_completed entry per course, enforced by the ledger key
                pointsLedger.countEntries(userId, PointsReason.COURSE_COMPLETED)
        );
    }
}
