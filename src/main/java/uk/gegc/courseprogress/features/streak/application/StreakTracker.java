package uk.gegc.courseprogress.features.streak.application;

import uk.gegc.courseprogress.features.streak.domain.model.UserStreak;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-user daily activity streak with a limited grace allowance.
 *
 * <pre>
 * gap = activityDate - lastActivityDate
 *   no record  -> current = 1
 *   0          -> no-op
 *   1          -> current + 1
 *   2          -> current + 1 and consume grace if available, else current = 1
 *   &gt;= 3      -> current = 1
 * </pre>
 * Grace is available when none was used, or the day it was used lies at least the configured
 * window (30 days by default) before the activity date.
 */
public interface StreakTracker {

    StreakUpdate registerActivity(UUID userId, LocalDate activityDate);

    Optional<UserStreak> find(UUID userId);

    /**
     * Calendar date of "now" in the reference zone.
     */
    LocalDate today();

    boolean isGraceAvailable(UserStreak streak, LocalDate onDate);

    /**
     * Days until grace can be consumed again; 0 when it is available.
     */
    int daysUntilGraceAvailable(UserStreak streak, LocalDate onDate);
}
