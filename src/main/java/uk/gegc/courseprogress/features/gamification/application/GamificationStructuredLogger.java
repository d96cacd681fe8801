package uk.gegc.courseprogress.features.gamification.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging for gamification state changes.
 * Sets the key fields as MDC entries for the duration of one log line.
 */
public final class GamificationStructuredLogger {

    private GamificationStructuredLogger() {
    }

    public static void logLedgerWrite(Logger logger, String message, UUID userId, String reason,
                                      String referenceType, String referenceId, long points,
                                      long totalAfter, Object... args) {
        MDC.put("gamification.userId", userId != null ? userId.toString() : null);
        MDC.put("gamification.reason", reason);
        MDC.put("gamification.referenceType", referenceType);
        MDC.put("gamification.referenceId", referenceId);
        MDC.put("gamification.points", String.valueOf(points));
        MDC.put("gamification.totalAfter", String.valueOf(totalAfter));
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public static void logStreakTransition(Logger logger, String message, UUID userId, String transition,
                                           int currentStreak, int longestStreak, Object... args) {
        MDC.put("gamification.userId", userId != null ? userId.toString() : null);
        MDC.put("gamification.streakTransition", transition);
        MDC.put("gamification.currentStreak", String.valueOf(currentStreak));
        MDC.put("gamification.longestStreak", String.valueOf(longestStreak));
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public static void logAchievementUnlock(Logger logger, String message, UUID userId, String achievementCode,
                                            long progressValue, Object... args) {
        MDC.put("gamification.userId", userId != null ? userId.toString() : null);
        MDC.put("gamification.achievementCode", achievementCode);
        MDC.put("gamification.progressValue", String.valueOf(progressValue));
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    private static void clearMDC() {
        MDC.remove("gamification.userId");
        MDC.remove("gamification.reason");
        MDC.remove("gamification.referenceType");
        MDC.remove("gamification.referenceId");
        MDC.remove("gamification.points");
        MDC.remove("gamification.totalAfter");
        MDC.remove("gamification.streakTransition");
        MDC.remove("gamification.currentStreak");
        MDC.remove("gamification.longestStreak");
        MDC.remove("gamification.achievementCode");
        MDC.remove("gamification.progressValue");
    }
}
