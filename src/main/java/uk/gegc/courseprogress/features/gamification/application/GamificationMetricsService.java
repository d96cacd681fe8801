package uk.gegc.courseprogress.features.gamification.application;

/**
 * Counters for gamification events.
 */
public interface GamificationMetricsService {

    void incrementLessonsCompleted();

    void incrementCoursesCompleted();

    void recordPointsAwarded(String reason, long points);

    void incrementDuplicateAwards(String reason);

    void incrementAchievementsUnlocked(String achievementCode);

    void incrementGraceUsed();

    void incrementUnitOfWorkConflicts(String operation);
}
