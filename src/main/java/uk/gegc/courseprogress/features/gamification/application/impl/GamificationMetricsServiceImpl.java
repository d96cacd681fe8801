package uk.gegc.courseprogress.features.gamification.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.courseprogress.features.gamification.application.GamificationMetricsService;

/**
 * Micrometer-backed gamification counters.
 * Per-reason and per-achievement series are tagged rather than keyed per user.
 */
@Service
public class GamificationMetricsServiceImpl implements GamificationMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter lessonsCompletedCounter;
    private final Counter coursesCompletedCounter;
    private final Counter graceUsedCounter;

    public GamificationMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.lessonsCompletedCounter = Counter.builder("gamification.lessons.completed")
                .description("Number of lesson completion transitions")
                .register(meterRegistry);
        this.coursesCompletedCounter = Counter.builder("gamification.courses.completed")
                .description("Number of courses fully completed")
                .register(meterRegistry);
        this.graceUsedCounter = Counter.builder("gamification.streak.grace.used")
                .description("Number of streak grace periods consumed")
                .register(meterRegistry);
    }

    @Override
    public void incrementLessonsCompleted() {
        lessonsCompletedCounter.increment();
    }

    @Override
    public void incrementCoursesCompleted() {
        coursesCompletedCounter.increment();
    }

    @Override
    public void recordPointsAwarded(String reason, long points) {
        // counters are monotonic; deductions only show up in the ledger
        if (points <= 0) {
            return;
        }
        Counter.builder("gamification.points.awarded")
                .description("Points appended to the ledger")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment(points);
    }

    @Override
    public void incrementDuplicateAwards(String reason) {
        Counter.builder("gamification.points.duplicates")
                .description("Awards suppressed by the idempotency key")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementAchievementsUnlocked(String achievementCode) {
        Counter.builder("gamification.achievements.unlocked")
                .description("Achievements granted")
                .tag("code", achievementCode)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementGraceUsed() {
        graceUsedCounter.increment();
    }

    @Override
    public void incrementUnitOfWorkConflicts(String operation) {
        Counter.builder("gamification.unit_of_work.conflicts")
                .description("Retried write conflicts")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
