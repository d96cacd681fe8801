package uk.gegc.courseprogress.features.streak.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.gamification.application.GamificationMetricsService;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;
import uk.gegc.courseprogress.features.gamification.application.GamificationStructuredLogger;
import uk.gegc.courseprogress.features.streak.application.StreakTracker;
import uk.gegc.courseprogress.features.streak.application.StreakTransition;
import uk.gegc.courseprogress.features.streak.application.StreakUpdate;
import uk.gegc.courseprogress.features.streak.domain.model.UserStreak;
import uk.gegc.courseprogress.features.streak.domain.repository.UserStreakRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class StreakTrackerImpl implements StreakTracker {

    private static final Logger log = LoggerFactory.getLogger(StreakTrackerImpl.class);

    private final UserStreakRepository streakRepository;
    private final GamificationProperties properties;
    private final GamificationMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public StreakUpdate registerActivity(UUID userId, LocalDate activityDate) {
        if (userId == null || activityDate == null) {
            throw new IllegalArgumentException("userId and activityDate are required");
        }

        Optional<UserStreak> existing = streakRepository.findById(userId);
        if (existing.isEmpty()) {
            UserStreak streak = new UserStreak();
            streak.setUserId(userId);
            streak.setCurrentStreak(1);
            streak.setLongestStreak(1);
            streak.setLastActivityDate(activityDate);
            streakRepository.saveAndFlush(streak);
            return logged(userId, StreakTransition.STARTED, streak);
        }

        UserStreak streak = existing.get();
        long gap = ChronoUnit.DAYS.between(streak.getLastActivityDate(), activityDate);

        StreakTransition transition;
        if (gap < 0) {
            transition = StreakTransition.OUT_OF_ORDER;
        } else if (gap == 0) {
            transition = StreakTransition.SAME_DAY;
        } else if (gap == 1) {
            transition = StreakTransition.CONTINUED;
        } else if (gap == 2 && isGraceAvailable(streak, activityDate)) {
            transition = StreakTransition.GRACE_PRESERVED;
        } else {
            transition = StreakTransition.RESET;
        }

        if (!transition.changesState()) {
            return toUpdate(transition, streak);
        }

        switch (transition) {
            case CONTINUED -> streak.setCurrentStreak(streak.getCurrentStreak() + 1);
            case GRACE_PRESERVED -> {
                streak.setCurrentStreak(streak.getCurrentStreak() + 1);
                streak.setGracePeriodUsedAt(graceInstantFor(activityDate));
                metricsService.incrementGraceUsed();
            }
            default -> streak.setCurrentStreak(1);
        }
        streak.setLongestStreak(Math.max(streak.getLongestStreak(), streak.getCurrentStreak()));
        streak.setLastActivityDate(activityDate);
        streakRepository.saveAndFlush(streak);

        return logged(userId, transition, streak);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserStreak> find(UUID userId) {
        return streakRepository.findById(userId);
    }

    @Override
    public LocalDate today() {
        return LocalDate.ofInstant(Instant.now(clock), properties.getReferenceZone());
    }

    @Override
    public boolean isGraceAvailable(UserStreak streak, LocalDate onDate) {
        return daysUntilGraceAvailable(streak, onDate) == 0;
    }

    @Override
    public int daysUntilGraceAvailable(UserStreak streak, LocalDate onDate) {
        if (streak == null || streak.getGracePeriodUsedAt() == null) {
            return 0;
        }
        LocalDate usedOn = LocalDate.ofInstant(streak.getGracePeriodUsedAt(), properties.getReferenceZone());
        long daysSince = ChronoUnit.DAYS.between(usedOn, onDate);
        long remaining = properties.getGraceWindowDays() - daysSince;
        return remaining > 0 ? (int) remaining : 0;
    }

    /**
     * The grace timestamp is "now" unless the activity is being registered for another day
     * (replays), in which case it is pinned to the start of that day so the window is measured
     * from the day the gap was bridged.
     */
    private Instant graceInstantFor(LocalDate activityDate) {
        Instant now = Instant.now(clock);
        if (LocalDate.ofInstant(now, properties.getReferenceZone()).equals(activityDate)) {
            return now;
        }
        return activityDate.atStartOfDay(properties.getReferenceZone()).toInstant();
    }

    private StreakUpdate logged(UUID userId, StreakTransition transition, UserStreak streak) {
        GamificationStructuredLogger.logStreakTransition(log,
                "Streak {} for user {}: current={}, longest={}",
                userId, transition.name(), streak.getCurrentStreak(), streak.getLongestStreak(),
                transition, userId, streak.getCurrentStreak(), streak.getLongestStreak());
        return toUpdate(transition, streak);
    }

    private StreakUpdate toUpdate(StreakTransition transition, UserStreak streak) {
        return new StreakUpdate(
                transition,
                streak.getCurrentStreak(),
                streak.getLongestStreak(),
                streak.getLastActivityDate(),
                streak.getGracePeriodUsedAt()
        );
    }
}
