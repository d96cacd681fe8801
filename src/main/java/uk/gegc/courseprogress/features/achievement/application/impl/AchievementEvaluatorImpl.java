package uk.gegc.courseprogress.features.achievement.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.achievement.application.AchievementEvaluator;
import uk.gegc.courseprogress.features.achievement.application.ProgressAggregates;
import uk.gegc.courseprogress.features.achievement.domain.model.Achievement;
import uk.gegc.courseprogress.features.achievement.domain.model.UserAchievement;
import uk.gegc.courseprogress.features.achievement.domain.repository.AchievementRepository;
import uk.gegc.courseprogress.features.achievement.domain.repository.UserAchievementRepository;
import uk.gegc.courseprogress.features.gamification.application.GamificationMetricsService;
import uk.gegc.courseprogress.features.gamification.application.GamificationStructuredLogger;
import uk.gegc.courseprogress.features.points.application.PointsLedger;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AchievementEvaluatorImpl implements AchievementEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AchievementEvaluatorImpl.class);

    private final AchievementRepository achievementRepository;
    private final UserAchievementRepository userAchievementRepository;
    private final PointsLedger pointsLedger;
    private final GamificationMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public List<UserAchievement> evaluate(ProgressAggregates aggregates) {
        List<Achievement> catalog = achievementRepository.findByActiveTrueOrderBySortOrderAscCodeAsc();
        if (catalog.isEmpty()) {
            return List.of();
        }
        Set<UUID> earned = userAchievementRepository.findAchievementIdsByUserId(aggregates.userId());

        List<UserAchievement> unlocked = new ArrayList<>();
        for (Achievement achievement : catalog) {
            if (earned.contains(achievement.getId())) {
                continue;
            }
            long measured = achievement.getTriggerType().measure(aggregates);
            if (measured < achievement.getThreshold()) {
                continue;
            }
            unlocked.add(grant(aggregates, achievement, measured));
        }
        return unlocked;
    }

    private UserAchievement grant(ProgressAggregates aggregates, Achievement achievement, long measured) {
        UserAchievement userAchievement = new UserAchievement();
        userAchievement.setUserId(aggregates.userId());
        userAchievement.setAchievement(achievement);
        userAchievement.setEarnedAt(Instant.now(clock));
        userAchievement.setProgressValue(measured);
        UserAchievement saved = userAchievementRepository.saveAndFlush(userAchievement);

        pointsLedger.award(aggregates.userId(), achievement.getPointsReward(),
                PointsReason.ACHIEVEMENT_UNLOCKED, PointsReferenceType.ACHIEVEMENT, achievement.getId());

        GamificationStructuredLogger.logAchievementUnlock(log,
                "Achievement {} unlocked for user {} ({} {} >= {})",
                aggregates.userId(), achievement.getCode(), measured,
                achievement.getCode(), aggregates.userId(), achievement.getTriggerType(), measured,
                achievement.getThreshold());
        metricsService.incrementAchievementsUnlocked(achievement.getCode());
        return saved;
    }
}
