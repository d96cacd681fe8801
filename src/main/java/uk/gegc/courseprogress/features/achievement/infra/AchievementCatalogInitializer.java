package uk.gegc.courseprogress.features.achievement.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.achievement.domain.model.Achievement;
import uk.gegc.courseprogress.features.achievement.domain.model.AchievementTrigger;
import uk.gegc.courseprogress.features.achievement.domain.repository.AchievementRepository;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;

import java.util.List;

/**
 * Seeds the default achievement catalog at startup. Existing codes are left untouched, so
 * edited rewards or deactivated entries survive restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AchievementCatalogInitializer implements CommandLineRunner {

    static final List<AchievementSeed> DEFAULTS = List.of(
            new AchievementSeed("first_lesson_completed", "First step", "Completed your first lesson",
                    "zap", "general", AchievementTrigger.LESSON_COUNT, 1, 10),
            new AchievementSeed("streak_3_days", "First steps", "3 days of learning in a row",
                    "flame", "streak", AchievementTrigger.STREAK_LENGTH, 3, 50),
            new AchievementSeed("streak_7_days", "Power week", "7 days of consistent learning",
                    "flame", "streak", AchievementTrigger.STREAK_LENGTH, 7, 100),
            new AchievementSeed("streak_14_days", "Two-week marathon", "14 days without a break",
                    "flame", "streak", AchievementTrigger.STREAK_LENGTH, 14, 250),
            new AchievementSeed("streak_30_days", "A month of learning", "30 days of consistent learning",
                    "trophy", "streak", AchievementTrigger.STREAK_LENGTH, 30, 500),
            new AchievementSeed("streak_60_days", "Unbreakable learner", "2 months of daily learning",
                    "trophy", "streak", AchievementTrigger.STREAK_LENGTH, 60, 1000),
            new AchievementSeed("streak_100_days", "Legendary consistency", "100 days in a row",
                    "star", "streak", AchievementTrigger.STREAK_LENGTH, 100, 2000),
            new AchievementSeed("first_course_completed", "Finisher", "Completed your first course",
                    "award", "general", AchievementTrigger.COURSE_COUNT, 1, 100),
            new AchievementSeed("watch_time_10_hours", "Marathoner", "10 hours of video watched",
                    "clock", "watch_time", AchievementTrigger.WATCH_TIME_TOTAL, 10L * 3600, 150),
            new AchievementSeed("watch_time_50_hours", "Master of learning", "50 hours of video watched",
                    "clock", "watch_time", AchievementTrigger.WATCH_TIME_TOTAL, 50L * 3600, 500)
    );

    private final AchievementRepository achievementRepository;
    private final GamificationProperties properties;

    @Override
    @Transactional
    public void run(String... args) {
        if (!properties.isSeedAchievements()) {
            log.info("AchievementCatalogInitializer: seeding disabled");
            return;
        }
        long before = achievementRepository.count();
        for (int i = 0; i < DEFAULTS.size(); i++) {
            AchievementSeed seed = DEFAULTS.get(i);
            if (achievementRepository.findByCode(seed.code()).isPresent()) {
                continue;
            }
            achievementRepository.save(seed.toEntity((i + 1) * 10));
        }
        log.info("AchievementCatalogInitializer: achievements count before={} after={}",
                before, achievementRepository.count());
    }

    record AchievementSeed(String code, String title, String description, String icon, String category,
                           AchievementTrigger trigger, long threshold, int pointsReward) {

        Achievement toEntity(int sortOrder) {
            Achievement achievement = new Achievement();
            achievement.setCode(code);
            achievement.setTitle(title);
            achievement.setDescription(description);
            achievement.setIcon(icon);
            achievement.setCategory(category);
            achievement.setTriggerType(trigger);
            achievement.setThreshold(threshold);
            achievement.setPointsReward(pointsReward);
            achievement.setActive(true);
            achievement.setSortOrder(sortOrder);
            return achievement;
        }
    }
}
