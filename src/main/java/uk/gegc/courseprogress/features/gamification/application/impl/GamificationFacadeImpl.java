package uk.gegc.courseprogress.features.gamification.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;
import uk.gegc.courseprogress.features.achievement.application.AchievementEvaluator;
import uk.gegc.courseprogress.features.achievement.application.dto.AchievementDto;
import uk.gegc.courseprogress.features.achievement.application.dto.UserAchievementDto;
import uk.gegc.courseprogress.features.achievement.domain.model.UserAchievement;
import uk.gegc.courseprogress.features.achievement.domain.repository.AchievementRepository;
import uk.gegc.courseprogress.features.achievement.domain.repository.UserAchievementRepository;
import uk.gegc.courseprogress.features.achievement.infra.mapping.AchievementMapper;
import uk.gegc.courseprogress.features.catalog.application.LessonCatalog;
import uk.gegc.courseprogress.features.gamification.application.ActivityUnitOfWork;
import uk.gegc.courseprogress.features.gamification.application.GamificationFacade;
import uk.gegc.courseprogress.features.gamification.application.GamificationMetricsService;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;
import uk.gegc.courseprogress.features.gamification.application.ProgressAggregatesCollector;
import uk.gegc.courseprogress.features.gamification.application.dto.ActivitySnapshot;
import uk.gegc.courseprogress.features.gamification.application.dto.GamificationSnapshot;
import uk.gegc.courseprogress.features.gamification.domain.event.CourseCompletedEvent;
import uk.gegc.courseprogress.features.points.application.AwardResult;
import uk.gegc.courseprogress.features.points.application.LevelCalculator;
import uk.gegc.courseprogress.features.points.application.LevelStanding;
import uk.gegc.courseprogress.features.points.application.PointsLedger;
import uk.gegc.courseprogress.features.points.application.dto.LeaderboardEntryDto;
import uk.gegc.courseprogress.features.points.application.dto.PointsHistoryDto;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;
import uk.gegc.courseprogress.features.points.domain.model.UserPoints;
import uk.gegc.courseprogress.features.points.infra.mapping.PointsHistoryMapper;
import uk.gegc.courseprogress.features.progress.application.CompletionEvaluator;
import uk.gegc.courseprogress.features.progress.application.ProgressChange;
import uk.gegc.courseprogress.features.progress.application.ProgressStore;
import uk.gegc.courseprogress.features.progress.application.dto.CourseProgressSummaryDto;
import uk.gegc.courseprogress.features.progress.application.dto.LessonProgressDto;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;
import uk.gegc.courseprogress.features.progress.infra.mapping.LessonProgressMapper;
import uk.gegc.courseprogress.features.streak.application.StreakTracker;
import uk.gegc.courseprogress.features.streak.application.StreakTransition;
import uk.gegc.courseprogress.features.streak.domain.model.UserStreak;
import uk.gegc.courseprogress.shared.exception.InsufficientProgressException;
import uk.gegc.courseprogress.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates one activity event: progress upsert, completion, lesson and course awards,
 * streak, achievements. Mutations run through {@link ActivityUnitOfWork}; only the read
 * operations carry {@code @Transactional}.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class GamificationFacadeImpl implements GamificationFacade {

    private final ActivityUnitOfWork unitOfWork;
    private final LessonCatalog lessonCatalog;
    private final ProgressStore progressStore;
    private final CompletionEvaluator completionEvaluator;
    private final PointsLedger pointsLedger;
    private final LevelCalculator levelCalculator;
    private final StreakTracker streakTracker;
    private final AchievementEvaluator achievementEvaluator;
    private final ProgressAggregatesCollector aggregatesCollector;
    private final AchievementRepository achievementRepository;
    private final UserAchievementRepository userAchievementRepository;
    private final LessonProgressMapper lessonProgressMapper;
    private final PointsHistoryMapper pointsHistoryMapper;
    private final AchievementMapper achievementMapper;
    private final GamificationMetricsService metricsService;
    private final GamificationProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public ActivitySnapshot recordActivity(UUID userId, UUID lessonId, int watchedSeconds,
                                           int lastPositionSeconds, int completionPercentage) {
        return unitOfWork.execute("recordActivity", userId, () -> {
            UUID courseId = requireCourse(lessonId);

            ProgressChange change = progressStore.recordActivity(
                    userId, lessonId, watchedSeconds, lastPositionSeconds, completionPercentage);
            boolean completed = completionEvaluator.evaluate(change);
            LessonProgress progress = progressStore.save(change.current());

            boolean qualifiesForStreak = completed
                    || watchedSeconds >= properties.getStreakQualifyingWatchSeconds();
            return applyConsequences(userId, lessonId, courseId, progress, completed, qualifiesForStreak);
        });
    }

    @Override
    public ActivitySnapshot markComplete(UUID userId, UUID lessonId) {
        return unitOfWork.execute("markComplete", userId, () -> {
            UUID courseId = requireCourse(lessonId);

            LessonProgress progress = progressStore.find(userId, lessonId)
                    .orElseThrow(() -> new InsufficientProgressException(lessonId, 0, completionEvaluator.threshold()));
            boolean completed = completionEvaluator.completeExplicitly(progress);
            if (completed) {
                progress.setLastUpdatedAt(Instant.now(clock));
                progress = progressStore.save(progress);
            }
            return applyConsequences(userId, lessonId, courseId, progress, completed, completed);
        });
    }

    @Override
    public GamificationSnapshot adjustPoints(UUID userId, int points, UUID referenceId) {
        if (points == 0) {
            throw new IllegalArgumentException("Adjustment must be non-zero");
        }
        return unitOfWork.execute("adjustPoints", userId, () -> {
            pointsLedger.award(userId, points, PointsReason.MANUAL_ADJUSTMENT,
                    PointsReferenceType.ADJUSTMENT, referenceId);
            achievementEvaluator.evaluate(aggregatesCollector.collect(userId));
            return buildSnapshot(userId);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public GamificationSnapshot getSnapshot(UUID userId) {
        return buildSnapshot(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public LessonProgressDto getLessonProgress(UUID userId, UUID lessonId) {
        requireCourse(lessonId);
        return progressStore.find(userId, lessonId)
                .map(lessonProgressMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No progress for lesson " + lessonId + " and user " + userId));
    }

    @Override
    @Transactional(readOnly = true)
    public CourseProgressSummaryDto getCourseProgress(UUID userId, UUID courseId) {
        int totalLessons = lessonCatalog.totalLessonsInCourse(courseId);
        if (totalLessons == 0) {
            throw new ResourceNotFoundException("Course " + courseId + " not found");
        }
        List<UUID> lessonIds = lessonCatalog.lessonIdsInCourse(courseId);
        long completedLessons = progressStore.countCompletedLessons(userId, lessonIds);
        long watchTime = progressStore.totalWatchedSeconds(userId, lessonIds);
        int percentage = (int) (completedLessons * 100 / totalLessons);
        return new CourseProgressSummaryDto(courseId, totalLessons, completedLessons, percentage,
                watchTime, completedLessons >= totalLessons);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean courseCompletionSignal(UUID userId, UUID courseId) {
        return getCourseProgress(userId, courseId).completed();
    }

    @Override
    @Transactional(readOnly = true)
    public List<AchievementDto> listAchievements() {
        return achievementMapper.toDtos(achievementRepository.findByActiveTrueOrderBySortOrderAscCodeAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserAchievementDto> listEarnedAchievements(UUID userId) {
        return achievementMapper.toUserDtos(userAchievementRepository.findByUserIdOrderByEarnedAtDesc(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<PointsHistoryDto> listPointsHistory(UUID userId, Pageable pageable) {
        return pointsLedger.history(userId, pageable).map(pointsHistoryMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public List<LeaderboardEntryDto> getLeaderboard(int limit) {
        List<UserPoints> top = pointsLedger.topByTotal(limit);
        List<LeaderboardEntryDto> entries = new ArrayList<>(top.size());
        for (int i = 0; i < top.size(); i++) {
            UserPoints row = top.get(i);
            entries.add(new LeaderboardEntryDto(i + 1, row.getUserId(), row.getTotalPoints(), row.getLevel()));
        }
        return entries;
    }

    private UUID requireCourse(UUID lessonId) {
        return lessonCatalog.findCourseIdForLesson(lessonId)
                .orElseThrow(() -> new ResourceNotFoundException("Lesson " + lessonId + " not found"));
    }

    private ActivitySnapshot applyConsequences(UUID userId, UUID lessonId, UUID courseId,
                                               LessonProgress progress, boolean lessonCompleted,
                                               boolean qualifiesForStreak) {
        boolean courseCompleted = false;
        if (lessonCompleted) {
            metricsService.incrementLessonsCompleted();
            pointsLedger.award(userId, properties.getLessonCompletedPoints(),
                    PointsReason.LESSON_COMPLETED, PointsReferenceType.LESSON, lessonId);
            courseCompleted = completeCourseIfFinished(userId, courseId);
        }

        StreakTransition streakTransition = null;
        if (qualifiesForStreak) {
            streakTransition = streakTracker.registerActivity(userId, streakTracker.today()).transition();
        }

        List<UserAchievement> unlocked = achievementEvaluator.evaluate(aggregatesCollector.collect(userId));

        return new ActivitySnapshot(
                lessonProgressMapper.toDto(progress),
                lessonCompleted,
                courseCompleted,
                streakTransition,
                buildSnapshot(userId),
                achievementMapper.toUserDtos(unlocked)
        );
    }

    private boolean completeCourseIfFinished(UUID userId, UUID courseId) {
        List<UUID> lessonIds = lessonCatalog.lessonIdsInCourse(courseId);
        if (lessonIds.isEmpty()) {
            return false;
        }
        long completed = progressStore.countCompletedLessons(userId, lessonIds);
        if (completed < lessonIds.size()) {
            return false;
        }

        AwardResult award = pointsLedger.award(userId, properties.getCourseCompletedPoints(),
                PointsReason.COURSE_COMPLETED, PointsReferenceType.COURSE, courseId);
        if (award.duplicate()) {
            return false;
        }
        metricsService.incrementCoursesCompleted();
        log.info("User {} completed course {}", userId, courseId);
        eventPublisher.publishEvent(new CourseCompletedEvent(this, userId, courseId, Instant.now(clock)));
        return true;
    }

    private GamificationSnapshot buildSnapshot(UUID userId) {
        long totalPoints = pointsLedger.findUserPoints(userId).map(UserPoints::getTotalPoints).orElse(0L);
        LevelStanding standing = levelCalculator.levelFor(totalPoints);

        LocalDate today = streakTracker.today();
        Optional<UserStreak> streak = streakTracker.find(userId);
        int currentStreak = streak.map(UserStreak::getCurrentStreak).orElse(0);
        int longestStreak = streak.map(UserStreak::getLongestStreak).orElse(0);
        LocalDate lastActivityDate = streak.map(UserStreak::getLastActivityDate).orElse(null);
        boolean graceAvailable = streak.map(s -> streakTracker.isGraceAvailable(s, today)).orElse(true);
        int daysUntilGrace = streak.map(s -> streakTracker.daysUntilGraceAvailable(s, today)).orElse(0);

        return new GamificationSnapshot(
                userId,
                totalPoints,
                standing.level(),
                standing.pointsToNextLevel(),
                currentStreak,
                longestStreak,
                lastActivityDate,
                graceAvailable,
                daysUntilGrace,
                userAchievementRepository.countByUserId(userId),
                achievementRepository.countByActiveTrue()
        );
    }
}
