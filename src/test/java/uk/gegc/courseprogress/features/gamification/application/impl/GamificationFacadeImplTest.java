package uk.gegc.courseprogress.features.gamification.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.courseprogress.BaseUnitTest;
import uk.gegc.courseprogress.features.achievement.application.AchievementEvaluator;
import uk.gegc.courseprogress.features.achievement.domain.repository.AchievementRepository;
import uk.gegc.courseprogress.features.achievement.domain.repository.UserAchievementRepository;
import uk.gegc.courseprogress.features.achievement.infra.mapping.AchievementMapper;
import uk.gegc.courseprogress.features.catalog.application.LessonCatalog;
import uk.gegc.courseprogress.features.gamification.application.ActivityUnitOfWork;
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
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;
import uk.gegc.courseprogress.features.points.domain.model.UserPoints;
import uk.gegc.courseprogress.features.points.infra.mapping.PointsHistoryMapper;
import uk.gegc.courseprogress.features.progress.application.CompletionEvaluator;
import uk.gegc.courseprogress.features.progress.application.ProgressChange;
import uk.gegc.courseprogress.features.progress.application.ProgressStore;
import uk.gegc.courseprogress.features.progress.application.dto.CourseProgressSummaryDto;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgressState;
import uk.gegc.courseprogress.features.progress.infra.mapping.LessonProgressMapper;
import uk.gegc.courseprogress.features.streak.application.StreakTracker;
import uk.gegc.courseprogress.features.streak.application.StreakTransition;
import uk.gegc.courseprogress.features.streak.application.StreakUpdate;
import uk.gegc.courseprogress.shared.exception.InsufficientProgressException;
import uk.gegc.courseprogress.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("GamificationFacadeImpl Tests")
class GamificationFacadeImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:15:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @Mock private ActivityUnitOfWork unitOfWork;
    @Mock private LessonCatalog lessonCatalog;
    @Mock private ProgressStore progressStore;
    @Mock private PointsLedger pointsLedger;
    @Mock private StreakTracker streakTracker;
    @Mock private AchievementEvaluator achievementEvaluator;
    @Mock private ProgressAggregatesCollector aggregatesCollector;
    @Mock private AchievementRepository achievementRepository;
    @Mock private UserAchievementRepository userAchievementRepository;
    @Mock private LessonProgressMapper lessonProgressMapper;
    @Mock private PointsHistoryMapper pointsHistoryMapper;
    @Mock private AchievementMapper achievementMapper;
    @Mock private GamificationMetricsService metricsService;
    @Mock private ApplicationEventPublisher eventPublisher;

    private GamificationFacadeImpl facade;
    private UUID userId;
    private UUID lessonId;
    private UUID otherLessonId;
    private UUID courseId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        GamificationProperties properties = new GamificationProperties();
        facade = new GamificationFacadeImpl(unitOfWork, lessonCatalog, progressStore,
                new CompletionEvaluator(properties, clock), pointsLedger,
                new LevelCalculator(properties), streakTracker, achievementEvaluator, aggregatesCollector,
                achievementRepository, userAchievementRepository, lessonProgressMapper, pointsHistoryMapper,
                achievementMapper, metricsService, properties, eventPublisher, clock);

        userId = UUID.randomUUID();
        lessonId = UUID.randomUUID();
        otherLessonId = UUID.randomUUID();
        courseId = UUID.randomUUID();

        lenient().when(unitOfWork.execute(anyString(), any(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(2)).get());
        lenient().when(lessonCatalog.findCourseIdForLesson(lessonId)).thenReturn(Optional.of(courseId));
        lenient().when(progressStore.save(any(LessonProgress.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(streakTracker.today()).thenReturn(TODAY);
    }

    @Test
    @DisplayName("Unknown lesson fails with ResourceNotFoundException before any write")
    void unknownLessonFails() {
        UUID unknown = UUID.randomUUID();
        when(lessonCatalog.findCourseIdForLesson(unknown)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> facade.recordActivity(userId, unknown, 100, 100, 50))
                .isInstanceOf(ResourceNotFoundException.class);

        verifyNoInteractions(progressStore, pointsLedger, streakTracker, achievementEvaluator);
    }

    @Test
    @DisplayName("Crossing the threshold awards lesson points, registers streak and evaluates achievements")
    void completionTransitionAppliesConsequences() {
        givenUpsert(LessonProgressState.absent(), progressAt(95));
        when(lessonCatalog.lessonIdsInCourse(courseId)).thenReturn(List.of(lessonId, otherLessonId));
        when(progressStore.countCompletedLessons(userId, List.of(lessonId, otherLessonId))).thenReturn(1L);
        when(streakTracker.registerActivity(userId, TODAY)).thenReturn(streakUpdate(StreakTransition.STARTED));
        when(pointsLedger.findUserPoints(userId)).thenReturn(Optional.of(userPoints(10)));

        ActivitySnapshot snapshot = facade.recordActivity(userId, lessonId, 600, 600, 95);

        assertThat(snapshot.lessonCompleted()).isTrue();
        assertThat(snapshot.courseCompleted()).isFalse();
        assertThat(snapshot.streakTransition()).isEqualTo(StreakTransition.STARTED);
        assertThat(snapshot.gamification().totalPoints()).isEqualTo(10);
        assertThat(snapshot.gamification().pointsToNextLevel()).isEqualTo(90);

        verify(pointsLedger).award(userId, 10, PointsReason.LESSON_COMPLETED, PointsReferenceType.LESSON, lessonId);
        verify(pointsLedger, never()).award(any(), anyInt(), eq(PointsReason.COURSE_COMPLETED), any(), any());
        verify(metricsService).incrementLessonsCompleted();
        verify(achievementEvaluator).evaluate(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("Completing the last lesson awards the course bonus and publishes CourseCompletedEvent")
    void lastLessonCompletesCourse() {
        givenUpsert(LessonProgressState.absent(), progressAt(100));
        when(lessonCatalog.lessonIdsInCourse(courseId)).thenReturn(List.of(lessonId, otherLessonId));
        when(progressStore.countCompletedLessons(userId, List.of(lessonId, otherLessonId))).thenReturn(2L);
        when(pointsLedger.award(userId, 10, PointsReason.LESSON_COMPLETED, PointsReferenceType.LESSON, lessonId))
                .thenReturn(new AwardResult(null, false, 20, new LevelStanding(1, 80, false)));
        when(pointsLedger.award(userId, 100, PointsReason.COURSE_COMPLETED, PointsReferenceType.COURSE, courseId))
                .thenReturn(new AwardResult(null, false, 120, new LevelStanding(2, 180, false)));
        when(streakTracker.registerActivity(userId, TODAY)).thenReturn(streakUpdate(StreakTransition.CONTINUED));

        ActivitySnapshot snapshot = facade.recordActivity(userId, lessonId, 900, 900, 100);

        assertThat(snapshot.courseCompleted()).isTrue();
        ArgumentCaptor<CourseCompletedEvent> captor = ArgumentCaptor.forClass(CourseCompletedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo(userId);
        assertThat(captor.getValue().getCourseId()).isEqualTo(courseId);
        assertThat(captor.getValue().getCompletedAt()).isEqualTo(NOW);
        verify(metricsService).incrementCoursesCompleted();
    }

    @Test
    @DisplayName("A course already rewarded is not announced again")
    void duplicateCourseAwardIsSilent() {
        givenUpsert(LessonProgressState.absent(), progressAt(100));
        when(lessonCatalog.lessonIdsInCourse(courseId)).thenReturn(List.of(lessonId));
        when(progressStore.countCompletedLessons(userId, List.of(lessonId))).thenReturn(1L);
        when(pointsLedger.award(userId, 10, PointsReason.LESSON_COMPLETED, PointsReferenceType.LESSON, lessonId))
                .thenReturn(new AwardResult(null, false, 20, new LevelStanding(1, 80, false)));
        when(pointsLedger.award(userId, 100, PointsReason.COURSE_COMPLETED, PointsReferenceType.COURSE, courseId))
                .thenReturn(new AwardResult(null, true, 120, new LevelStanding(2, 180, false)));
        when(streakTracker.registerActivity(userId, TODAY)).thenReturn(streakUpdate(StreakTransition.SAME_DAY));

        ActivitySnapshot snapshot = facade.recordActivity(userId, lessonId, 900, 900, 100);

        assertThat(snapshot.courseCompleted()).isFalse();
        verifyNoInteractions(eventPublisher);
        verify(metricsService, never()).incrementCoursesCompleted();
    }

    @Test
    @DisplayName("Short partial watch neither awards points nor counts toward the streak")
    void shortPartialWatchDoesNotQualify() {
        givenUpsert(LessonProgressState.absent(), progressAt(20));

        ActivitySnapshot snapshot = facade.recordActivity(userId, lessonId, 30, 30, 20);

        assertThat(snapshot.lessonCompleted()).isFalse();
        assertThat(snapshot.streakTransition()).isNull();
        verify(pointsLedger, never()).award(any(), anyInt(), any(), any(), any());
        verify(streakTracker, never()).registerActivity(any(), any());
    }

    @Test
    @DisplayName("Partial watch of a minute or more counts toward the streak")
    void longPartialWatchQualifies() {
        givenUpsert(LessonProgressState.absent(), progressAt(40));
        when(streakTracker.registerActivity(userId, TODAY)).thenReturn(streakUpdate(StreakTransition.STARTED));

        ActivitySnapshot snapshot = facade.recordActivity(userId, lessonId, 60, 60, 40);

        assertThat(snapshot.lessonCompleted()).isFalse();
        assertThat(snapshot.streakTransition()).isEqualTo(StreakTransition.STARTED);
        verify(pointsLedger, never()).award(any(), anyInt(), any(), any(), any());
    }

    @Test
    @DisplayName("markComplete without any progress is insufficient progress")
    void markCompleteWithoutProgress() {
        when(progressStore.find(userId, lessonId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> facade.markComplete(userId, lessonId))
                .isInstanceOf(InsufficientProgressException.class);
        verify(pointsLedger, never()).award(any(), anyInt(), any(), any(), any());
    }

    @Test
    @DisplayName("markComplete on an already completed lesson changes nothing")
    void markCompleteIsIdempotent() {
        LessonProgress progress = progressAt(100);
        progress.markCompleted(NOW.minusSeconds(60));
        when(progressStore.find(userId, lessonId)).thenReturn(Optional.of(progress));

        ActivitySnapshot snapshot = facade.markComplete(userId, lessonId);

        assertThat(snapshot.lessonCompleted()).isFalse();
        verify(progressStore, never()).save(any());
        verify(pointsLedger, never()).award(any(), anyInt(), any(), any(), any());
        verify(streakTracker, never()).registerActivity(any(), any());
    }

    @Test
    @DisplayName("Zero adjustment is rejected")
    void zeroAdjustmentRejected() {
        assertThatThrownBy(() -> facade.adjustPoints(userId, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("Negative adjustment goes to the ledger and re-evaluates achievements")
    void negativeAdjustment() {
        UUID referenceId = UUID.randomUUID();
        when(pointsLedger.findUserPoints(userId)).thenReturn(Optional.of(userPoints(70)));

        GamificationSnapshot snapshot = facade.adjustPoints(userId, -50, referenceId);

        verify(pointsLedger).award(userId, -50, PointsReason.MANUAL_ADJUSTMENT,
                PointsReferenceType.ADJUSTMENT, referenceId);
        verify(achievementEvaluator).evaluate(any());
        assertThat(snapshot.totalPoints()).isEqualTo(70);
        assertThat(snapshot.level()).isEqualTo(1);
    }

    @Test
    @DisplayName("Course progress summary and completion signal")
    void courseProgressSummary() {
        List<UUID> lessons = List.of(lessonId, otherLessonId, UUID.randomUUID(), UUID.randomUUID());
        when(lessonCatalog.totalLessonsInCourse(courseId)).thenReturn(4);
        when(lessonCatalog.lessonIdsInCourse(courseId)).thenReturn(lessons);
        when(progressStore.countCompletedLessons(userId, lessons)).thenReturn(3L);
        when(progressStore.totalWatchedSeconds(userId, lessons)).thenReturn(5400L);

        CourseProgressSummaryDto summary = facade.getCourseProgress(userId, courseId);

        assertThat(summary.totalLessons()).isEqualTo(4);
        assertThat(summary.completedLessons()).isEqualTo(3);
        assertThat(summary.progressPercentage()).isEqualTo(75);
        assertThat(summary.totalWatchTimeSeconds()).isEqualTo(5400);
        assertThat(summary.completed()).isFalse();
        assertThat(facade.courseCompletionSignal(userId, courseId)).isFalse();
    }

    @Test
    @DisplayName("Unknown course fails with ResourceNotFoundException")
    void unknownCourse() {
        when(lessonCatalog.totalLessonsInCourse(courseId)).thenReturn(0);

        assertThatThrownBy(() -> facade.courseCompletionSignal(userId, courseId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Reading progress of an untouched lesson is not found")
    void lessonProgressMissing() {
        when(progressStore.find(userId, lessonId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> facade.getLessonProgress(userId, lessonId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("Leaderboard ranks users by total")
    void leaderboardRanks() {
        UserPoints first = userPoints(500);
        first.setLevel(3);
        UserPoints second = userPoints(120);
        second.setUserId(UUID.randomUUID());
        second.setLevel(2);
        when(pointsLedger.topByTotal(2)).thenReturn(List.of(first, second));

        List<LeaderboardEntryDto> board = facade.getLeaderboard(2);

        assertThat(board).extracting(LeaderboardEntryDto::rank).containsExactly(1, 2);
        assertThat(board.get(0).userId()).isEqualTo(userId);
        assertThat(board.get(1).totalPoints()).isEqualTo(120);
    }

    private void givenUpsert(LessonProgressState previous, LessonProgress current) {
        when(progressStore.recordActivity(eq(userId), eq(lessonId), anyInt(), anyInt(), anyInt()))
                .thenReturn(new ProgressChange(previous, current, true));
    }

    private LessonProgress progressAt(int percentage) {
        LessonProgress progress = new LessonProgress();
        progress.setUserId(userId);
        progress.setLessonId(lessonId);
        progress.setCompletionPercentage(percentage);
        return progress;
    }

    private StreakUpdate streakUpdate(StreakTransition transition) {
        return new StreakUpdate(transition, 1, 1, TODAY, null);
    }

    private UserPoints userPoints(long total) {
        UserPoints points = new UserPoints();
        points.setUserId(userId);
        points.setTotalPoints(total);
        return points;
    }
}
