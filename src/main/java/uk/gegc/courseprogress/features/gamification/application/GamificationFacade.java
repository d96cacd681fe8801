package uk.gegc.courseprogress.features.gamification.application;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.courseprogress.features.achievement.application.dto.AchievementDto;
import uk.gegc.courseprogress.features.achievement.application.dto.UserAchievementDto;
import uk.gegc.courseprogress.features.gamification.application.dto.ActivitySnapshot;
import uk.gegc.courseprogress.features.gamification.application.dto.GamificationSnapshot;
import uk.gegc.courseprogress.features.points.application.dto.LeaderboardEntryDto;
import uk.gegc.courseprogress.features.points.application.dto.PointsHistoryDto;
import uk.gegc.courseprogress.features.progress.application.dto.CourseProgressSummaryDto;
import uk.gegc.courseprogress.features.progress.application.dto.LessonProgressDto;

import java.util.List;
import java.util.UUID;

/**
 * Entry point of the progress and gamification engine.
 * <p>
 * Callers (the HTTP layer, importers) have already authenticated the user and verified the
 * enrollment. Every mutating operation runs as one unit of work: progress, completion, points,
 * streak and achievements commit or roll back together, and a retried call is safe.
 */
public interface GamificationFacade {

    /**
     * Records watch progress for a lesson and applies every consequence of it.
     *
     * @throws uk.gegc.courseprogress.shared.exception.ResourceNotFoundException if the lesson is unknown
     * @throws uk.gegc.courseprogress.shared.exception.ConcurrencyConflictException if conflicts outlast the retries
     * @throws uk.gegc.courseprogress.shared.exception.StoreUnavailableException if the store fails
     */
    ActivitySnapshot recordActivity(@NotNull UUID userId,
                                    @NotNull UUID lessonId,
                                    @PositiveOrZero int watchedSeconds,
                                    @PositiveOrZero int lastPositionSeconds,
                                    int completionPercentage);

    /**
     * Explicitly completes a lesson. A lesson that is already completed is left as is.
     *
     * @throws uk.gegc.courseprogress.shared.exception.InsufficientProgressException below the completion threshold
     */
    ActivitySnapshot markComplete(@NotNull UUID userId, @NotNull UUID lessonId);

    /**
     * Appends a manual adjustment (may be negative). Deduplicated only when a reference id is given.
     */
    GamificationSnapshot adjustPoints(@NotNull UUID userId, int points, UUID referenceId);

    GamificationSnapshot getSnapshot(@NotNull UUID userId);

    LessonProgressDto getLessonProgress(@NotNull UUID userId, @NotNull UUID lessonId);

    CourseProgressSummaryDto getCourseProgress(@NotNull UUID userId, @NotNull UUID courseId);

    /**
     * {@code true} iff every lesson of the course is completed by the user. Polled by the
     * certificate collaborator before issuance.
     */
    boolean courseCompletionSignal(@NotNull UUID userId, @NotNull UUID courseId);

    List<AchievementDto> listAchievements();

    List<UserAchievementDto> listEarnedAchievements(@NotNull UUID userId);

    Page<PointsHistoryDto> listPointsHistory(@NotNull UUID userId, @NotNull Pageable pageable);

    List<LeaderboardEntryDto> getLeaderboard(@Min(1) @Max(100) int limit);
}
