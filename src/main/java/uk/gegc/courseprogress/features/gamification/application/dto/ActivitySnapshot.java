package uk.gegc.courseprogress.features.gamification.application.dto;

import uk.gegc.courseprogress.features.achievement.application.dto.UserAchievementDto;
import uk.gegc.courseprogress.features.progress.application.dto.LessonProgressDto;
import uk.gegc.courseprogress.features.streak.application.StreakTransition;

import java.util.List;

/**
 * Consolidated result of one activity event.
 *
 * @param lessonCompleted  this event performed the lesson's completion transition
 * @param courseCompleted  this event completed the lesson's course
 * @param streakTransition how the daily streak reacted, or {@code null} if the event did not qualify
 */
public record ActivitySnapshot(
        LessonProgressDto lessonProgress,
        boolean lessonCompleted,
        boolean courseCompleted,
        StreakTransition streakTransition,
        GamificationSnapshot gamification,
        List<UserAchievementDto> newlyUnlockedAchievements
) {}
