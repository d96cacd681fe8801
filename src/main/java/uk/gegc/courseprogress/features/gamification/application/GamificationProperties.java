package uk.gegc.courseprogress.features.gamification.application;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Gamification configuration (completion, points, streak and retry parameters).
 */
@Configuration
@ConfigurationProperties(prefix = "gamification")
@Validated
@Data
public class GamificationProperties {

    /**
     * Completion percentage at or above which a lesson counts as completed.
     */
    @Min(1)
    @Max(100)
    private int completionThreshold = 95;

    @PositiveOrZero
    private int lessonCompletedPoints = 10;

    @PositiveOrZero
    private int courseCompletedPoints = 100;

    /**
     * A progress update with at least this many watched seconds counts as daily activity
     * even without a completion transition.
     */
    @PositiveOrZero
    private int streakQualifyingWatchSeconds = 60;

    /**
     * Rolling window, in days, inside which only one grace period may be consumed.
     */
    @Positive
    private int graceWindowDays = 30;

    /**
     * Zone used to turn event time into a calendar activity date.
     */
    @NotNull
    private ZoneId referenceZone = ZoneId.of("UTC");

    /**
     * Ascending point thresholds; level N starts at element N-1.
     */
    @NotEmpty
    private List<Long> levelThresholds = new ArrayList<>(List.of(
            0L, 100L, 300L, 600L, 1000L, 1500L, 2100L, 2800L, 3600L, 5000L));

    /**
     * Total attempts of one unit of work before a conflict surfaces to the caller.
     */
    @Min(1)
    private int maxConflictAttempts = 3;

    @PositiveOrZero
    private long conflictBackoffMillis = 20L;

    /**
     * Seed the default achievement catalog at startup when entries are missing.
     */
    private boolean seedAchievements = true;
}
