package uk.gegc.courseprogress.features.points.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.courseprogress.features.gamification.application.GamificationProperties;

import java.util.List;

/**
 * Pure mapping from total points to a level against an ascending threshold table.
 * Level N starts at {@code thresholds[N-1]}; totals below the first threshold stay at level 1.
 * There is no peak tracking: a lower total yields a lower level.
 */
@Component
public class LevelCalculator {

    private final long[] thresholds;

    @Autowired
    public LevelCalculator(GamificationProperties properties) {
        this(properties.getLevelThresholds());
    }

    LevelCalculator(List<Long> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("level thresholds must not be empty");
        }
        this.thresholds = new long[thresholds.size()];
        for (int i = 0; i < thresholds.size(); i++) {
            long value = thresholds.get(i);
            if (i > 0 && value <= this.thresholds[i - 1]) {
                throw new IllegalArgumentException("level thresholds must be strictly ascending: " + thresholds);
            }
            this.thresholds[i] = value;
        }
    }

    public LevelStanding levelFor(long totalPoints) {
        int index = 0;
        for (int i = thresholds.length - 1; i > 0; i--) {
            if (totalPoints >= thresholds[i]) {
                index = i;
                break;
            }
        }
        int level = index + 1;
        if (level >= thresholds.length) {
            return new LevelStanding(level, 0L, true);
        }
        return new LevelStanding(level, thresholds[index + 1] - totalPoints, false);
    }

    public int maxLevel() {
        return thresholds.length;
    }
}
