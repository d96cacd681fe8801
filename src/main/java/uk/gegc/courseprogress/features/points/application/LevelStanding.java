package uk.gegc.courseprogress.features.points.application;

/**
 * Level derived from a point total. {@code pointsToNextLevel} is 0 at the top level.
 */
public record LevelStanding(int level, long pointsToNextLevel, boolean maxLevel) {
}
