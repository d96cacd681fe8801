package uk.gegc.courseprogress.features.points.application;

import uk.gegc.courseprogress.features.points.domain.model.PointsHistory;

/**
 * Outcome of a ledger append. For a suppressed duplicate {@code entry} is the row that already
 * held the idempotency key and the total is unchanged.
 */
public record AwardResult(PointsHistory entry, boolean duplicate, long totalPoints, LevelStanding standing) {
}
