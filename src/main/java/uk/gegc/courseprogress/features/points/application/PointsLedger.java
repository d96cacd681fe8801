package uk.gegc.courseprogress.features.points.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.courseprogress.features.points.domain.model.PointsHistory;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;
import uk.gegc.courseprogress.features.points.domain.model.UserPoints;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only, idempotent points ledger with a derived running total per user.
 */
public interface PointsLedger {

    /**
     * Appends an entry and updates the user's total and level.
     * <p>
     * For {@link PointsReason#isExactlyOnce() exactly-once} reasons, and for any award that carries
     * a reference id, an existing entry with the same (user, reference type, reference id) turns
     * the call into a no-op that returns that entry.
     *
     * @throws IllegalArgumentException if an exactly-once reason has no reference
     * @throws uk.gegc.courseprogress.shared.exception.IdempotencyConflictException if the key is
     *         already bound to a different reason
     */
    AwardResult award(UUID userId, int points, PointsReason reason,
                      PointsReferenceType referenceType, UUID referenceId);

    Optional<UserPoints> findUserPoints(UUID userId);

    Page<PointsHistory> history(UUID userId, Pageable pageable);

    long countEntries(UUID userId, PointsReason reason);

    List<UserPoints> topByTotal(int limit);

    /**
     * Rebuilds the running total from the ledger rows and stores it.
     *
     * @return the recomputed total
     */
    long recomputeTotal(UUID userId);
}
