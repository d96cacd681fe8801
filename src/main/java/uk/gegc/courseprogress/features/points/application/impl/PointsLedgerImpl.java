package uk.gegc.courseprogress.features.points.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.gamification.application.GamificationMetricsService;
import uk.gegc.courseprogress.features.gamification.application.GamificationStructuredLogger;
import uk.gegc.courseprogress.features.points.application.AwardResult;
import uk.gegc.courseprogress.features.points.application.LevelCalculator;
import uk.gegc.courseprogress.features.points.application.LevelStanding;
import uk.gegc.courseprogress.features.points.application.PointsLedger;
import uk.gegc.courseprogress.features.points.domain.model.PointsHistory;
import uk.gegc.courseprogress.features.points.domain.model.PointsReason;
import uk.gegc.courseprogress.features.points.domain.model.PointsReferenceType;
import uk.gegc.courseprogress.features.points.domain.model.UserPoints;
import uk.gegc.courseprogress.features.points.domain.repository.PointsHistoryRepository;
import uk.gegc.courseprogress.features.points.domain.repository.UserPointsRepository;
import uk.gegc.courseprogress.shared.exception.IdempotencyConflictException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class PointsLedgerImpl implements PointsLedger {

    private static final Logger log = LoggerFactory.getLogger(PointsLedgerImpl.class);

    private final PointsHistoryRepository historyRepository;
    private final UserPointsRepository userPointsRepository;
    private final LevelCalculator levelCalculator;
    private final GamificationMetricsService metricsService;
    private final Clock clock;

    @Override
    @Transactional
    public AwardResult award(UUID userId, int points, PointsReason reason,
                             PointsReferenceType referenceType, UUID referenceId) {
        if (userId == null || reason == null) {
            throw new IllegalArgumentException("userId and reason are required");
        }
        if (reason.isExactlyOnce() && (referenceType == null || referenceId == null)) {
            throw new IllegalArgumentException(reason + " awards require a reference type and id");
        }
        if (referenceId != null && referenceType == null) {
            throw new IllegalArgumentException("referenceId given without referenceType");
        }

        // Fast path; the unique key on points_history still guards a racing insert
        if (referenceId != null) {
            var existing = historyRepository.findByUserIdAndReferenceTypeAndReferenceId(userId, referenceType, referenceId);
            if (existing.isPresent()) {
                PointsHistory entry = existing.get();
                if (entry.getReason() != reason) {
                    throw new IdempotencyConflictException("Reference " + referenceType + ":" + referenceId
                            + " is already bound to " + entry.getReason() + ", not " + reason);
                }
                metricsService.incrementDuplicateAwards(reason.name());
                log.debug("Duplicate award suppressed: userId={}, reason={}, reference={}:{}",
                        userId, reason, referenceType, referenceId);
                UserPoints current = userPointsRepository.findById(userId).orElse(null);
                long total = current != null ? current.getTotalPoints() : 0L;
                return new AwardResult(entry, true, total, levelCalculator.levelFor(total));
            }
        }

        Instant now = Instant.now(clock);
        UserPoints userPoints = userPointsRepository.findById(userId).orElseGet(() -> {
            UserPoints p = new UserPoints();
            p.setUserId(userId);
            return p;
        });

        long total = userPoints.getTotalPoints() + points;
        LevelStanding standing = applyTotal(userPoints, total, now);
        userPointsRepository.save(userPoints);

        PointsHistory entry = new PointsHistory();
        entry.setUserId(userId);
        entry.setPoints(points);
        entry.setReason(reason);
        entry.setReferenceType(referenceType);
        entry.setReferenceId(referenceId);
        entry.setTotalAfter(total);
        entry.setCreatedAt(now);
        PointsHistory saved = historyRepository.saveAndFlush(entry);

        GamificationStructuredLogger.logLedgerWrite(log,
                "Awarded {} points to user {} for {} (total {}, level {})",
                userId, reason.name(),
                referenceType != null ? referenceType.name() : null,
                referenceId != null ? referenceId.toString() : null,
                points, total,
                points, userId, reason, total, standing.level());
        metricsService.recordPointsAwarded(reason.name(), points);

        return new AwardResult(saved, false, total, standing);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserPoints> findUserPoints(UUID userId) {
        return userPointsRepository.findById(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<PointsHistory> history(UUID userId, Pageable pageable) {
        return historyRepository.findHistory(userId, pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public long countEntries(UUID userId, PointsReason reason) {
        return historyRepository.countByUserIdAndReason(userId, reason);
    }

    @Override
    @Transactional(readOnly = true)
    public List<UserPoints> topByTotal(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0");
        }
        return userPointsRepository.findTopByTotalPoints(PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public long recomputeTotal(UUID userId) {
        long total = historyRepository.sumPointsByUserId(userId);
        UserPoints userPoints = userPointsRepository.findById(userId).orElseGet(() -> {
            UserPoints p = new UserPoints();
            p.setUserId(userId);
            return p;
        });
        if (userPoints.getTotalPoints() != total) {
            log.warn("Points total drift repaired for user {}: stored={}, ledger={}",
                    userId, userPoints.getTotalPoints(), total);
        }
        applyTotal(userPoints, total, Instant.now(clock));
        userPointsRepository.saveAndFlush(userPoints);
        return total;
    }

    private LevelStanding applyTotal(UserPoints userPoints, long total, Instant now) {
        LevelStanding standing = levelCalculator.levelFor(total);
        userPoints.setTotalPoints(total);
        userPoints.setLevel(standing.level());
        userPoints.setPointsToNextLevel(standing.pointsToNextLevel());
        userPoints.setLastRecomputedAt(now);
        return standing;
    }
}
