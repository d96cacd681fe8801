package uk.gegc.courseprogress.features.gamification.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.courseprogress.shared.exception.ConcurrencyConflictException;
import uk.gegc.courseprogress.shared.exception.StoreUnavailableException;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Transactional boundary for one activity event.
 * <p>
 * Each attempt runs in its own new transaction, so a failed attempt leaves no partial state.
 * Write conflicts (version mismatch, lock failure, or a racing insert hitting a unique key) are
 * retried from scratch a bounded number of times; the re-run reads the winner's committed state
 * and takes the idempotent path. Any other store failure surfaces immediately.
 */
@Component
public class ActivityUnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(ActivityUnitOfWork.class);

    private final TransactionTemplate transactionTemplate;
    private final GamificationProperties properties;
    private final GamificationMetricsService metricsService;

    public ActivityUnitOfWork(PlatformTransactionManager transactionManager,
                              GamificationProperties properties,
                              GamificationMetricsService metricsService) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
        this.metricsService = metricsService;
    }

    public <T> T execute(String operation, UUID userId, Supplier<T> work) {
        int maxAttempts = properties.getMaxConflictAttempts();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (ConcurrencyFailureException | DataIntegrityViolationException ex) {
                metricsService.incrementUnitOfWorkConflicts(operation);
                if (attempt >= maxAttempts) {
                    log.warn("{} write conflict persisted after {} attempts for user {}", operation, attempt, userId);
                    throw new ConcurrencyConflictException(
                            operation + " could not be applied for user " + userId + " due to concurrent updates",
                            attempt, ex);
                }
                log.warn("{} write conflict for user {}: attempt={}/{}, cause={}",
                        operation, userId, attempt, maxAttempts, ex.getClass().getSimpleName());
                sleepBackoff(attempt);
            } catch (DataAccessException | TransactionException ex) {
                log.error("{} failed for user {}: store unavailable", operation, userId, ex);
                throw new StoreUnavailableException(operation + " failed: store unavailable", ex);
            }
        }
    }

    private void sleepBackoff(int attempt) {
        long backoff = properties.getConflictBackoffMillis() * attempt;
        if (backoff <= 0) {
            return;
        }
        try {
            Thread.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
