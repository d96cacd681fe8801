package uk.gegc.courseprogress.features.progress.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.progress.application.ProgressChange;
import uk.gegc.courseprogress.features.progress.application.ProgressStore;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgressState;
import uk.gegc.courseprogress.features.progress.domain.repository.LessonProgressRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ProgressStoreImpl implements ProgressStore {

    private static final Logger log = LoggerFactory.getLogger(ProgressStoreImpl.class);

    private final LessonProgressRepository progressRepository;
    private final Clock clock;

    @Override
    @Transactional
    public ProgressChange recordActivity(UUID userId, UUID lessonId, int watchedSeconds,
                                         int lastPositionSeconds, int completionPercentage) {
        if (watchedSeconds < 0 || lastPositionSeconds < 0) {
            throw new IllegalArgumentException("watchedSeconds and lastPositionSeconds must be >= 0");
        }

        Optional<LessonProgress> existing = progressRepository.findByUserIdAndLessonId(userId, lessonId);
        LessonProgressState previous = existing.map(LessonProgressState::of).orElseGet(LessonProgressState::absent);

        LessonProgress progress = existing.orElseGet(() -> {
            LessonProgress p = new LessonProgress();
            p.setUserId(userId);
            p.setLessonId(lessonId);
            return p;
        });

        progress.setWatchedSeconds(watchedSeconds);
        progress.setLastPositionSeconds(lastPositionSeconds);
        progress.setCompletionPercentage(clamp(completionPercentage));
        progress.setLastUpdatedAt(Instant.now(clock));

        LessonProgress saved = progressRepository.save(progress);
        log.debug("Progress upserted: userId={}, lessonId={}, watchedSeconds={}, percentage={}, created={}",
                userId, lessonId, watchedSeconds, saved.getCompletionPercentage(), existing.isEmpty());
        return new ProgressChange(previous, saved, existing.isEmpty());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LessonProgress> find(UUID userId, UUID lessonId) {
        return progressRepository.findByUserIdAndLessonId(userId, lessonId);
    }

    @Override
    @Transactional
    public LessonProgress save(LessonProgress progress) {
        return progressRepository.saveAndFlush(progress);
    }

    @Override
    @Transactional(readOnly = true)
    public long countCompletedLessons(UUID userId) {
        return progressRepository.countByUserIdAndCompletedTrue(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public long totalWatchedSeconds(UUID userId) {
        return progressRepository.sumWatchedSecondsByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countCompletedLessons(UUID userId, Collection<UUID> lessonIds) {
        if (lessonIds.isEmpty()) {
            return 0L;
        }
        return progressRepository.countByUserIdAndLessonIdInAndCompletedTrue(userId, lessonIds);
    }

    @Override
    @Transactional(readOnly = true)
    public long totalWatchedSeconds(UUID userId, Collection<UUID> lessonIds) {
        if (lessonIds.isEmpty()) {
            return 0L;
        }
        return progressRepository.sumWatchedSecondsByUserIdAndLessonIdIn(userId, lessonIds);
    }

    static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }
}
