package uk.gegc.courseprogress.features.progress.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface LessonProgressRepository extends JpaRepository<LessonProgress, UUID> {

    Optional<LessonProgress> findByUserIdAndLessonId(UUID userId, UUID lessonId);

    long countByUserIdAndCompletedTrue(UUID userId);

    long countByUserIdAndLessonIdInAndCompletedTrue(UUID userId, Collection<UUID> lessonIds);

    @Query("select coalesce(sum(p.watchedSeconds), 0) from LessonProgress p where p.userId = :userId")
    long sumWatchedSecondsByUserId(@Param("userId") UUID userId);

    @Query("""
        select coalesce(sum(p.watchedSeconds), 0) from LessonProgress p
        where p.userId = :userId
          and p.lessonId in :lessonIds
    """)
    long sumWatchedSecondsByUserIdAndLessonIdIn(@Param("userId") UUID userId,
                                                @Param("lessonIds") Collection<UUID> lessonIds);
}
