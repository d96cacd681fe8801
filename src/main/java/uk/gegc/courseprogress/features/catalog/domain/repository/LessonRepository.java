package uk.gegc.courseprogress.features.catalog.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.courseprogress.features.catalog.domain.model.Lesson;

import java.util.List;
import java.util.UUID;

public interface LessonRepository extends JpaRepository<Lesson, UUID> {

    long countByCourseId(UUID courseId);

    @Query("select l.id from Lesson l where l.courseId = :courseId order by l.position asc")
    List<UUID> findIdsByCourseId(@Param("courseId") UUID courseId);
}
