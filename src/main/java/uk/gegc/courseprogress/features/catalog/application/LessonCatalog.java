package uk.gegc.courseprogress.features.catalog.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Lesson to course lookups the progress engine needs from the catalog.
 */
public interface LessonCatalog {

    Optional<UUID> findCourseIdForLesson(UUID lessonId);

    int totalLessonsInCourse(UUID courseId);

    List<UUID> lessonIdsInCourse(UUID courseId);
}
