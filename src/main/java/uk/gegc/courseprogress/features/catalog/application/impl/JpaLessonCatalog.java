package uk.gegc.courseprogress.features.catalog.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.courseprogress.features.catalog.application.LessonCatalog;
import uk.gegc.courseprogress.features.catalog.domain.model.Lesson;
import uk.gegc.courseprogress.features.catalog.domain.repository.LessonRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaLessonCatalog implements LessonCatalog {

    private final LessonRepository lessonRepository;

    @Override
    public Optional<UUID> findCourseIdForLesson(UUID lessonId) {
        return lessonRepository.findById(lessonId).map(Lesson::getCourseId);
    }

    @Override
    public int totalLessonsInCourse(UUID courseId) {
        return Math.toIntExact(lessonRepository.countByCourseId(courseId));
    }

    @Override
    public List<UUID> lessonIdsInCourse(UUID courseId) {
        return lessonRepository.findIdsByCourseId(courseId);
    }
}
