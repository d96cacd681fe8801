package uk.gegc.courseprogress.features.catalog.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * Read-only view of the course catalog: which course a lesson belongs to.
 * The catalog itself is owned by the course CRUD side of the platform.
 */
@Entity
@Getter
@Setter
@Table(name = "lessons", indexes = {
        @Index(name = "ix_lessons_course", columnList = "course_id")
})
public class Lesson {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "course_id", nullable = false)
    private UUID courseId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "position", nullable = false)
    private int position;
}
