package uk.gegc.courseprogress.features.points.domain.model;

public enum PointsReferenceType {
    LESSON,
    COURSE,
    ACHIEVEMENT,
    ADJUSTMENT
}
