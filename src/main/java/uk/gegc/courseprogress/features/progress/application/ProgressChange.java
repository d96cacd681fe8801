package uk.gegc.courseprogress.features.progress.application;

import uk.gegc.courseprogress.features.progress.domain.model.LessonProgress;
import uk.gegc.courseprogress.features.progress.domain.model.LessonProgressState;

/**
 * Result of an upsert: the row as it was before the update and the managed row after it.
 */
public record ProgressChange(LessonProgressState previous, LessonProgress current, boolean created) {
}
