package uk.gegc.courseprogress.features.achievement.application;

import uk.gegc.courseprogress.features.achievement.domain.model.UserAchievement;

import java.util.List;

/**
 * Grants every active achievement whose rule is satisfied by the aggregates and that the user
 * does not hold yet, crediting its reward through the points ledger. Evaluation follows catalog
 * order, so the same state always yields the same unlocks; running it again on unchanged state
 * grants nothing.
 */
public interface AchievementEvaluator {

    List<UserAchievement> evaluate(ProgressAggregates aggregates);
}
