package uk.gegc.courseprogress.features.streak.application;

public enum StreakTransition {
    /** First qualifying activity for the user. */
    STARTED(true),
    /** Activity on a day that was already counted. */
    SAME_DAY(false),
    /** Activity dated before the last counted day; ignored. */
    OUT_OF_ORDER(false),
    /** Consecutive day. */
    CONTINUED(true),
    /** One skipped day bridged by the grace allowance. */
    GRACE_PRESERVED(true),
    /** Gap too long, or one skipped day with no grace left. */
    RESET(true);

    private final boolean changesState;

    StreakTransition(boolean changesState) {
        this.changesState = changesState;
    }

    public boolean changesState() {
        return changesState;
    }
}
