package org.jstats.fantasyhub_api.modules.league_hub.assembly;

import org.jstats.fantasyhub_api.modules.league_hub.model.MatchupStatus;

/**
 * Where the target week sits relative to the platform's current week.
 */
public enum WeekPhase {
    PAST,
    CURRENT,
    FUTURE;

    public static WeekPhase of(int targetWeek, int currentWeek) {
        if (targetWeek < currentWeek) return PAST;
        if (targetWeek > currentWeek) return FUTURE;
        return CURRENT;
    }

    /** The current week goes live as soon as either side has scored. */
    public MatchupStatus statusFor(double homeScore, double awayScore) {
        return switch (this) {
            case PAST -> MatchupStatus.COMPLETE;
            case FUTURE -> MatchupStatus.UPCOMING;
            case CURRENT -> homeScore != 0.0 || awayScore != 0.0 ? MatchupStatus.LIVE : MatchupStatus.UPCOMING;
        };
    }
}
