package org.jstats.fantasyhub_api.modules.league_hub.provider;

/**
 * Why a league produced no result in a fetch cycle.
 */
public enum FailureKind {
    /** Transport failure, upstream error status, or retries exhausted. */
    NETWORK,
    /** The platform answered with a body we could not read. */
    DECODE,
    /** None of the user's ids owns a roster in the league. */
    IDENTITY,
    /** The league has nothing to show for the user this week (bye, missing league, empty schedule). */
    EMPTY_RESULT
}
