package org.jstats.fantasyhub_api.modules.league_hub.provider;

import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors.UpstreamJsonParseException;
import org.jstats.fantasyhub_api.modules.league_hub.model.LeagueRef;

/**
 * A single league's fetch failed. Never affects sibling leagues.
 */
public class LeagueFetchException extends RuntimeException {

    private final FailureKind kind;
    private final String leagueKey;

    public LeagueFetchException(LeagueRef league, FailureKind kind, String message) {
        this(league, kind, message, null);
    }

    public LeagueFetchException(LeagueRef league, FailureKind kind, String message, Throwable cause) {
        super(league.key() + ": " + message, cause);
        this.kind = kind;
        this.leagueKey = league.key();
    }

    /**
     * Maps whatever escaped a client call to a failure kind.
     */
    public static LeagueFetchException from(LeagueRef league, RuntimeException ex) {
        if (ex instanceof LeagueFetchException lfe) {
            return lfe;
        }
        var kind = ex instanceof UpstreamJsonParseException ? FailureKind.DECODE : FailureKind.NETWORK;
        return new LeagueFetchException(league, kind, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), ex);
    }

    public FailureKind kind() {
        return kind;
    }

    public String leagueKey() {
        return leagueKey;
    }
}
