package org.jstats.fantasyhub_api.modules.league_hub.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What one league produced in a fetch cycle: a head-to-head matchup or an elimination ranking.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Matchup.class, name = "matchup"),
        @JsonSubTypes.Type(value = Ranking.class, name = "ranking")
})
public sealed interface LeagueOutcome permits Matchup, Ranking {

    int week();
}
