package org.jstats.fantasyhub_api.modules.league_hub.model;

public record TeamRecord(int wins, int losses, int ties) {
}
