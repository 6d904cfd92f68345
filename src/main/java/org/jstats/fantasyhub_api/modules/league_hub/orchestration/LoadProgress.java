package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

/**
 * {@code loaded} counts leagues that finished, successfully or not.
 */
public record LoadProgress(int loaded, int total) {

    public double fraction() {
        return total == 0 ? 0.0 : (double) loaded / total;
    }
}
