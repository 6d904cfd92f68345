package org.jstats.fantasyhub_api.modules.league_hub.orchestration;

/**
 * Outcome of one full load or background refresh.
 *
 * @param accepted  false when another full load was already running
 * @param total     leagues considered
 * @param succeeded leagues that produced a result
 * @param failed    leagues that failed or timed out
 * @param skipped   leagues dropped because the same fetch was already in flight
 */
public record LoadReport(boolean accepted, int total, int succeeded, int failed, int skipped) {

    private static final LoadReport REJECTED = new LoadReport(false, 0, 0, 0, 0);

    public static LoadReport rejected() {
        return REJECTED;
    }
}
