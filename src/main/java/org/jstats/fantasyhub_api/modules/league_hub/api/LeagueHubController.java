package org.jstats.fantasyhub_api.modules.league_hub.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.jstats.fantasyhub_api.modules.league_hub.orchestration.ActivitySignal;
import org.jstats.fantasyhub_api.modules.league_hub.orchestration.AggregationOrchestrator;
import org.jstats.fantasyhub_api.modules.league_hub.orchestration.RefreshScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@Tag(name = "League Hub", description = "Aggregated matchups and elimination rankings across ESPN and Sleeper.")
@Validated
@RestController
@RequestMapping("/leagues")
public class LeagueHubController {

    private final AggregationOrchestrator orchestrator;
    private final ActivitySignal activity;
    private final RefreshScheduler scheduler;

    public LeagueHubController(AggregationOrchestrator orchestrator, ActivitySignal activity, RefreshScheduler scheduler) {
        this.orchestrator = orchestrator;
        this.activity = activity;
        this.scheduler = scheduler;
    }

    /**
     * GET /leagues/results
     */
    @Operation(summary = "Current results", description = "Priority-ordered results of the last load or refresh.")
    @GetMapping("/results")
    public LeagueHubViews.Results results() {
        return new LeagueHubViews.Results(
                orchestrator.currentResults(),
                orchestrator.lastUpdated().orElse(null),
                orchestrator.isLoading(),
                orchestrator.noLeaguesFound());
    }

    /**
     * GET /leagues/loading
     */
    @Operation(summary = "Loading state", description = "Per-league state and aggregate progress of the current full load.")
    @GetMapping("/loading")
    public LeagueHubViews.Loading loading() {
        return new LeagueHubViews.Loading(orchestrator.isLoading(), orchestrator.progress(), orchestrator.loadingStates());
    }

    /**
     * Example:
     * POST /leagues/load?week=7&year=2024
     */
    @Operation(
            summary = "Start a full load",
            description = "Clears the visible list and loads every connected league for the week.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Accepted"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "409", description = "A full load is already running",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/load")
    public ResponseEntity<LeagueHubViews.Accepted> load(
            @RequestParam("week") @Min(value = 1, message = "week starts at 1") @Max(value = 22, message = "week must be 22 or less") int week,
            @RequestParam("year") @Min(value = 2000, message = "year looks wrong") @Max(value = 2100, message = "year looks wrong") int year) {
        if (!orchestrator.startLoad(week, year)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "A full load is already running");
        }
        return ResponseEntity.accepted().body(new LeagueHubViews.Accepted("load", week, year));
    }

    /**
     * Example:
     * POST /leagues/refresh?week=7&year=2024
     */
    @Operation(
            summary = "Start a background refresh",
            description = "Re-fetches the leagues of the last load; the current list stays visible until the replacement is ready.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Accepted"),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/refresh")
    public ResponseEntity<LeagueHubViews.Accepted> refresh(
            @RequestParam("week") @Min(value = 1, message = "week starts at 1") @Max(value = 22, message = "week must be 22 or less") int week,
            @RequestParam("year") @Min(value = 2000, message = "year looks wrong") @Max(value = 2100, message = "year looks wrong") int year) {
        orchestrator.startRefresh(week, year);
        return ResponseEntity.accepted().body(new LeagueHubViews.Accepted("refresh", week, year));
    }

    /**
     * PUT /leagues/activity?active=true turns periodic refresh on while a client is watching.
     */
    @Operation(summary = "Set viewer activity", description = "Starts or stops the periodic background refresh.")
    @PutMapping("/activity")
    public LeagueHubViews.Activity activity(@RequestParam("active") boolean active) {
        if (active) {
            activity.activate();
        } else {
            activity.deactivate();
        }
        return new LeagueHubViews.Activity(activity.isActive(), scheduler.isRunning());
    }
}
