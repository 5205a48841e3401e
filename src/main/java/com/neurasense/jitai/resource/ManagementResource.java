package com.neurasense.jitai.resource;

import com.neurasense.jitai.catalog.CatalogService;
import com.neurasense.jitai.domain.CatalogEntry;
import com.neurasense.jitai.domain.CheckinObservation;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.outcome.OutcomeTracker;
import com.neurasense.jitai.outcome.RecommendationStoreException;
import com.neurasense.jitai.resource.dto.DecisionRequest;
import com.neurasense.jitai.resource.dto.ErrorResponse;
import com.neurasense.jitai.resource.dto.MetricsResponse;
import com.neurasense.jitai.resource.dto.ReloadResponse;
import com.neurasense.jitai.resource.dto.RulesetStatus;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import com.neurasense.jitai.service.DecisionService;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.util.Optional;

/**
 * Management API for rule authors and admin tools.
 *
 * <p>These endpoints are used for:
 * <ul>
 *   <li>Previewing a decision without recording anything</li>
 *   <li>Inspecting and reloading the active rules</li>
 *   <li>Per-rule outcome statistics, catalog lookup and engine counters</li>
 * </ul>
 */
@Path("/v1/manage")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Management", description = "Rule management and preview endpoints")
public class ManagementResource {

    private static final Logger LOG = Logger.getLogger(ManagementResource.class);

    @Inject
    DecisionService decisionService;

    @Inject
    RulesetRegistry rulesetRegistry;

    @Inject
    OutcomeTracker outcomeTracker;

    @Inject
    CatalogService catalogService;

    @Inject
    EngineMetrics engineMetrics;

    @Inject
    Clock clock;

    /**
     * Evaluates a decision point without side effects.
     * <p>
     * Preview decisions write no recommendation records and return the full tailoring
     * context, so rule authors can see why each rule did or did not match.
     */
    @POST
    @Path("/preview")
    @Operation(summary = "Preview decision", description = "Dry-run decision; returns the tailoring context and records nothing")
    @APIResponses({
            @APIResponse(
                    responseCode = "200",
                    description = "Preview complete",
                    content = @Content(schema = @Schema(implementation = Decision.class))
            ),
            @APIResponse(responseCode = "400", description = "Invalid request")
    })
    public Response preview(@Valid @NotNull DecisionRequest request) {
        LOG.infof("Preview request: user=%s", request.userId);
        CheckinObservation checkin = request.checkin != null
                ? request.checkin.toObservation(request.userId, clock.instant())
                : null;
        Decision decision = decisionService.preview(request.userId, checkin, request.maxResults);
        return Response.ok(decision).build();
    }

    @GET
    @Path("/rules")
    @Operation(summary = "Active rules", description = "Version, source and rules of the active snapshot")
    @APIResponse(
            responseCode = "200",
            description = "Ruleset status",
            content = @Content(schema = @Schema(implementation = RulesetStatus.class))
    )
    public Response rules() {
        return Response.ok(RulesetStatus.of(rulesetRegistry.current())).build();
    }

    @POST
    @Path("/rules/reload")
    @Consumes(MediaType.WILDCARD)
    @Operation(summary = "Reload rules", description = "Re-reads the rule document; keeps the previous rules on failure")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Rules reloaded"),
            @APIResponse(responseCode = "500", description = "Reload failed, previous rules still active")
    })
    public Response reload() {
        LOG.info("Rule reload requested");
        RulesetRegistry.ReloadResult result = rulesetRegistry.refresh();
        ReloadResponse response = ReloadResponse.of(result, rulesetRegistry.peek().size());
        if (result.success()) {
            return Response.ok(response).build();
        }
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR).entity(response).build();
    }

    @GET
    @Path("/rules/effectiveness")
    @Operation(summary = "Rule effectiveness", description = "Outcome statistics grouped by the rule that produced each recommendation")
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Statistics returned"),
            @APIResponse(responseCode = "503", description = "Outcome tracking unavailable")
    })
    public Response effectiveness() {
        try {
            return Response.ok(outcomeTracker.statsByRule()).build();
        } catch (RecommendationStoreException e) {
            LOG.errorf(e, "Rule effectiveness unavailable");
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("OUTCOME_UNAVAILABLE", "Outcome statistics are temporarily unavailable"))
                    .build();
        }
    }

    @GET
    @Path("/catalog/{id}")
    @Operation(summary = "Catalog entry", description = "Display metadata of one intervention")
    @APIResponses({
            @APIResponse(
                    responseCode = "200",
                    description = "Entry found",
                    content = @Content(schema = @Schema(implementation = CatalogEntry.class))
            ),
            @APIResponse(responseCode = "404", description = "Entry not found")
    })
    public Response catalogEntry(@PathParam("id") String id) {
        Optional<CatalogEntry> entry = catalogService.find(id);
        if (entry.isEmpty()) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(new ErrorResponse("CATALOG_ENTRY_NOT_FOUND", "No catalog entry: " + id))
                    .build();
        }
        return Response.ok(entry.get()).build();
    }

    @GET
    @Path("/metrics")
    @Operation(summary = "Engine metrics", description = "Counters and runtime information")
    @APIResponse(
            responseCode = "200",
            description = "Metrics returned",
            content = @Content(schema = @Schema(implementation = MetricsResponse.class))
    )
    public Response metrics() {
        Ruleset ruleset = rulesetRegistry.peek();
        Runtime runtime = Runtime.getRuntime();

        MetricsResponse metrics = new MetricsResponse();
        metrics.rulesetVersion = ruleset.getVersion();
        metrics.rulesLoaded = ruleset.size();
        metrics.catalogSize = catalogService.size();
        metrics.jvmUptime = ManagementFactory.getRuntimeMXBean().getUptime();
        metrics.jvmMemory = runtime.totalMemory() - runtime.freeMemory();
        metrics.engineCounters = engineMetrics.snapshot();
        return Response.ok(metrics).build();
    }
}
