package com.neurasense.jitai.resource;

import com.neurasense.jitai.config.DecisionConfig;
import com.neurasense.jitai.domain.CheckinObservation;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.outcome.OutcomeStats;
import com.neurasense.jitai.outcome.OutcomeTracker;
import com.neurasense.jitai.outcome.RecommendationStoreException;
import com.neurasense.jitai.resource.dto.DecisionRequest;
import com.neurasense.jitai.resource.dto.DecisionResponse;
import com.neurasense.jitai.resource.dto.ErrorResponse;
import com.neurasense.jitai.resource.dto.HealthResponse;
import com.neurasense.jitai.resource.dto.HistoryResponse;
import com.neurasense.jitai.resource.dto.OutcomeRequest;
import com.neurasense.jitai.resource.dto.OutcomeResponse;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import com.neurasense.jitai.service.DecisionService;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.RequestBody;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Path("/v1/decisions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Decisions", description = "Intervention decisions and outcome reporting")
public class DecisionResource {

    private static final Logger LOG = Logger.getLogger(DecisionResource.class);

    @Inject
    DecisionService decisionService;

    @Inject
    OutcomeTracker outcomeTracker;

    @Inject
    RulesetRegistry rulesetRegistry;

    @Inject
    DecisionConfig config;

    @Inject
    Clock clock;

    @POST
    @Operation(
            summary = "Decide interventions",
            description = "Builds the user's tailoring context, resolves the active rules and records one "
                    + "delivered recommendation per selected action"
    )
    @APIResponses({
            @APIResponse(
                    responseCode = "200",
                    description = "Decision made (check tracking_available for delivery logging)",
                    content = @Content(schema = @Schema(implementation = DecisionResponse.class))
            ),
            @APIResponse(responseCode = "400", description = "Invalid request")
    })
    public Response decide(
            @RequestBody(
                    description = "Decision point",
                    required = true,
                    content = @Content(schema = @Schema(implementation = DecisionRequest.class))
            )
            @Valid @NotNull DecisionRequest request) {

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Decision request: user=%s, checkin=%s, max_results=%s",
                    request.userId, request.checkin != null, request.maxResults);
        }

        CheckinObservation checkin = request.checkin != null
                ? request.checkin.toObservation(request.userId, clock.instant())
                : null;
        Decision decision = decisionService.decide(request.userId, checkin, request.maxResults);
        return Response.ok(DecisionResponse.from(decision)).build();
    }

    /**
     * Applies an outcome report. Unknown ids, another user's record and repeated reports
     * all get the same acknowledgement as an applied one.
     */
    @POST
    @Path("/outcome")
    @Operation(summary = "Report outcome", description = "Reports what the user did with a delivered recommendation")
    @APIResponses({
            @APIResponse(
                    responseCode = "200",
                    description = "Report acknowledged",
                    content = @Content(schema = @Schema(implementation = OutcomeResponse.class))
            ),
            @APIResponse(responseCode = "400", description = "Invalid status"),
            @APIResponse(responseCode = "503", description = "Outcome tracking unavailable")
    })
    public Response reportOutcome(@Valid @NotNull OutcomeRequest request) {
        Optional<RecommendationStatus> status = RecommendationStatus.fromReported(request.status);
        if (status.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(new ErrorResponse("INVALID_STATUS",
                            "status must be one of opened, completed, dismissed, abandoned"))
                    .build();
        }

        try {
            outcomeTracker.updateStatus(request.recommendationId, request.userId, status.get(), request.extras());
        } catch (RecommendationStoreException e) {
            LOG.errorf(e, "Outcome store unavailable for recommendation %s", request.recommendationId);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("OUTCOME_UNAVAILABLE", "Outcome tracking is temporarily unavailable"))
                    .build();
        }
        return Response.ok(OutcomeResponse.recorded()).build();
    }

    @GET
    @Path("/history/{userId}")
    @Operation(summary = "Recommendation history", description = "The user's most recent recommendations, newest first")
    @APIResponse(responseCode = "200", description = "History returned")
    public Response history(@PathParam("userId") String userId, @QueryParam("limit") Integer limit) {
        int effectiveLimit = limit != null && limit > 0 ? limit : config.historyLimit;
        try {
            List<RecommendationRecord> records = outcomeTracker.history(userId, effectiveLimit);
            return Response.ok(new HistoryResponse(userId, records)).build();
        } catch (RecommendationStoreException e) {
            LOG.errorf(e, "History unavailable for user %s", userId);
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("OUTCOME_UNAVAILABLE", "Recommendation history is temporarily unavailable"))
                    .build();
        }
    }

    @GET
    @Path("/stats")
    @Operation(summary = "Outcome statistics", description = "Status totals, completion and engagement rates")
    @APIResponse(
            responseCode = "200",
            description = "Statistics returned",
            content = @Content(schema = @Schema(implementation = OutcomeStats.class))
    )
    public Response stats(@QueryParam("user_id") String userId) {
        String filter = userId != null && !userId.isBlank() ? userId : null;
        try {
            return Response.ok(outcomeTracker.stats(filter)).build();
        } catch (RecommendationStoreException e) {
            LOG.errorf(e, "Outcome stats unavailable");
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(new ErrorResponse("OUTCOME_UNAVAILABLE", "Outcome statistics are temporarily unavailable"))
                    .build();
        }
    }

    @GET
    @Path("/health")
    @Operation(summary = "Service health", description = "Reports whether a rule snapshot is loaded")
    @APIResponse(responseCode = "200", description = "Service is healthy")
    public Response health() {
        Ruleset ruleset = rulesetRegistry.peek();
        return Response.ok(new HealthResponse("UP", ruleset.size())).build();
    }
}
