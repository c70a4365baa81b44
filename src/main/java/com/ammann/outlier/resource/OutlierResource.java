/* (C)2026 */
package com.ammann.outlier.resource;

import com.ammann.outlier.detection.DetectionResult;
import com.ammann.outlier.detection.SampleSeries;
import com.ammann.outlier.dto.AnalyzeRequestDTO;
import com.ammann.outlier.dto.DetectionResultDTO;
import com.ammann.outlier.dto.InconsistencyReportDTO;
import com.ammann.outlier.dto.OutlierReportDTO;
import com.ammann.outlier.dto.ScoreStatisticsDTO;
import com.ammann.outlier.enumeration.DetectionMethod;
import com.ammann.outlier.exception.ValidationException;
import com.ammann.outlier.properties.ApiProperties;
import com.ammann.outlier.service.OutlierDetectionService;
import com.ammann.outlier.service.ScoreAnalysisService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for outlier and inconsistency analysis of assessment scores.
 *
 * <p>Stored-score endpoints delegate to {@link ScoreAnalysisService}; {@code POST /analyze}
 * runs the detection engine directly on a caller-supplied series.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Outliers.BASE)
@Tag(name = "Outlier API", description = "Statistical outlier and inconsistency detection")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class OutlierResource {

    private static final Logger LOG = Logger.getLogger(OutlierResource.class);

    @Inject ScoreAnalysisService analysisService;

    @Inject OutlierDetectionService detectionService;

    @GET
    @Path(ApiProperties.Outliers.USER)
    @Operation(
            summary = "Detect outliers in a user's scores",
            description = "Analyses the user's score history in chronological order")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = OutlierReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Unknown detection method"),
        @APIResponse(responseCode = "404", description = "User has no scores")
    })
    public Response analyzeUser(
            @PathParam("username") String username,
            @Parameter(description = "zscore, iqr, modified_zscore, mad or ensemble")
                    @QueryParam("method")
                    @DefaultValue("ensemble")
                    String method) {
        LOG.debugf("User outlier request: username=%s, method=%s", username, method);
        OutlierReportDTO report =
                analysisService.analyzeUser(username, DetectionMethod.fromKey(method));
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Outliers.AGE_GROUP)
    @Operation(
            summary = "Detect outliers within an age group",
            description = "Analyses every score of the detailed age group")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = OutlierReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Unknown detection method"),
        @APIResponse(responseCode = "404", description = "Age group has no scores")
    })
    public Response analyzeAgeGroup(
            @PathParam("ageGroup") String ageGroup,
            @QueryParam("method") @DefaultValue("ensemble") String method) {
        LOG.debugf("Age group outlier request: ageGroup=%s, method=%s", ageGroup, method);
        OutlierReportDTO report =
                analysisService.analyzeAgeGroup(ageGroup, DetectionMethod.fromKey(method));
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Outliers.GLOBAL)
    @Operation(summary = "Detect outliers across all scores")
    public Response analyzeGlobal(@QueryParam("method") @DefaultValue("ensemble") String method) {
        OutlierReportDTO report = analysisService.analyzeGlobal(DetectionMethod.fromKey(method));
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Outliers.USER_INCONSISTENCY)
    @Operation(
            summary = "Detect inconsistent score trajectories",
            description =
                    "Flags abnormally large jumps between consecutive scores of the user within"
                            + " the last N days")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed (possibly with insufficient data)",
                content =
                        @Content(schema = @Schema(implementation = InconsistencyReportDTO.class))),
        @APIResponse(responseCode = "400", description = "Window out of range")
    })
    public Response analyzeInconsistency(
            @PathParam("username") String username,
            @Parameter(description = "Look-back window in days (1-3650)")
                    @QueryParam("days")
                    Integer days) {
        InconsistencyReportDTO report =
                days == null
                        ? analysisService.analyzeInconsistency(username)
                        : analysisService.analyzeInconsistency(username, days);
        return Response.ok(report).build();
    }

    @GET
    @Path(ApiProperties.Outliers.STATISTICS)
    @Operation(
            summary = "Statistical summary",
            description = "Descriptive statistics with quartiles for an age group or all scores")
    public Response statisticalSummary(@QueryParam("ageGroup") String ageGroup) {
        ScoreStatisticsDTO summary = analysisService.statisticalSummary(ageGroup);
        return Response.ok(summary).build();
    }

    @POST
    @Path(ApiProperties.Outliers.ANALYZE)
    @Operation(
            summary = "Analyse a supplied series",
            description = "Runs one detection method over the given values without storing them")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Analysis completed",
                content = @Content(schema = @Schema(implementation = DetectionResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Invalid method or parameter"),
        @APIResponse(responseCode = "422", description = "Series contains non-finite values")
    })
    public Response analyzeSeries(AnalyzeRequestDTO request) {
        if (request == null || request.values() == null) {
            throw ValidationException.invalidParameter("values", null, "array of numbers");
        }

        DetectionMethod method = DetectionMethod.fromKey(request.method());
        SampleSeries series = SampleSeries.ofValues(request.values());
        Double parameter =
                method == DetectionMethod.ENSEMBLE
                        ? request.consensusThreshold()
                        : request.threshold();

        DetectionResult result = detectionService.detect(method, series, parameter);
        return Response.ok(DetectionResultDTO.from(result)).build();
    }
}
