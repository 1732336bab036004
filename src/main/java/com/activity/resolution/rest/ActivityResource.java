package com.activity.resolution.rest;

import com.activity.resolution.api.ActivityDetail;
import com.activity.resolution.api.ActivityQueryService;
import com.activity.resolution.api.ActivitySummary;
import com.activity.resolution.api.Page;
import com.activity.resolution.api.PageRequest;
import com.activity.resolution.core.exception.ValueParseException;
import com.activity.resolution.core.model.SourceSystem;
import com.activity.resolution.rest.dto.ActivityDetailResponse;
import com.activity.resolution.rest.dto.ActivityResponse;
import com.activity.resolution.rest.dto.ErrorResponse;
import com.activity.resolution.time.UtcTimestamps;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only REST resource over canonical activities.
 */
@Path("/api/v1/activities")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Activities", description = "Look up canonical activities and their source links")
public class ActivityResource {
    private static final Logger log = LoggerFactory.getLogger(ActivityResource.class);
    private static final String BASE = "/api/v1/activities";
    private static final String INTERNAL_ERROR = "An internal error occurred. Check server logs for details.";

    private final ActivityQueryService queries;

    @Inject
    public ActivityResource(ActivityQueryService queries) {
        this.queries = queries;
    }

    /**
     * GET /api/v1/activities?from=...&amp;to=...&amp;page=0&amp;size=50
     */
    @GET
    @Operation(summary = "List activities in a time range",
            description = "Activities whose UTC start lies in [from, to), ordered by start, with annotation and category path.")
    @APIResponse(responseCode = "200", description = "One page of activities")
    @APIResponse(responseCode = "400", description = "Missing or malformed range or paging parameters")
    public Response listActivities(
            @Parameter(description = "Inclusive UTC start, e.g. 2024-03-01T00:00:00Z") @QueryParam("from") String from,
            @Parameter(description = "Exclusive UTC end") @QueryParam("to") String to,
            @QueryParam("page") @DefaultValue("0") int page,
            @QueryParam("size") @DefaultValue("50") int size) {
        try {
            Instant fromInstant = requireInstant("from", from);
            Instant toInstant = requireInstant("to", to);
            Page<ActivitySummary> result = queries.findInRange(fromInstant, toInstant, PageRequest.of(page, size));
            Page<ActivityResponse> body = new Page<>(result.content().stream().map(ActivityResponse::from).toList(),
                    result.totalElements(), result.pageNumber(), result.pageSize());
            return Response.ok(body).build();
        } catch (IllegalArgumentException | ValueParseException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), BASE))
                    .build();
        } catch (RuntimeException e) {
            log.error("listActivities.failed from={} to={} error={}", from, to, e.getMessage(), e);
            return internalError(BASE);
        }
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get activity by id", description = "Returns the activity with its source links and annotations.")
    @APIResponse(responseCode = "200", description = "Activity found")
    @APIResponse(responseCode = "404", description = "Activity not found")
    public Response getActivity(@Parameter(description = "Canonical activity id") @PathParam("id") long id) {
        String path = BASE + "/" + id;
        try {
            Optional<ActivityDetail> detail = queries.findById(id);
            if (detail.isEmpty()) {
                return notFound("Activity not found: " + id, path);
            }
            return Response.ok(ActivityDetailResponse.from(detail.get())).build();
        } catch (RuntimeException e) {
            log.error("getActivity.failed id={} error={}", id, e.getMessage(), e);
            return internalError(path);
        }
    }

    @GET
    @Path("/{id}/native-ids")
    @Operation(summary = "Native ids of an activity", description = "Source rows linked to the activity, in annotation form.")
    public Response getNativeIds(@PathParam("id") long id) {
        String path = BASE + "/" + id + "/native-ids";
        try {
            if (queries.findById(id).isEmpty()) {
                return notFound("Activity not found: " + id, path);
            }
            return Response.ok(Map.of("activityId", id, "nativeIds", queries.findNativeIds(id))).build();
        } catch (RuntimeException e) {
            log.error("getNativeIds.failed id={} error={}", id, e.getMessage(), e);
            return internalError(path);
        }
    }

    @GET
    @Path("/by-source/{source}/{nativeId}")
    @Operation(summary = "Resolve a source row", description = "Canonical id of the activity a source row is linked to. Source is 'strava' or 'sporttracks'.")
    @APIResponse(responseCode = "404", description = "Row not linked")
    public Response findBySource(@PathParam("source") String source, @PathParam("nativeId") String nativeId) {
        String path = BASE + "/by-source/" + source + "/" + nativeId;
        Optional<SourceSystem> system = SourceSystem.fromCode(source);
        if (system.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest("Unknown source: " + source, path))
                    .build();
        }
        try {
            return queries.findCanonicalIdBySource(system.get(), nativeId)
                    .map(id -> Response.ok(Map.of("activityId", id)).build())
                    .orElseGet(() -> notFound("No activity linked to " + source + " " + nativeId, path));
        } catch (RuntimeException e) {
            log.error("findBySource.failed source={} nativeId={} error={}", source, nativeId, e.getMessage(), e);
            return internalError(path);
        }
    }

    @GET
    @Path("/by-annotation/{nativeId}")
    @Operation(summary = "Resolve an annotation", description = "Canonical id referenced by a training annotation.")
    @APIResponse(responseCode = "404", description = "Annotation missing or unlinked")
    public Response findByAnnotation(@PathParam("nativeId") String nativeId) {
        String path = BASE + "/by-annotation/" + nativeId;
        try {
            return queries.findCanonicalIdByAnnotation(nativeId)
                    .map(id -> Response.ok(Map.of("activityId", id)).build())
                    .orElseGet(() -> notFound("No activity linked to annotation " + nativeId, path));
        } catch (RuntimeException e) {
            log.error("findByAnnotation.failed nativeId={} error={}", nativeId, e.getMessage(), e);
            return internalError(path);
        }
    }

    private static Instant requireInstant(String name, String value) {
        Instant instant = UtcTimestamps.parse(value);
        if (instant == null) {
            throw new IllegalArgumentException("Query parameter '" + name + "' is required");
        }
        return instant;
    }

    private static Response notFound(String message, String path) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(ErrorResponse.notFound(message, path))
                .build();
    }

    private static Response internalError(String path) {
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(ErrorResponse.internalError(INTERNAL_ERROR, path))
                .build();
    }
}
