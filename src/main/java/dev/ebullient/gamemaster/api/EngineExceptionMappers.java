package dev.ebullient.gamemaster.api;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import dev.ebullient.gamemaster.CampaignNotFoundException;
import dev.ebullient.gamemaster.combat.InvalidCombatStateException;
import dev.ebullient.gamemaster.state.SchemaViolationException;
import dev.ebullient.gamemaster.state.StaleVersionException;
import dev.ebullient.gamemaster.state.UnknownDomainException;
import dev.ebullient.gamemaster.state.WorldStateException;
import io.quarkus.logging.Log;

/**
 * Turns engine rejections into JSON error bodies.
 */
public class EngineExceptionMappers {

    @ServerExceptionMapper
    public Response staleVersion(StaleVersionException e) {
        Log.warnf("Rejected stale update: %s", e.getMessage());
        return respond(Status.CONFLICT, "stale_version", e);
    }

    @ServerExceptionMapper
    public Response invalidCombatState(InvalidCombatStateException e) {
        Log.warnf("Rejected combat transition: %s", e.getMessage());
        return respond(Status.CONFLICT, "invalid_combat_state", e);
    }

    @ServerExceptionMapper
    public Response schemaViolation(SchemaViolationException e) {
        Log.warnf("Rejected patch: %s", e.getMessage());
        return Response.status(422)
                .entity(new ErrorResponse("schema_violation", e.getMessage(), e.path(), e.expected(), e.actual()))
                .build();
    }

    @ServerExceptionMapper
    public Response unknownDomain(UnknownDomainException e) {
        Log.warnf("Rejected patch: %s", e.getMessage());
        return respond(Status.BAD_REQUEST, "unknown_domain", e);
    }

    @ServerExceptionMapper
    public Response campaignNotFound(CampaignNotFoundException e) {
        return respond(Status.NOT_FOUND, "not_found", e);
    }

    @ServerExceptionMapper
    public Response illegalArgument(IllegalArgumentException e) {
        Log.warnf("Bad request: %s", e.getMessage());
        return Response.status(Status.BAD_REQUEST)
                .entity(ErrorResponse.of("bad_request", e.getMessage()))
                .build();
    }

    private static Response respond(Status status, String error, WorldStateException e) {
        return Response.status(status)
                .entity(new ErrorResponse(error, e.getMessage(), e.path(), null, null))
                .build();
    }
}
