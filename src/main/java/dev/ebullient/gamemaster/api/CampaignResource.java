package dev.ebullient.gamemaster.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.Response.Status;

import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.gamemaster.CampaignSessions;
import dev.ebullient.gamemaster.TurnProcessor;
import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.model.TurnRequest;
import dev.ebullient.gamemaster.model.TurnResult;
import dev.ebullient.gamemaster.reputation.Disposition;
import dev.ebullient.gamemaster.reputation.ReputationResolver;
import dev.ebullient.gamemaster.state.WorldState;
import io.quarkus.logging.Log;

@ApplicationScoped
@Path("/api/campaigns")
public class CampaignResource {

    @Inject
    CampaignSessions sessions;

    @Inject
    TurnProcessor turns;

    @Inject
    ReputationResolver reputation;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<Campaign> listCampaigns() {
        return sessions.listCampaigns();
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response createCampaign(JsonNode request) {
        String name = request.path("name").asText();
        if (name == null || name.isBlank()) {
            return Response.status(Status.BAD_REQUEST)
                    .entity(ErrorResponse.of("bad_request", "Name is required")).build();
        }
        Campaign campaign = sessions.createCampaign(name);
        return Response.status(Status.CREATED).entity(campaign).build();
    }

    @DELETE
    @Path("/{campaignId}")
    public Response deleteCampaign(@RestPath String campaignId) {
        return sessions.deleteCampaign(campaignId)
                ? Response.noContent().build()
                : Response.status(Status.NOT_FOUND).build();
    }

    @GET
    @Path("/{campaignId}/state")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> getState(@RestPath String campaignId) {
        return sessions.store(campaignId).snapshot().toDocument();
    }

    @GET
    @Path("/{campaignId}/state/{path}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response getStatePath(@RestPath String campaignId, @RestPath String path) {
        WorldState state = sessions.store(campaignId).snapshot();
        return state.get(path)
                .map(value -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("path", path);
                    body.put("version", state.version());
                    body.put("value", value);
                    return Response.ok(body).build();
                })
                .orElseGet(() -> Response.status(Status.NOT_FOUND)
                        .entity(ErrorResponse.of("not_found", "Nothing at " + path)).build());
    }

    @POST
    @Path("/{campaignId}/turns")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public TurnResult processTurn(@RestPath String campaignId, TurnRequest request) {
        TurnResult result = turns.processTurn(campaignId, request);
        Log.debugf("[%s] Turn committed at version %d", campaignId, result.version());
        return result;
    }

    @POST
    @Path("/{campaignId}/recovery")
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> applyRecovery(@RestPath String campaignId, String text) {
        WorldState state = turns.applyRecovery(campaignId, text);
        return state.toDocument();
    }

    @GET
    @Path("/{campaignId}/disposition")
    @Produces(MediaType.APPLICATION_JSON)
    public Disposition getDisposition(@RestPath String campaignId,
            @RestQuery String actor, @RestQuery String npc, @RestQuery String faction) {
        WorldState state = sessions.store(campaignId).snapshot();
        if (npc != null && !npc.isBlank()) {
            return faction == null || faction.isBlank()
                    ? reputation.resolveForNpc(state, actor, npc)
                    : reputation.resolve(state, actor, faction, npc);
        }
        return reputation.resolve(state, actor, faction);
    }
}
