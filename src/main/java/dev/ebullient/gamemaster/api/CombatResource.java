package dev.ebullient.gamemaster.api;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.resteasy.reactive.RestPath;

import com.fasterxml.jackson.annotation.JsonProperty;

import dev.ebullient.gamemaster.CampaignSessions;
import dev.ebullient.gamemaster.combat.CombatEngine;
import dev.ebullient.gamemaster.combat.CombatSession;
import dev.ebullient.gamemaster.combat.Combatant;
import dev.ebullient.gamemaster.combat.DamageType;
import io.quarkus.logging.Log;

@ApplicationScoped
@Path("/api/campaigns/{campaignId}/combat")
public class CombatResource {

    public record InitiativeRoll(@JsonProperty("actor_id") String actorId, int score) {
    }

    public record DamageRoll(@JsonProperty("actor_id") String actorId, int amount,
            @JsonProperty("damage_type") DamageType damageType) {
    }

    public record ActorRef(@JsonProperty("actor_id") String actorId) {
    }

    @Inject
    CampaignSessions sessions;

    @Inject
    CombatEngine combat;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public CombatSession getSession(@RestPath String campaignId) {
        return combat.session(sessions.store(campaignId).snapshot());
    }

    @POST
    @Path("/initiative")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public CombatSession setInitiative(@RestPath String campaignId, InitiativeRoll roll) {
        return combat.setInitiative(sessions.store(campaignId), roll.actorId(), roll.score());
    }

    @POST
    @Path("/damage")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Combatant applyDamage(@RestPath String campaignId, DamageRoll roll) {
        return combat.applyDamage(sessions.store(campaignId), roll.actorId(), roll.amount(), roll.damageType());
    }

    @POST
    @Path("/surrender")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Combatant surrender(@RestPath String campaignId, ActorRef actor) {
        return combat.markSurrendered(sessions.store(campaignId), actor.actorId());
    }

    @POST
    @Path("/advance")
    @Produces(MediaType.APPLICATION_JSON)
    public CombatSession advanceTurn(@RestPath String campaignId) {
        return combat.advanceTurn(sessions.store(campaignId));
    }

    @POST
    @Path("/archive")
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> archive(@RestPath String campaignId) {
        Map<String, Object> entry = combat.archive(sessions.store(campaignId));
        Log.debugf("[%s] Archived combat %s", campaignId, entry.get("session_id"));
        return entry;
    }
}
