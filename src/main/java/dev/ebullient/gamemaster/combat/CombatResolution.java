package dev.ebullient.gamemaster.combat;

public record CombatResolution(
        String sessionId,
        CombatOutcome outcome,
        int xpAwarded,
        RewardStatus rewardStatus) {
}
