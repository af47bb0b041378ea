package dev.ebullient.gamemaster.combat;

public enum RewardStatus {
    /** XP computed and committed with the terminal transition */
    APPLIED,
    /** the session was already processed; nothing changed */
    DUPLICATE,
    /** fled: no rewards */
    NONE
}
