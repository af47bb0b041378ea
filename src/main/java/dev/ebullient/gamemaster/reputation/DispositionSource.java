package dev.ebullient.gamemaster.reputation;

/**
 * Where a resolved disposition came from, in precedence order.
 */
public enum DispositionSource {
    TRUST_OVERRIDE,
    RELATIONSHIP,
    FACTION_STANDING,
    PUBLIC_NOTORIETY,
    DEFAULT
}
