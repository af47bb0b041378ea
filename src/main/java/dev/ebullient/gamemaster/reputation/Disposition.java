package dev.ebullient.gamemaster.reputation;

/**
 * @param value disposition on the -10..10 trust scale
 * @param tier human-readable tier label for the source that decided
 */
public record Disposition(int value, DispositionSource source, String tier) {

    public static final Disposition NEUTRAL = new Disposition(0, DispositionSource.DEFAULT, FactionStanding.NEUTRAL.label());
}
