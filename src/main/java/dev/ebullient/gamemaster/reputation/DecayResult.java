package dev.ebullient.gamemaster.reputation;

public record DecayResult(int rumorsDropped, int driftPoints) {

    public static final DecayResult NONE = new DecayResult(0, 0);

    public boolean changed() {
        return rumorsDropped > 0 || driftPoints > 0;
    }

    DecayResult plus(DecayResult other) {
        return new DecayResult(rumorsDropped + other.rumorsDropped, driftPoints + other.driftPoints);
    }
}
