package dev.ebullient.gamemaster.state;

@FunctionalInterface
public interface StateListener {
    /** Called after a new version has been committed. */
    void committed(String campaignId, WorldState snapshot, ChangelogEntry entry);
}
