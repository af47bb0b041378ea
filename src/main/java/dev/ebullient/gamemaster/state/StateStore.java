package dev.ebullient.gamemaster.state;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import org.jboss.logging.Logger;

/**
 * The authoritative world state of one campaign.
 * <p>
 * Single writer: every mutation goes through {@link #apply(Patch)} (or the recovery and
 * rollback variants), which either commits the whole patch as version + 1 or throws and
 * leaves the current snapshot untouched. {@link #inTransaction(String, Function)} groups
 * several such mutations into one version.
 * <p>
 * Only the last {@code historyLimit} snapshots and changelog entries are kept in memory;
 * the full changelog belongs to the listeners.
 */
public class StateStore {
    private static final Logger log = Logger.getLogger(StateStore.class);

    private final String campaignId;
    private final PathSchema schema;
    private final PatchApplier applier;
    private final int historyLimit;

    private final Deque<WorldState> history = new ArrayDeque<>();
    private final Deque<ChangelogEntry> changelog = new ArrayDeque<>();
    private final List<StateListener> listeners = new CopyOnWriteArrayList<>();

    private WorldState current;
    private boolean staging;

    Clock clock = Clock.systemUTC();

    public StateStore(String campaignId, PathSchema schema, int historyLimit) {
        this(campaignId, schema, historyLimit, WorldState.initial(schema));
    }

    public StateStore(String campaignId, PathSchema schema, int historyLimit, WorldState initial) {
        this.campaignId = campaignId;
        this.schema = schema;
        this.applier = new PatchApplier(schema);
        this.historyLimit = Math.max(0, historyLimit);
        this.current = initial;
    }

    public String campaignId() {
        return campaignId;
    }

    public PathSchema schema() {
        return schema;
    }

    public synchronized WorldState snapshot() {
        return current;
    }

    public synchronized long version() {
        return current.version();
    }

    public Optional<Object> get(String path) {
        return snapshot().get(path);
    }

    /**
     * A retained earlier snapshot (or the current one).
     */
    public synchronized Optional<WorldState> snapshot(long version) {
        if (version == current.version()) {
            return Optional.of(current);
        }
        return history.stream().filter(s -> s.version() == version).findFirst();
    }

    public synchronized List<Long> retainedVersions() {
        return history.stream().map(WorldState::version).toList();
    }

    public synchronized List<ChangelogEntry> changelog() {
        return List.copyOf(changelog);
    }

    public void addListener(StateListener listener) {
        listeners.add(listener);
    }

    public synchronized WorldState apply(Patch patch) {
        requireVersion(patch.baseVersion());
        if (patch.isEmpty()) {
            return current;
        }
        Map<String, Object> tree = applier.apply(current.tree(), patch.ops(), patch.source());
        return commit(tree, new ChangelogEntry(current.version() + 1, patch.source(), patch.ops(), now(), null));
    }

    /**
     * Run {@code work} against a staging copy of this store and commit everything it applied
     * as a single version. Staged patches see the current version as their base, so engines
     * can keep using {@link Patch#against(WorldState)}. If {@code work} throws, nothing is committed.
     */
    public synchronized <T> T inTransaction(String note, Function<StateStore, T> work) {
        StateStore stage = new StateStore(campaignId, schema, 0, current);
        stage.staging = true;
        stage.clock = clock;

        T result = work.apply(stage);
        if (stage.changelog.isEmpty()) {
            return result;
        }
        List<PatchOp> ops = new ArrayList<>();
        PatchSource source = PatchSource.ENGINE;
        for (ChangelogEntry entry : stage.changelog) {
            ops.addAll(entry.ops());
            if (entry.source() == PatchSource.AUTHOR) {
                source = PatchSource.AUTHOR;
            }
        }
        log.debugf("[%s] Committing %d staged step(s) as one version", campaignId, stage.changelog.size());
        commit(stage.current.tree(), new ChangelogEntry(current.version() + 1, source, ops, now(), note));
        return result;
    }

    /**
     * Apply an out-of-band correction against whatever version is current.
     * Schema checks and all-or-nothing still hold.
     */
    public synchronized WorldState applyCorrection(List<PatchOp> ops) {
        if (ops.isEmpty()) {
            return current;
        }
        Map<String, Object> tree = applier.apply(current.tree(), ops);
        log.warnf("[%s] Applying correction at version %d:\n%s",
                campaignId, current.version(), PatchFormatter.describe(ops));
        return commit(tree, new ChangelogEntry(current.version() + 1, PatchSource.RECOVERY, ops, now(),
                "manual correction"));
    }

    /**
     * Re-commit the tree of a retained snapshot as a new version.
     */
    public synchronized WorldState rollback(long targetVersion, long expectedVersion) {
        requireVersion(expectedVersion);
        WorldState target = snapshot(targetVersion)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Version %d of campaign %s is no longer retained".formatted(targetVersion, campaignId)));
        List<PatchOp> ops = RecoveryDiff.ops(current.tree(), target.tree());
        log.warnf("[%s] Rolling back to the state of version %d", campaignId, targetVersion);
        return commit(target.tree(), new ChangelogEntry(current.version() + 1, PatchSource.ROLLBACK, ops, now(),
                "rollback to version " + targetVersion));
    }

    private void requireVersion(long baseVersion) {
        if (baseVersion != current.version()) {
            throw new StaleVersionException(baseVersion, current.version());
        }
    }

    private WorldState commit(Map<String, Object> tree, ChangelogEntry entry) {
        if (staging) {
            current = new WorldState(current.version(), tree);
            changelog.addLast(entry);
            return current;
        }
        WorldState next = new WorldState(entry.version(), tree);
        // listeners persist before the swap; a failing listener leaves this version uncommitted
        for (StateListener listener : listeners) {
            listener.committed(campaignId, next, entry);
        }
        if (historyLimit > 0) {
            history.addLast(current);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        changelog.addLast(entry);
        while (changelog.size() > Math.max(1, historyLimit)) {
            changelog.removeFirst();
        }
        current = next;
        log.infof("[%s] version %d (%s): %s", campaignId, next.version(), entry.source(),
                PatchFormatter.summary(entry.ops()));
        if (log.isDebugEnabled()) {
            log.debug(PatchFormatter.describe(entry.ops()));
        }
        return next;
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
