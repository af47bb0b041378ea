package dev.ebullient.gamemaster;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.gamemaster.model.Campaign;
import dev.ebullient.gamemaster.state.ChangelogEntry;
import dev.ebullient.gamemaster.state.StateListener;
import dev.ebullient.gamemaster.state.WorldState;

/**
 * File persistence for campaigns: {@code <id>.json} holds the latest snapshot (with its
 * {@code game_state_version}), {@code <id>.changelog.jsonl} the append-only changelog.
 */
@Singleton
public class CampaignStateJournal implements StateListener {
    private static final Logger log = Logger.getLogger(CampaignStateJournal.class);

    private static final ConcurrentHashMap<String, Object> CAMPAIGN_LOCKS = new ConcurrentHashMap<>();

    static final String SNAPSHOT_SUFFIX = ".json";
    static final String CHANGELOG_SUFFIX = ".changelog.jsonl";
    static final String CAMPAIGN_NAME = "world_data.campaign_name";

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    @ConfigProperty(name = "gamemaster.state.dir", defaultValue = "${user.home}/.gamemaster")
    String stateDir;

    @Inject
    ObjectMapper objectMapper;

    private Path resolveStateDir() {
        Path dir = Path.of(stateDir);
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create state directory: " + dir, e);
            }
        }
        return dir;
    }

    Path snapshotPath(String campaignId) {
        return resolveStateDir().resolve(campaignId + SNAPSHOT_SUFFIX);
    }

    Path changelogPath(String campaignId) {
        return resolveStateDir().resolve(campaignId + CHANGELOG_SUFFIX);
    }

    public List<Campaign> listCampaigns() {
        Path dir = resolveStateDir();
        List<Campaign> campaigns = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.toString().endsWith(SNAPSHOT_SUFFIX))
                    .sorted(Comparator.comparing(Path::getFileName))
                    .forEach(p -> {
                        String filename = p.getFileName().toString();
                        String id = filename.substring(0, filename.length() - SNAPSHOT_SUFFIX.length());
                        load(id).ifPresent(state -> campaigns.add(toCampaign(id, state, p)));
                    });
        } catch (IOException e) {
            log.errorf(e, "Failed to list campaigns in %s", dir);
        }
        return campaigns;
    }

    /**
     * Write the first snapshot of a new campaign. Fails if the id is taken.
     */
    public Campaign createCampaign(String campaignId, WorldState initial) {
        Object lock = CAMPAIGN_LOCKS.computeIfAbsent(campaignId, k -> new Object());
        synchronized (lock) {
            Path path = snapshotPath(campaignId);
            try {
                Files.writeString(path, toJson(initial), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.infof("Created campaign state: %s", path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create campaign file: " + path, e);
            }
            return toCampaign(campaignId, initial, path);
        }
    }

    public boolean exists(String campaignId) {
        return Files.exists(snapshotPath(campaignId));
    }

    public Optional<WorldState> load(String campaignId) {
        Path path = snapshotPath(campaignId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            Map<String, Object> document = objectMapper.readValue(
                    Files.readString(path, StandardCharsets.UTF_8), DOCUMENT);
            return Optional.of(WorldState.fromDocument(document));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read campaign: " + campaignId, e);
        }
    }

    public void save(String campaignId, WorldState state) {
        Object lock = CAMPAIGN_LOCKS.computeIfAbsent(campaignId, k -> new Object());
        synchronized (lock) {
            Path path = snapshotPath(campaignId);
            Path temp = path.resolveSibling(path.getFileName() + ".tmp");
            try {
                Files.writeString(temp, toJson(state), StandardCharsets.UTF_8);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                log.errorf(e, "Failed to save campaign %s at version %d", campaignId, state.version());
                throw new UncheckedIOException("Failed to save campaign: " + campaignId, e);
            }
        }
    }

    public void appendChangelog(String campaignId, ChangelogEntry entry) {
        Object lock = CAMPAIGN_LOCKS.computeIfAbsent(campaignId, k -> new Object());
        synchronized (lock) {
            Path path = changelogPath(campaignId);
            try {
                Files.writeString(path, objectMapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                log.errorf(e, "Failed to append changelog for campaign %s", campaignId);
                throw new UncheckedIOException("Failed to append changelog: " + campaignId, e);
            }
        }
    }

    public List<ChangelogEntry> readChangelog(String campaignId) {
        Path path = changelogPath(campaignId);
        if (!Files.exists(path)) {
            return List.of();
        }
        List<ChangelogEntry> entries = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(objectMapper.readValue(line, ChangelogEntry.class));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read changelog: " + campaignId, e);
        }
        return entries;
    }

    /**
     * Persist every commit: snapshot first, then the changelog line.
     */
    @Override
    public void committed(String campaignId, WorldState snapshot, ChangelogEntry entry) {
        save(campaignId, snapshot);
        appendChangelog(campaignId, entry);
    }

    public boolean deleteCampaign(String campaignId) {
        Object lock = CAMPAIGN_LOCKS.computeIfAbsent(campaignId, k -> new Object());
        synchronized (lock) {
            Path path = snapshotPath(campaignId);
            if (!Files.exists(path)) {
                return false;
            }
            try {
                Files.delete(path);
                Files.deleteIfExists(changelogPath(campaignId));
                log.infof("Deleted campaign state: %s", path);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete campaign file: " + path, e);
            }
        }
        CAMPAIGN_LOCKS.remove(campaignId);
        return true;
    }

    public Campaign getCampaign(String campaignId) {
        Path path = snapshotPath(campaignId);
        return load(campaignId)
                .map(state -> toCampaign(campaignId, state, path))
                .orElse(null);
    }

    private Campaign toCampaign(String campaignId, WorldState state, Path path) {
        String name = state.getString(CAMPAIGN_NAME).orElse(campaignId);
        return new Campaign(campaignId, name, state.version(), path);
    }

    private String toJson(WorldState state) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state.toDocument());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("World state is not serializable", e);
        }
    }
}
