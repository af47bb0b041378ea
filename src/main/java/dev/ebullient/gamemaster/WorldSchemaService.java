package dev.ebullient.gamemaster;

import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.gamemaster.state.PathSchema;
import io.quarkus.runtime.Startup;

/**
 * Loads the world state schema once, at startup, so a broken schema fails fast.
 */
@Startup
@Singleton
public class WorldSchemaService {
    private static final Logger log = Logger.getLogger(WorldSchemaService.class);

    private final PathSchema schema;

    public WorldSchemaService() {
        schema = PathSchema.fromClasspath();
        log.infof("Loaded world state schema: %d domains, %d entity reference paths",
                schema.domains().size(), schema.references().size());
    }

    public PathSchema schema() {
        return schema;
    }
}
