package com.activity.resolution.cdi;

import com.activity.resolution.api.ActivityQueryService;
import com.activity.resolution.api.ActivityResolver;
import com.activity.resolution.config.EngineConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * CDI producer that wires the activity resolution engine from MicroProfile Config.
 *
 * <p>The database path is required; every other key has the same default as the CLI:</p>
 * <pre>
 * activity-resolution:
 *   db:
 *     path: /data/training.db
 *   timezone:
 *     home-zone: America/Chicago
 * </pre>
 */
@ApplicationScoped
public class ActivityResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(ActivityResolutionProducer.class);

    @Inject
    @ConfigProperty(name = "activity-resolution.db.path")
    String databasePath;

    @Inject
    Config config;

    @Produces
    @ApplicationScoped
    public ActivityResolver activityResolver() {
        EngineConfig engineConfig = EngineConfig.from(config);
        log.info("Producing ActivityResolver: db={} homeZone={}", databasePath,
                engineConfig.getTimezoneOptions().getHomeZone());
        return ActivityResolver.builder()
                .sqlite(Path.of(databasePath))
                .timezoneOptions(engineConfig.getTimezoneOptions())
                .matchingOptions(engineConfig.getMatchingOptions())
                .detectorOptions(engineConfig.getDetectorOptions())
                .categoryCacheSize(engineConfig.getCategoryCacheSize())
                .build();
    }

    public void closeResolver(@Disposes ActivityResolver resolver) {
        log.info("Closing ActivityResolver");
        resolver.close();
    }

    @Produces
    @ApplicationScoped
    public ActivityQueryService activityQueryService(ActivityResolver resolver) {
        return resolver.queries();
    }
}
