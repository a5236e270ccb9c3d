package com.trendradar.radar.service;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.isolation.SharedConfigResource;
import com.trendradar.radar.model.ConfigSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * Detects a backup journal left behind by a process that died while an override was live.
 */
@Component
public class StaleOverrideStartupCheck implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleOverrideStartupCheck.class);

    private final SharedConfigResource resource;
    private final RadarProperties properties;

    public StaleOverrideStartupCheck(SharedConfigResource resource, RadarProperties properties) {
        this.resource = resource;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Optional<ConfigSnapshot> journal;
        try {
            journal = resource.readJournal();
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read configuration backup journal at {}", resource.describe(), e);
            return;
        }
        if (journal.isEmpty()) {
            return;
        }
        if (!properties.getConfig().isRestoreStaleOverrideOnStartup()) {
            log.warn(
                "Configuration at {} may still hold an override from an interrupted execution; backup journal left in place",
                resource.describe()
            );
            return;
        }
        try {
            resource.write(journal.get());
            resource.clearJournal();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to restore configuration from backup journal", e);
        }
        log.info("Restored configuration at {} from backup journal", resource.describe());
    }
}
