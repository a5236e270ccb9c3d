package com.trendradar.radar.isolation;

import com.trendradar.radar.model.ConfigSnapshot;

import java.io.IOException;
import java.util.Optional;

/**
 * The one persisted configuration the fetch/match engine reads. Only
 * {@link ExecutionIsolationManager} writes it.
 */
public interface SharedConfigResource {

    ConfigSnapshot read() throws IOException;

    /**
     * Replaces all fields at once; readers never see a partially written snapshot.
     */
    void write(ConfigSnapshot snapshot) throws IOException;

    /**
     * Persists the backup taken before an override so a crash mid-execution leaves a trace.
     */
    void journalBackup(ConfigSnapshot backup) throws IOException;

    void clearJournal() throws IOException;

    Optional<ConfigSnapshot> readJournal() throws IOException;

    String describe();
}
