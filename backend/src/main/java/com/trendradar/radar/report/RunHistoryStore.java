package com.trendradar.radar.report;

import com.trendradar.radar.model.RecordIdentity;

import java.time.Instant;
import java.util.Map;

/**
 * Identities surfaced by previous runs, keyed by run signature.
 */
public interface RunHistoryStore {

    /**
     * Returns every identity seen in the retained runs of {@code signature} with its earliest
     * first-seen time.
     *
     * @throws HistoryCorruptException when the history cannot be read
     */
    Map<RecordIdentity, Instant> loadSeen(String signature);

    /**
     * Appends one run and prunes runs beyond the retention window for the signature.
     */
    void recordRun(String signature, Instant recordedAt, Map<RecordIdentity, Instant> identities);
}
