package com.trendradar.radar.report;

import com.trendradar.radar.model.AggregatedRecord;
import com.trendradar.radar.model.RankObservation;
import com.trendradar.radar.model.RecordIdentity;
import com.trendradar.radar.model.ReducedReport;
import com.trendradar.radar.model.ReportMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ReportModeReducer {
    private static final Logger log = LoggerFactory.getLogger(ReportModeReducer.class);

    private final RunHistoryStore historyStore;

    public ReportModeReducer(RunHistoryStore historyStore) {
        this.historyStore = historyStore;
    }

    /**
     * Selects the records to surface for {@code mode}. Incremental mode also merges this run's
     * identities into the history of {@code signature}; callers hold the execution lock.
     */
    public ReducedReport reduce(
        ReportMode mode,
        List<AggregatedRecord> records,
        int finalRound,
        String signature,
        Instant runAt
    ) {
        List<AggregatedRecord> safeRecords = records == null ? List.of() : records;
        return switch (mode == null ? ReportMode.CURRENT : mode) {
            case DAILY -> new ReducedReport(List.copyOf(safeRecords), false);
            case CURRENT -> new ReducedReport(selectCurrent(safeRecords, finalRound), false);
            case INCREMENTAL -> reduceIncremental(safeRecords, signature, runAt);
        };
    }

    List<AggregatedRecord> selectCurrent(List<AggregatedRecord> records, int finalRound) {
        List<AggregatedRecord> out = new ArrayList<>();
        for (AggregatedRecord record : records) {
            RankObservation latest = record.latestObservation();
            if (latest != null && latest.window().round() == finalRound) {
                out.add(record);
            }
        }
        return out;
    }

    private ReducedReport reduceIncremental(List<AggregatedRecord> records, String signature, Instant runAt) {
        Map<RecordIdentity, Instant> seen;
        boolean degraded = false;
        try {
            seen = historyStore.loadSeen(signature);
        } catch (HistoryCorruptException e) {
            log.warn("Run history for signature {} is unreadable; incremental report degrades to daily", signature, e);
            seen = null;
            degraded = true;
        }

        List<AggregatedRecord> selected;
        if (seen == null) {
            selected = List.copyOf(records);
        } else {
            selected = new ArrayList<>();
            for (AggregatedRecord record : records) {
                if (!seen.containsKey(record.identity())) {
                    selected.add(record);
                }
            }
        }

        Map<RecordIdentity, Instant> identities = new LinkedHashMap<>();
        for (AggregatedRecord record : records) {
            Instant firstSeen = record.firstSeen() == null ? null : record.firstSeen().startedAt();
            identities.put(record.identity(), firstSeen == null ? runAt : firstSeen);
        }
        if (identities.isEmpty()) {
            return new ReducedReport(selected, degraded);
        }
        try {
            historyStore.recordRun(signature, runAt, identities);
        } catch (RuntimeException e) {
            log.warn("Failed to record run history for signature {}", signature, e);
        }
        return new ReducedReport(selected, degraded);
    }
}
