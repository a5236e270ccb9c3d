package com.trendradar.radar.persistence;

import com.trendradar.radar.model.AggregatedRecord;
import com.trendradar.radar.model.RankObservation;
import com.trendradar.radar.model.RecordIdentity;
import com.trendradar.radar.model.ReducedReport;
import com.trendradar.radar.model.ReportMode;
import com.trendradar.radar.model.TimeWindow;
import com.trendradar.radar.report.ReportModeReducer;
import com.trendradar.radar.util.TitleNormalizer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcRunHistoryStoreTest {
    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    @Autowired
    private JdbcRunHistoryStore historyStore;

    @Test
    void seenIdentitiesAreScopedBySignatureWithEarliestFirstSeen() {
        String signature = UUID.randomUUID().toString().replace("-", "");
        RecordIdentity identity = new RecordIdentity("weibo", "openai发布ai模型");

        historyStore.recordRun(signature, T0, Map.of(identity, T0));
        historyStore.recordRun(signature, T0.plusSeconds(60), Map.of(identity, T0.plusSeconds(60)));

        assertThat(historyStore.loadSeen(signature)).containsEntry(identity, T0);
        assertThat(historyStore.loadSeen("other-" + signature)).isEmpty();
    }

    @Test
    void oldestRunsBeyondRetentionAreDropped() {
        String signature = UUID.randomUUID().toString().replace("-", "");
        RecordIdentity oldest = new RecordIdentity("weibo", "run-0");

        for (int i = 0; i < 5; i++) {
            historyStore.recordRun(
                signature,
                T0.plusSeconds(i * 60L),
                Map.of(new RecordIdentity("weibo", "run-" + i), T0.plusSeconds(i * 60L))
            );
        }

        assertThat(historyStore.countRuns(signature)).isEqualTo(3);
        Map<RecordIdentity, Instant> seen = historyStore.loadSeen(signature);
        assertThat(seen).doesNotContainKey(oldest).hasSize(3);
    }

    @Test
    void overlongTitlesAreRememberedAcrossIncrementalRuns() {
        String signature = UUID.randomUUID().toString().replace("-", "");
        ReportModeReducer reducer = new ReportModeReducer(historyStore);
        List<AggregatedRecord> records = List.of(record("AI芯片出口新规"), record("AI " + "长".repeat(1100)));

        ReducedReport first = reducer.reduce(ReportMode.INCREMENTAL, records, 1, signature, T0);
        ReducedReport second = reducer.reduce(ReportMode.INCREMENTAL, records, 1, signature, T0.plusSeconds(3600));

        assertThat(first.records()).hasSize(2);
        assertThat(second.records()).isEmpty();
        assertThat(historyStore.loadSeen(signature)).containsKeys(records.get(1).identity());
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    void failedItemInsertLeavesNoPartialRun() {
        String signature = UUID.randomUUID().toString().replace("-", "");
        Map<RecordIdentity, Instant> identities = new LinkedHashMap<>();
        identities.put(new RecordIdentity("weibo", "ai芯片出口新规"), T0);
        identities.put(new RecordIdentity(null, "missing platform"), T0);

        assertThatThrownBy(() -> historyStore.recordRun(signature, T0, identities))
            .isInstanceOf(DataAccessException.class);

        assertThat(historyStore.countRuns(signature)).isZero();
        assertThat(historyStore.loadSeen(signature)).isEmpty();
    }

    private static AggregatedRecord record(String title) {
        TimeWindow window = new TimeWindow(1, T0, T0.plusSeconds(5));
        return new AggregatedRecord(
            TitleNormalizer.identityOf("weibo", title),
            title,
            null,
            null,
            "weibo",
            "AI",
            List.of(new RankObservation(1, window)),
            window,
            window
        );
    }
}
