package com.trendradar.radar.aggregate;

import com.trendradar.radar.model.AggregatedRecord;
import com.trendradar.radar.model.MatchedBatch;
import com.trendradar.radar.model.MatchedItem;
import com.trendradar.radar.model.RankObservation;
import com.trendradar.radar.model.RawItem;
import com.trendradar.radar.model.RecordIdentity;
import com.trendradar.radar.model.TimeWindow;
import com.trendradar.radar.util.TitleNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds matched items of successive rounds into one record per (platform, normalized title).
 */
@Component
public class RankHistoryAggregator {

    public List<AggregatedRecord> aggregate(List<MatchedBatch> batches) {
        Accumulator accumulator = newAccumulator();
        if (batches != null) {
            for (MatchedBatch batch : batches) {
                accumulator.accept(batch);
            }
        }
        return accumulator.records();
    }

    public Accumulator newAccumulator() {
        return new Accumulator();
    }

    /**
     * Running state for one run. Not thread-safe; rounds are fed in order.
     */
    public static final class Accumulator {
        private final Map<RecordIdentity, RecordBuilder> records = new LinkedHashMap<>();

        public void accept(MatchedBatch batch) {
            if (batch == null || batch.items() == null) {
                return;
            }
            for (MatchedItem matched : batch.items()) {
                RawItem item = matched.item();
                RecordIdentity identity = TitleNormalizer.identityOf(item.platformId(), item.title());
                RecordBuilder builder = records.get(identity);
                if (builder == null) {
                    builder = new RecordBuilder(identity, item, matched.keyword());
                    records.put(identity, builder);
                }
                builder.observe(item, batch.window());
            }
        }

        public int size() {
            return records.size();
        }

        public List<AggregatedRecord> records() {
            List<AggregatedRecord> out = new ArrayList<>(records.size());
            for (RecordBuilder builder : records.values()) {
                out.add(builder.build());
            }
            return out;
        }
    }

    private static final class RecordBuilder {
        private final RecordIdentity identity;
        private final String title;
        private final String platform;
        private final String keyword;
        private final List<RankObservation> observations = new ArrayList<>();
        private String url;
        private String mobileUrl;

        private RecordBuilder(RecordIdentity identity, RawItem first, String keyword) {
            this.identity = identity;
            this.title = first.title();
            this.platform = first.platformId();
            this.keyword = keyword;
        }

        private void observe(RawItem item, TimeWindow window) {
            if (isBlank(url) && !isBlank(item.url())) {
                url = item.url();
            }
            if (isBlank(mobileUrl) && !isBlank(item.mobileUrl())) {
                mobileUrl = item.mobileUrl();
            }
            observations.add(new RankObservation(item.rank(), window));
        }

        private AggregatedRecord build() {
            List<RankObservation> ordered = new ArrayList<>(observations);
            // stable sort keeps arrival order for equal window starts
            ordered.sort(Comparator.comparing(
                (RankObservation observation) -> observation.window().startedAt(),
                Comparator.nullsFirst(Comparator.naturalOrder())
            ));
            TimeWindow firstSeen = ordered.get(0).window();
            TimeWindow lastSeen = ordered.get(0).window();
            for (RankObservation observation : ordered) {
                TimeWindow window = observation.window();
                if (isBefore(window, firstSeen)) {
                    firstSeen = window;
                }
                if (!isBefore(window, lastSeen)) {
                    lastSeen = window;
                }
            }
            return new AggregatedRecord(
                identity,
                title,
                url,
                mobileUrl,
                platform,
                keyword,
                List.copyOf(ordered),
                firstSeen,
                lastSeen
            );
        }

        private static boolean isBefore(TimeWindow left, TimeWindow right) {
            if (left.startedAt() == null || right.startedAt() == null) {
                return left.round() < right.round();
            }
            return left.startedAt().isBefore(right.startedAt());
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
