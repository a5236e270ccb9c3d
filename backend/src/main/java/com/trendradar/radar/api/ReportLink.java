package com.trendradar.radar.api;

import com.trendradar.radar.model.AggregatedRecord;

import java.time.Instant;
import java.util.List;

/**
 * Link view of one aggregated record, returned when no report artifact is requested.
 */
public record ReportLink(
    String title,
    String url,
    String mobileUrl,
    String platform,
    String keyword,
    List<Integer> ranks,
    Instant firstSeenAt,
    Instant lastSeenAt
) {
    public static ReportLink from(AggregatedRecord record) {
        return new ReportLink(
            record.title(),
            record.url(),
            record.mobileUrl(),
            record.platform(),
            record.keyword(),
            record.ranks(),
            record.firstSeen() == null ? null : record.firstSeen().startedAt(),
            record.lastSeen() == null ? null : record.lastSeen().startedAt()
        );
    }
}
