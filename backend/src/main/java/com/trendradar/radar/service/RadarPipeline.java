package com.trendradar.radar.service;

import com.trendradar.config.RadarProperties;
import com.trendradar.radar.aggregate.RankHistoryAggregator;
import com.trendradar.radar.fetch.FetchException;
import com.trendradar.radar.fetch.PlatformFetchAdapter;
import com.trendradar.radar.match.KeywordMatcher;
import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.model.MatchedBatch;
import com.trendradar.radar.model.MatchedItem;
import com.trendradar.radar.model.PipelineOutput;
import com.trendradar.radar.model.RawItem;
import com.trendradar.radar.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetch, match and aggregate for one execution. Rounds run one after another; within a round
 * every platform is fetched concurrently and a failing platform contributes no items.
 */
@Service
public class RadarPipeline {
    private static final Logger log = LoggerFactory.getLogger(RadarPipeline.class);

    private final ExecutorService fetchExecutor;
    private final PlatformFetchAdapter fetchAdapter;
    private final KeywordMatcher matcher;
    private final RankHistoryAggregator aggregator;
    private final RadarProperties properties;

    public RadarPipeline(
        @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
        PlatformFetchAdapter fetchAdapter,
        KeywordMatcher matcher,
        RankHistoryAggregator aggregator,
        RadarProperties properties
    ) {
        this.fetchExecutor = fetchExecutor;
        this.fetchAdapter = fetchAdapter;
        this.matcher = matcher;
        this.aggregator = aggregator;
        this.properties = properties;
    }

    public PipelineOutput run(ConfigSnapshot config) {
        RadarProperties.Fetch fetch = properties.getFetch();
        int rounds = fetch.getRounds();
        List<String> platforms = config.platforms();
        Set<String> succeeded = new HashSet<>();
        RankHistoryAggregator.Accumulator accumulator = aggregator.newAccumulator();
        int totalRawItems = 0;

        for (int round = 1; round <= rounds; round++) {
            if (round > 1) {
                pause(fetch.getRoundIntervalMs());
            }
            Instant startedAt = Instant.now();
            List<RawItem> items = fetchRound(platforms, round, succeeded);
            TimeWindow window = new TimeWindow(round, startedAt, Instant.now());
            totalRawItems += items.size();

            List<MatchedItem> matched = matcher.match(items, config.keywordGroups(), config.filters());
            accumulator.accept(new MatchedBatch(window, matched));
            log.info(
                "Round {}/{} fetched {} items from {} platforms, {} matched",
                round,
                rounds,
                items.size(),
                platforms.size(),
                matched.size()
            );
        }

        return new PipelineOutput(accumulator.records(), rounds, totalRawItems, platforms.size(), succeeded.size());
    }

    private List<RawItem> fetchRound(List<String> platforms, int round, Set<String> succeeded) {
        RadarProperties.Fetch fetch = properties.getFetch();
        // plain futures so cancel(true) interrupts a fetch that outlives the deadline
        List<Future<List<RawItem>>> futures = new ArrayList<>();
        for (String platformId : platforms) {
            futures.add(fetchExecutor.submit(() -> fetchAdapter.fetch(platformId, round)));
        }

        int waves = Math.max(1, (platforms.size() + fetch.getConcurrency() - 1) / fetch.getConcurrency());
        long deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos((long) fetch.getTimeoutSeconds() * waves);

        List<RawItem> items = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String platformId = platforms.get(i);
            Future<List<RawItem>> future = futures.get(i);
            try {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                List<RawItem> fetched = future.get(remaining, TimeUnit.NANOSECONDS);
                items.addAll(fetched);
                succeeded.add(platformId);
            } catch (InterruptedException e) {
                futures.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                CancellationException cancelled = new CancellationException("Run cancelled while fetching " + platformId);
                cancelled.initCause(e);
                throw cancelled;
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Fetch of {} timed out in round {}", platformId, round);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof FetchException fetchException) {
                    log.warn("Fetch of {} failed in round {}: {}", platformId, round, fetchException.getMessage());
                } else {
                    log.warn("Fetch of {} failed in round {}", platformId, round, cause);
                }
            }
        }
        return items;
    }

    private void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Run cancelled between rounds");
            cancelled.initCause(e);
            throw cancelled;
        }
    }
}
