package com.trendradar.radar.isolation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.model.FilterSet;
import com.trendradar.radar.model.KeywordGroup;
import com.trendradar.radar.model.ReportMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionIsolationManagerTest {
    private static final ConfigSnapshot BASELINE = new ConfigSnapshot(
        List.of(KeywordGroup.of("baseline")),
        FilterSet.of(List.of("ad")),
        List.of("weibo", "zhihu"),
        ReportMode.DAILY
    );

    @TempDir
    Path tempDir;

    private FileSharedConfigResource resource;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException {
        ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        resource = new FileSharedConfigResource(tempDir.resolve("radar-config.json"), mapper);
        resource.write(BASELINE);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void bodySeesOverrideAndBaselineIsRestoredAfterwards() throws IOException {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);
        ConfigSnapshot override = override("AI");

        ConfigSnapshot seenInside = manager.runIsolated(override, active -> {
            assertThat(active).isEqualTo(override);
            return resource.read();
        });

        assertThat(seenInside).isEqualTo(override);
        assertThat(resource.read()).isEqualTo(BASELINE);
        assertThat(resource.readJournal()).isEmpty();
    }

    @Test
    void throwingBodyStillRestoresBaseline() throws IOException {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);
        List<ConfigSnapshot> inside = new ArrayList<>();

        assertThatThrownBy(() -> manager.runIsolated(override("AI"), active -> {
            inside.add(resource.read());
            throw new IllegalStateException("pipeline exploded");
        }))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("pipeline exploded");

        assertThat(inside).containsExactly(override("AI"));
        assertThat(resource.read()).isEqualTo(BASELINE);
        assertThat(manager.isExecutionInFlight()).isFalse();
    }

    @Test
    void checkedBodyFailureIsWrappedAndBaselineRestored() throws IOException {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);

        assertThatThrownBy(() -> manager.runIsolated(override("AI"), active -> {
            throw new IOException("socket closed");
        }))
            .isInstanceOf(IsolatedExecutionException.class)
            .hasCauseInstanceOf(IOException.class);

        assertThat(resource.read()).isEqualTo(BASELINE);
    }

    @Test
    void concurrentExecutionsNeverObserveAnotherOverride() throws Exception {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);
        int runs = 8;
        executor = Executors.newFixedThreadPool(runs);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        ConcurrentLinkedQueue<String> mismatches = new ConcurrentLinkedQueue<>();

        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < runs; i++) {
            ConfigSnapshot own = override("kw-" + i);
            futures.add(executor.submit(() -> {
                start.await();
                return manager.runIsolated(own, activeConfig -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    try {
                        Thread.sleep(5);
                        ConfigSnapshot persisted = resource.read();
                        if (!persisted.equals(own) || !activeConfig.equals(own)) {
                            mismatches.add(own.keywordGroups().get(0).label());
                        }
                        return own.keywordGroups().get(0).label();
                    } finally {
                        active.decrementAndGet();
                    }
                });
            }));
        }
        start.countDown();

        List<String> labels = new ArrayList<>();
        for (Future<String> future : futures) {
            labels.add(future.get(30, TimeUnit.SECONDS));
        }

        assertThat(labels).hasSize(runs).doesNotHaveDuplicates();
        assertThat(mismatches).isEmpty();
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(resource.read()).isEqualTo(BASELINE);
    }

    @Test
    void currentBaselineDuringExecutionIsTheBackupNotTheOverride() {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);

        ConfigSnapshot reported = manager.runIsolated(override("AI"), active -> manager.currentBaseline());

        assertThat(reported).isEqualTo(BASELINE);
        assertThat(manager.currentBaseline()).isEqualTo(BASELINE);
    }

    @Test
    void readerOnAnotherThreadSeesBaselineWhileOverrideIsLive() throws Exception {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);
        executor = Executors.newSingleThreadExecutor();

        ConfigSnapshot seenByReader = manager.runIsolated(override("AI"), active -> {
            assertThat(resource.read()).isEqualTo(override("AI"));
            return executor.submit(manager::currentBaseline).get(5, TimeUnit.SECONDS);
        });

        assertThat(seenByReader).isEqualTo(BASELINE);
    }

    @Test
    void slowFirstBaselineReadIsNotOverwrittenByQueuedExecution() throws Exception {
        PausingResource pausing = new PausingResource(resource);
        ExecutionIsolationManager manager = new ExecutionIsolationManager(pausing);
        executor = Executors.newFixedThreadPool(2);

        Future<ConfigSnapshot> reader = executor.submit(manager::currentBaseline);
        assertThat(pausing.firstReadEntered.await(5, TimeUnit.SECONDS)).isTrue();
        Future<ConfigSnapshot> execution = executor.submit(() -> manager.runIsolated(override("AI"), active -> active));
        Thread.sleep(50);
        pausing.releaseFirstRead.countDown();

        assertThat(reader.get(5, TimeUnit.SECONDS)).isEqualTo(BASELINE);
        assertThat(execution.get(5, TimeUnit.SECONDS)).isEqualTo(override("AI"));
        assertThat(manager.currentBaseline()).isEqualTo(BASELINE);
        assertThat(resource.read()).isEqualTo(BASELINE);
    }

    @Test
    void failedOverrideWriteSkipsBodyAndRestores() throws IOException {
        FlakyResource flaky = new FlakyResource(resource);
        flaky.failWriteNumber = 1;
        ExecutionIsolationManager manager = new ExecutionIsolationManager(flaky);
        AtomicBoolean bodyRan = new AtomicBoolean();

        assertThatThrownBy(() -> manager.runIsolated(override("AI"), active -> {
            bodyRan.set(true);
            return null;
        }))
            .isInstanceOf(ConfigWriteException.class)
            .satisfies(e -> assertThat(((ConfigWriteException) e).getStage()).isEqualTo("override"));

        assertThat(bodyRan).isFalse();
        assertThat(resource.read()).isEqualTo(BASELINE);
    }

    @Test
    void failedRestoreSurfacesRestoreErrorWithOriginalSuppressed() throws IOException {
        FlakyResource flaky = new FlakyResource(resource);
        flaky.failWriteNumber = 2;
        ExecutionIsolationManager manager = new ExecutionIsolationManager(flaky);

        assertThatThrownBy(() -> manager.runIsolated(override("AI"), active -> {
            throw new IllegalStateException("pipeline exploded");
        }))
            .isInstanceOf(ConfigRestoreException.class)
            .satisfies(e -> assertThat(e.getSuppressed())
                .singleElement()
                .isInstanceOf(IllegalStateException.class));

        assertThat(resource.readJournal()).contains(BASELINE);
        assertThat(manager.isExecutionInFlight()).isFalse();
    }

    @Test
    void interruptedBodyStillRestoresAndKeepsInterruptFlag() throws IOException {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);

        try {
            manager.runIsolated(override("AI"), active -> {
                Thread.currentThread().interrupt();
                return null;
            });
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(resource.read()).isEqualTo(BASELINE);
    }

    @Test
    void replaceBaselineBecomesWhatLaterExecutionsRestore() throws IOException {
        ExecutionIsolationManager manager = new ExecutionIsolationManager(resource);
        ConfigSnapshot replacement = new ConfigSnapshot(List.of(KeywordGroup.of("new")), null, List.of("baidu"), null);

        manager.replaceBaseline(replacement);
        manager.runIsolated(override("AI"), active -> null);

        assertThat(resource.read()).isEqualTo(replacement);
        assertThat(Files.exists(tempDir.resolve("radar-config.json.backup"))).isFalse();
    }

    private static ConfigSnapshot override(String keyword) {
        return new ConfigSnapshot(List.of(KeywordGroup.of(keyword)), FilterSet.EMPTY, List.of("baidu"), ReportMode.CURRENT);
    }

    /**
     * Blocks the first read until released.
     */
    private static final class PausingResource extends FlakyResource {
        private final CountDownLatch firstReadEntered = new CountDownLatch(1);
        private final CountDownLatch releaseFirstRead = new CountDownLatch(1);
        private final AtomicBoolean paused = new AtomicBoolean();

        private PausingResource(SharedConfigResource delegate) {
            super(delegate);
        }

        @Override
        public ConfigSnapshot read() throws IOException {
            ConfigSnapshot snapshot = super.read();
            if (paused.compareAndSet(false, true)) {
                firstReadEntered.countDown();
                try {
                    releaseFirstRead.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted while paused", e);
                }
            }
            return snapshot;
        }
    }

    /**
     * Delegates to a real file resource and fails the configured write call.
     */
    private static class FlakyResource implements SharedConfigResource {
        private final SharedConfigResource delegate;
        private final AtomicInteger writes = new AtomicInteger();
        private int failWriteNumber = -1;

        private FlakyResource(SharedConfigResource delegate) {
            this.delegate = delegate;
        }

        @Override
        public ConfigSnapshot read() throws IOException {
            return delegate.read();
        }

        @Override
        public void write(ConfigSnapshot snapshot) throws IOException {
            if (writes.incrementAndGet() == failWriteNumber) {
                throw new IOException("simulated write failure");
            }
            delegate.write(snapshot);
        }

        @Override
        public void journalBackup(ConfigSnapshot backup) throws IOException {
            delegate.journalBackup(backup);
        }

        @Override
        public void clearJournal() throws IOException {
            delegate.clearJournal();
        }

        @Override
        public Optional<ConfigSnapshot> readJournal() throws IOException {
            return delegate.readJournal();
        }

        @Override
        public String describe() {
            return delegate.describe();
        }
    }
}
