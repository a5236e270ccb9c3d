package com.trendradar.radar.service;

import com.trendradar.radar.isolation.ExecutionIsolationManager;
import com.trendradar.radar.model.AggregatedRecord;
import com.trendradar.radar.model.ConfigSnapshot;
import com.trendradar.radar.model.ExecutionOutcome;
import com.trendradar.radar.model.PipelineOutput;
import com.trendradar.radar.model.ReducedReport;
import com.trendradar.radar.model.RunRequest;
import com.trendradar.radar.model.RunResult;
import com.trendradar.radar.model.RunStats;
import com.trendradar.radar.model.SearchOutcome;
import com.trendradar.radar.model.TaskDefinition;
import com.trendradar.radar.persistence.TaskStore;
import com.trendradar.radar.report.ReportArtifactWriter;
import com.trendradar.radar.report.ReportModeReducer;
import com.trendradar.radar.util.RunSignatures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

@Service
public class RadarSearchService {
    private static final Logger log = LoggerFactory.getLogger(RadarSearchService.class);

    private final RunRequestValidator validator;
    private final ExecutionIsolationManager isolationManager;
    private final RadarPipeline pipeline;
    private final ReportModeReducer reducer;
    private final ReportArtifactWriter artifactWriter;
    private final TaskStore taskStore;

    public RadarSearchService(
        RunRequestValidator validator,
        ExecutionIsolationManager isolationManager,
        RadarPipeline pipeline,
        ReportModeReducer reducer,
        ReportArtifactWriter artifactWriter,
        TaskStore taskStore
    ) {
        this.validator = validator;
        this.isolationManager = isolationManager;
        this.pipeline = pipeline;
        this.reducer = reducer;
        this.artifactWriter = artifactWriter;
        this.taskStore = taskStore;
    }

    /**
     * Runs one ad-hoc search. The request is validated before the execution lock is requested,
     * so a malformed request never touches the shared configuration.
     */
    public SearchOutcome search(RunRequest request, boolean generateReport, String label) {
        ConfigSnapshot override = validator.toOverride(request);
        long startedNanos = System.nanoTime();
        RunResult result = isolationManager.runIsolated(override, config -> execute(config, startedNanos));
        String artifactPath = generateReport ? artifactWriter.write(result, label) : null;
        return new SearchOutcome(result, artifactPath, null);
    }

    /**
     * Runs a stored task with a report artifact and records the execution, successful or not.
     */
    public SearchOutcome executeTask(String taskId) {
        TaskDefinition task = taskStore.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        long startedNanos = System.nanoTime();
        SearchOutcome outcome;
        try {
            outcome = search(RunRequest.fromTask(task), true, task.name());
        } catch (RuntimeException e) {
            recordFailure(taskId, e, elapsedMs(startedNanos));
            throw e;
        }
        RunResult result = outcome.result();
        long executionId = taskStore.recordExecution(
            taskId,
            ExecutionOutcome.success(outcome.artifactPath(), result.records().size(), result.durationMs())
        );
        log.info("Task {} executed: {} records, artifact {}", taskId, result.records().size(), outcome.artifactPath());
        return new SearchOutcome(result, outcome.artifactPath(), executionId);
    }

    private RunResult execute(ConfigSnapshot config, long startedNanos) {
        Instant runAt = Instant.now();
        PipelineOutput output = pipeline.run(config);
        String signature = RunSignatures.of(config);
        ReducedReport reduced = reducer.reduce(
            config.reportMode(),
            output.records(),
            output.finalRound(),
            signature,
            runAt
        );
        int matchedGroups = (int) reduced.records().stream()
            .map(AggregatedRecord::keyword)
            .distinct()
            .count();
        RunStats stats = new RunStats(
            output.totalRawItems(),
            matchedGroups,
            reduced.records().size(),
            output.platformsQueried(),
            output.platformsSucceeded()
        );
        long durationMs = elapsedMs(startedNanos);
        log.info(
            "Radar run finished mode={} records={} platforms={}/{} durationMs={}",
            config.reportMode().code(),
            reduced.records().size(),
            output.platformsSucceeded(),
            output.platformsQueried(),
            durationMs
        );
        return new RunResult(reduced.records(), stats, durationMs, config.reportMode(), signature, reduced.degraded());
    }

    private void recordFailure(String taskId, RuntimeException failure, long durationMs) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        try {
            taskStore.recordExecution(taskId, ExecutionOutcome.failed(message, durationMs));
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.warn("Could not record failed execution of task {}", taskId, e);
        }
        log.warn("Task {} execution failed: {}", taskId, message);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
