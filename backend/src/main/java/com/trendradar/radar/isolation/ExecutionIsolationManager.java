package com.trendradar.radar.isolation;

import com.trendradar.radar.model.ConfigSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serialises every execution that needs the shared configuration swapped for its own.
 *
 * <p>Each execution backs up the live snapshot, writes its override, runs its body with the
 * override passed by value and writes the backup back before the lock is released. The lock is
 * fair, so waiting callers enter in arrival order. Restoration runs on success, failure and
 * interruption alike; if it fails, a {@link ConfigRestoreException} replaces the original failure,
 * which is attached as suppressed.
 *
 * <p>A process crash between override and restore leaves the override live together with the
 * backup journal; {@link com.trendradar.radar.service.StaleOverrideStartupCheck} reports it on restart.
 */
@Service
public class ExecutionIsolationManager {
    private static final Logger log = LoggerFactory.getLogger(ExecutionIsolationManager.class);

    private final SharedConfigResource resource;
    private final ReentrantLock executionLock = new ReentrantLock(true);

    // last known baseline; only assigned while holding executionLock
    private volatile ConfigSnapshot baseline;

    public ExecutionIsolationManager(SharedConfigResource resource) {
        this.resource = resource;
    }

    public <T> T runIsolated(ConfigSnapshot override, IsolatedBody<T> body) {
        Objects.requireNonNull(override, "override");
        Objects.requireNonNull(body, "body");
        if (executionLock.isLocked()) {
            log.info("Execution in flight; waiting behind {} queued", executionLock.getQueueLength());
        }
        try {
            executionLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IsolatedExecutionException("Interrupted while waiting for the execution lock", e);
        }
        try {
            return runLocked(override, body);
        } finally {
            executionLock.unlock();
        }
    }

    /**
     * Sets a new baseline. Waits for any in-flight execution so the new value is not overwritten
     * by that execution's restore.
     */
    public void replaceBaseline(ConfigSnapshot baseline) {
        Objects.requireNonNull(baseline, "baseline");
        executionLock.lock();
        try {
            resource.write(baseline);
            this.baseline = baseline;
            log.info("Shared configuration baseline replaced at {}", resource.describe());
        } catch (IOException | RuntimeException e) {
            throw new ConfigWriteException("baseline", "Failed to write configuration baseline", e);
        } finally {
            executionLock.unlock();
        }
    }

    /**
     * Returns the baseline, never an in-flight override. The first call before any execution or
     * replacement loads it from the resource under the execution lock.
     */
    public ConfigSnapshot currentBaseline() {
        ConfigSnapshot known = baseline;
        if (known != null) {
            return known;
        }
        executionLock.lock();
        try {
            if (baseline == null) {
                baseline = resource.read();
            }
            return baseline;
        } catch (IOException e) {
            throw new ConfigWriteException("read", "Failed to read shared configuration", e);
        } finally {
            executionLock.unlock();
        }
    }

    boolean isExecutionInFlight() {
        return executionLock.isLocked();
    }

    private <T> T runLocked(ConfigSnapshot override, IsolatedBody<T> body) {
        ConfigSnapshot backup;
        try {
            backup = resource.read();
        } catch (IOException | RuntimeException e) {
            throw new ConfigWriteException("backup", "Failed to back up shared configuration", e);
        }
        baseline = backup;

        try {
            resource.journalBackup(backup);
            resource.write(override);
        } catch (IOException | RuntimeException e) {
            ConfigWriteException failure = new ConfigWriteException("override", "Failed to write configuration override", e);
            restore(backup, failure);
            throw failure;
        }
        log.debug("Configuration override active at {}", resource.describe());

        Throwable failure = null;
        try {
            return body.run(override);
        } catch (RuntimeException | Error e) {
            failure = e;
            throw e;
        } catch (Exception e) {
            failure = e;
            throw new IsolatedExecutionException("Isolated execution failed: " + e.getMessage(), e);
        } finally {
            restore(backup, failure);
        }
    }

    private void restore(ConfigSnapshot backup, Throwable failure) {
        // interruptible file channels would abort the write while the flag is set
        boolean interrupted = Thread.interrupted();
        try {
            writeBackup(backup, failure);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void writeBackup(ConfigSnapshot backup, Throwable failure) {
        try {
            resource.write(backup);
        } catch (IOException | RuntimeException e) {
            ConfigRestoreException restoreFailure = new ConfigRestoreException(
                "Failed to restore shared configuration at " + resource.describe(),
                e
            );
            if (failure != null) {
                restoreFailure.addSuppressed(failure);
            }
            log.error("Shared configuration left overridden; backup journal kept for recovery", restoreFailure);
            throw restoreFailure;
        }
        try {
            resource.clearJournal();
        } catch (IOException | RuntimeException e) {
            log.warn("Configuration restored but backup journal could not be removed", e);
        }
        log.debug("Configuration restored at {}", resource.describe());
    }
}
