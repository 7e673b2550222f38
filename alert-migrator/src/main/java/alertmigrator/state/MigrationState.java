package alertmigrator.state;

import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.metrics.MigrationMetrics.Phase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * What the alert migrations did in this process: the run in progress, its
 * phase, and a bounded history of finished runs, most recent first.
 *
 * <p>{@link alertmigrator.engine.AlertMigration} and
 * {@link alertmigrator.engine.UnifiedAlertingRemoval} write to it; monitoring
 * code may read it from any thread.
 */
public final class MigrationState {

    public enum Status {
        /** Nothing ran yet */
        IDLE,
        /** A run is executing */
        IN_PROGRESS,
        /** Last run committed */
        SUCCESS,
        /** Last run rolled back */
        FAILED
    }

    private final int maxHistorySize;
    private final Deque<MigrationHistoryEntry> history = new ArrayDeque<>();

    private Status status = Status.IDLE;
    private volatile Phase currentPhase;
    private long currentRunId;
    private String currentMigration;
    private String lastError;

    public MigrationState() {
        this(10);
    }

    /**
     * @param maxHistorySize number of finished runs to keep
     * @throws IllegalArgumentException if the size is not positive
     */
    public MigrationState(int maxHistorySize) {
        if (maxHistorySize <= 0) {
            throw new IllegalArgumentException("maxHistorySize must be positive: " + maxHistorySize);
        }
        this.maxHistorySize = maxHistorySize;
    }

    public synchronized void runStarted(long runId, String migrationName) {
        status = Status.IN_PROGRESS;
        currentRunId = runId;
        currentMigration = migrationName;
        currentPhase = null;
        lastError = null;
    }

    public void setCurrentPhase(Phase phase) {
        this.currentPhase = phase;
    }

    /**
     * Records a committed run.
     *
     * @param skippedAlertIds alerts the run left out, empty for removals
     */
    public synchronized void runCompleted(MigrationMetrics metrics, List<Long> skippedAlertIds) {
        status = Status.SUCCESS;
        currentPhase = null;
        record(MigrationHistoryEntry.committed(currentRunId, currentMigration, metrics, skippedAlertIds));
    }

    /**
     * Records a rolled back run.
     *
     * @param partialMetrics metrics collected before the failure, may be null
     */
    public synchronized void runFailed(Throwable error, MigrationMetrics partialMetrics) {
        status = Status.FAILED;
        currentPhase = null;
        lastError = error != null ? error.getMessage() : "Unknown error";
        record(MigrationHistoryEntry.failed(currentRunId, currentMigration, partialMetrics, lastError));
    }

    private void record(MigrationHistoryEntry entry) {
        history.addFirst(entry);
        if (history.size() > maxHistorySize) {
            history.removeLast();
        }
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    public synchronized Status getStatus() {
        return status;
    }

    public Phase getCurrentPhase() {
        return currentPhase;
    }

    public synchronized String getCurrentMigration() {
        return currentMigration;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized List<MigrationHistoryEntry> getHistory() {
        return List.copyOf(history);
    }

    /**
     * Returns the most recent committed run of the named migration still in
     * the history.
     */
    public synchronized Optional<MigrationHistoryEntry> lastCommitted(String migrationName) {
        return history.stream()
                .filter(e -> e.status() == Status.SUCCESS && e.migrationName().equals(migrationName))
                .findFirst();
    }

    /**
     * Legacy alerts skipped by the most recent committed run of the named
     * migration, in load order.
     */
    public List<Long> skippedAlertIds(String migrationName) {
        return lastCommitted(migrationName)
                .map(MigrationHistoryEntry::skippedAlertIds)
                .orElse(List.of());
    }
}
