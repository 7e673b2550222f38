package alertmigrator.state;

import alertmigrator.metrics.MigrationMetrics;

import java.time.Instant;
import java.util.List;

/**
 * One finished run in the history kept by {@link MigrationState}.
 *
 * @param runId identifier of the run
 * @param migrationName name of the migration that ran
 * @param finishedAt end of the run, taken from its metrics when available
 * @param status SUCCESS or FAILED
 * @param metrics metrics of the run, partial when it failed
 * @param skippedAlertIds legacy alerts left out of a committed forward run
 * @param errorMessage failure message, null on success
 */
public record MigrationHistoryEntry(
        long runId,
        String migrationName,
        Instant finishedAt,
        MigrationState.Status status,
        MigrationMetrics metrics,
        List<Long> skippedAlertIds,
        String errorMessage
) {
    public MigrationHistoryEntry {
        skippedAlertIds = List.copyOf(skippedAlertIds);
    }

    static MigrationHistoryEntry committed(long runId, String migrationName, MigrationMetrics metrics,
                                           List<Long> skippedAlertIds) {
        return new MigrationHistoryEntry(runId, migrationName, finishedAt(metrics),
                MigrationState.Status.SUCCESS, metrics, skippedAlertIds, null);
    }

    static MigrationHistoryEntry failed(long runId, String migrationName, MigrationMetrics partialMetrics,
                                        String errorMessage) {
        return new MigrationHistoryEntry(runId, migrationName, finishedAt(partialMetrics),
                MigrationState.Status.FAILED, partialMetrics, List.of(), errorMessage);
    }

    private static Instant finishedAt(MigrationMetrics metrics) {
        return metrics != null && metrics.endTime() != null ? metrics.endTime() : Instant.now();
    }
}
