package alertmigrator.engine;

import alertmigrator.exceptions.AlertMigrationException;
import alertmigrator.metrics.MigrationMetrics;

import java.util.List;

/**
 * Result of a committed migration run.
 *
 * @param runId the run identifier
 * @param metrics counters and timings of the run
 * @param skipped alerts left out under the skip-and-report policy, in load order
 */
public record MigrationReport(long runId, MigrationMetrics metrics, List<AlertMigrationException> skipped) {

    public MigrationReport {
        skipped = List.copyOf(skipped);
    }

    public int rulesCreated() {
        return metrics.rulesCreated();
    }

    public int foldersCreated() {
        return metrics.foldersCreated();
    }

    public boolean isComplete() {
        return skipped.isEmpty();
    }
}
