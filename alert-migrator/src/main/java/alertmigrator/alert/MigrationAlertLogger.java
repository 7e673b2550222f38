package alertmigrator.alert;

import alertmigrator.config.AlertLevel;
import alertmigrator.engine.RemovalReport;
import alertmigrator.exceptions.AlertMigrationException;
import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.metrics.MigrationMetrics.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Log entries use markers like MIGRATION_STARTED, ALERT_MIGRATED and
 * MIGRATION_FAILED with key=value pairs for easy parsing and alerting.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_STARTED id=1 name="move dashboard alerts to unified alerting"
 * 12:00:00.040 INFO  migration - ALERT_MIGRATED id=1 alert_id=7 rule_uid=k3Jd9aQzx folder_uid=pQ82mZa0c
 * 12:00:00.041 WARN  migration - RULE_COLLISION_RETRIED id=1 alert_id=8 title="CPU high k3Jd9aQzx"
 * 12:00:00.100 INFO  migration - MIGRATION_COMPLETED id=1 duration_ms=100 rules_created=2 folders_created=1 skipped=0
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void migrationStarted(long runId, String migrationName) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED id={} name=\"{}\"", runId, migrationName);
        }
    }

    public static void alertMigrated(long runId, long alertId, String ruleUid, String folderUid) {
        if (shouldLogInfo()) {
            log.info("ALERT_MIGRATED id={} alert_id={} rule_uid={} folder_uid={}", runId, alertId, ruleUid, folderUid);
        }
    }

    public static void ruleCollisionRetried(long runId, long alertId, String title) {
        if (shouldLogWarn()) {
            log.warn("RULE_COLLISION_RETRIED id={} alert_id={} title=\"{}\"", runId, alertId, title);
        }
    }

    public static void alertSkipped(long runId, AlertMigrationException error) {
        if (shouldLogWarn()) {
            log.warn("ALERT_SKIPPED id={} alert_id={} error=\"{}\"", runId, error.getAlertId(),
                    error.unwrap().getMessage());
        }
    }

    public static void migrationCompleted(long runId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED id={} duration_ms={} rules_created={} folders_created={} skipped={}",
                    runId,
                    metrics.totalDurationMs(),
                    metrics.rulesCreated(),
                    metrics.foldersCreated(),
                    metrics.alertsSkipped());
        }
    }

    /**
     * Log when a run fails. Always logged.
     *
     * @param runId the run identifier
     * @param error the error that caused the failure
     * @param currentPhase the phase during which failure occurred (may be null)
     */
    public static void migrationFailed(long runId, Throwable error, Phase currentPhase) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        String phaseName = currentPhase != null ? currentPhase.name() : "UNKNOWN";
        log.error("MIGRATION_FAILED id={} phase={} error=\"{}\"", runId, phaseName, errorMsg);
    }

    public static void removalCompleted(long runId, RemovalReport report) {
        if (shouldLogWarn()) {
            log.warn("REMOVAL_COMPLETED id={} rules={} versions={} folders={} acl_entries={} configurations={} instances={}",
                    runId, report.rules(), report.ruleVersions(), report.folders(), report.aclEntries(),
                    report.configurations(), report.instances());
        }
    }
}
