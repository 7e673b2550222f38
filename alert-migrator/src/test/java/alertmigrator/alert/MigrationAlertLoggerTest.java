package alertmigrator.alert;

import alertmigrator.config.AlertLevel;
import alertmigrator.engine.RemovalReport;
import alertmigrator.exceptions.AlertMigrationException;
import alertmigrator.exceptions.UnresolvedDatasourceException;
import alertmigrator.metrics.MigrationMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MigrationAlertLoggerTest {

    @AfterEach
    void resetLevel() {
        MigrationAlertLogger.setAlertLevel(AlertLevel.WARNING);
    }

    @Test
    void nullLevelFallsBackToWarning() {
        MigrationAlertLogger.setAlertLevel(AlertLevel.ERROR);
        MigrationAlertLogger.setAlertLevel(null);

        assertThat(MigrationAlertLogger.getAlertLevel()).isEqualTo(AlertLevel.WARNING);
    }

    @Test
    void eventsAreLoggedAtEveryLevel() {
        MigrationMetrics metrics = MigrationMetrics.builder().runId(1).migrationName("m").build();
        AlertMigrationException skipped = new AlertMigrationException(3, new UnresolvedDatasourceException(1, 9));

        for (AlertLevel level : AlertLevel.values()) {
            MigrationAlertLogger.setAlertLevel(level);
            assertThatCode(() -> {
                MigrationAlertLogger.migrationStarted(1, "m");
                MigrationAlertLogger.alertMigrated(1, 3, "r", "f");
                MigrationAlertLogger.ruleCollisionRetried(1, 3, "CPU r");
                MigrationAlertLogger.alertSkipped(1, skipped);
                MigrationAlertLogger.migrationCompleted(1, metrics);
                MigrationAlertLogger.removalCompleted(1, new RemovalReport(0, 0, 0, 0, 0, 0));
                MigrationAlertLogger.migrationFailed(1, null, null);
            }).doesNotThrowAnyException();
        }
    }
}
