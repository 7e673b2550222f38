package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.StoreException;
import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.metrics.MigrationMetrics.Phase;
import alertmigrator.metrics.MigrationMetricsCollector;
import alertmigrator.model.Dashboard;
import alertmigrator.state.MigrationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Deletes everything unified alerting owns, returning the store to its
 * pre-migration shape.
 *
 * <p>Deletion order is fixed: rule versions, rules, ACL entries of
 * synthesized folders, synthesized folders, alertmanager configurations and
 * alert instances. Everything runs in one transaction. Running it on a store
 * without unified alerting data deletes nothing and succeeds.
 */
public final class UnifiedAlertingRemoval {

    private static final Logger log = LoggerFactory.getLogger(UnifiedAlertingRemoval.class);

    /** Name of this migration in the migration log. */
    public static final String NAME = "remove unified alerting data";

    private static final String DELETE_FOLDER_ACL =
            "DELETE FROM dashboard_acl WHERE dashboard_id IN "
                    + "(SELECT id FROM dashboard WHERE created_by = ? AND is_folder = TRUE)";
    private static final String DELETE_FOLDERS =
            "DELETE FROM dashboard WHERE created_by = ? AND is_folder = TRUE";

    private final JdbcTemplate jdbc;
    private final TransactionalRun transactionalRun;
    private final MigrationState migrationState;
    private final MigrationMetricsCollector metrics;
    private final long runId = RunIds.next();

    private volatile RunState state = RunState.NOT_STARTED;

    public UnifiedAlertingRemoval(JdbcTemplate jdbc, PlatformTransactionManager txManager, MigrationState migrationState) {
        this(jdbc, txManager, migrationState, Clock.systemUTC());
    }

    public UnifiedAlertingRemoval(JdbcTemplate jdbc,
                                  PlatformTransactionManager txManager,
                                  MigrationState migrationState,
                                  Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.transactionalRun = new TransactionalRun(txManager);
        this.migrationState = Objects.requireNonNull(migrationState, "migrationState");
        this.metrics = new MigrationMetricsCollector(clock);
    }

    public long runId() {
        return runId;
    }

    public RunState state() {
        return state;
    }

    public RemovalReport execute() throws MigrateException {
        return execute(BeforeCommit.NONE);
    }

    /**
     * Deletes the unified alerting data, runs the hook and commits.
     *
     * @throws StoreException if a delete fails; nothing is deleted then
     * @throws IllegalStateException if this instance already ran
     */
    public RemovalReport execute(BeforeCommit beforeCommit) throws MigrateException {
        Objects.requireNonNull(beforeCommit, "beforeCommit");
        synchronized (this) {
            if (state != RunState.NOT_STARTED) {
                throw new IllegalStateException("removal run " + runId + " already " + state);
            }
            state = RunState.RUNNING;
        }

        migrationState.runStarted(runId, NAME);
        MigrationAlertLogger.migrationStarted(runId, NAME);
        metrics.start(runId, NAME);
        migrationState.setCurrentPhase(Phase.REMOVE_DATA);

        RemovalReport report;
        try {
            report = transactionalRun.execute(
                    tx -> metrics.timed(Phase.REMOVE_DATA, () -> {
                        return deleteAll();
                    }), beforeCommit);
        } catch (MigrateException | RuntimeException e) {
            state = RunState.ABORTED;
            MigrationAlertLogger.migrationFailed(runId, e, Phase.REMOVE_DATA);
            migrationState.runFailed(e, metrics.finish());
            throw e;
        }

        state = RunState.COMMITTED;
        MigrationMetrics result = metrics.rowsDeleted(report.total()).finish();
        migrationState.runCompleted(result, List.of());
        MigrationAlertLogger.removalCompleted(runId, report);
        return report;
    }

    private RemovalReport deleteAll() throws StoreException {
        try {
            int versions = jdbc.update("DELETE FROM alert_rule_version");
            int rules = jdbc.update("DELETE FROM alert_rule");
            int acl = jdbc.update(DELETE_FOLDER_ACL, Dashboard.FOLDER_CREATED_BY);
            int folders = jdbc.update(DELETE_FOLDERS, Dashboard.FOLDER_CREATED_BY);
            int configurations = jdbc.update("DELETE FROM alert_configuration");
            int instances = jdbc.update("DELETE FROM alert_instance");
            log.debug("Deleted {} rule versions, {} rules, {} acl entries, {} folders, {} configurations, {} instances",
                    versions, rules, acl, folders, configurations, instances);
            return new RemovalReport(versions, rules, acl, folders, configurations, instances);
        } catch (DataAccessException e) {
            throw new StoreException("failed to remove unified alerting data", e);
        }
    }
}
