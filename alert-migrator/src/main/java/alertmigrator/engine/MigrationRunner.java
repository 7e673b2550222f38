package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.StoreException;
import alertmigrator.rule.UidGenerator;
import alertmigrator.state.JdbcMigrationLog;
import alertmigrator.state.MigrationLog;
import alertmigrator.state.MigrationLogEntry;
import alertmigrator.state.MigrationState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Decides which of the two named migrations runs and runs it.
 *
 * <p>Nothing runs unless the operator acknowledged a backup. With unified
 * alerting enabled the forward migration runs once; with it disabled after a
 * forward run, the removal runs once. Each run registers its name in the
 * migration log inside its own transaction and clears the opposite entry
 * there too, so the toggle can be flipped back later.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationConfig config = MigrationConfigLoader.load();
 * MigrationRunner runner = new MigrationRunner(dataSource, config);
 * MigrationRunner.Outcome outcome = runner.run();
 * </pre>
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private static final TransactionDefinition NESTED =
            new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_NESTED);

    public enum Decision {
        /** Run the forward migration. */
        MIGRATE,
        /** Remove unified alerting data. */
        REMOVE,
        /** Nothing to do. */
        NONE
    }

    /**
     * Result of {@link #run()}. Exactly one of the reports is set when a
     * migration ran, none when the decision was {@link Decision#NONE}.
     */
    public record Outcome(Decision decision, MigrationReport migration, RemovalReport removal) {

        static Outcome none() {
            return new Outcome(Decision.NONE, null, null);
        }
    }

    private final JdbcTemplate jdbc;
    private final PlatformTransactionManager txManager;
    private final MigrationConfig config;
    private final MigrationLog migrationLog;
    private final MigrationState migrationState;
    private final ObjectMapper mapper;
    private final UidGenerator uids;
    private final Clock clock;

    public MigrationRunner(DataSource dataSource, MigrationConfig config) {
        this(new JdbcTemplate(dataSource), new DataSourceTransactionManager(dataSource), config);
    }

    private MigrationRunner(JdbcTemplate jdbc, PlatformTransactionManager txManager, MigrationConfig config) {
        this(jdbc, txManager, config, new JdbcMigrationLog(jdbc, Clock.systemUTC()),
                new MigrationState(config.historySize()), new ObjectMapper(), UidGenerator.shortUids(), Clock.systemUTC());
    }

    public MigrationRunner(JdbcTemplate jdbc,
                           PlatformTransactionManager txManager,
                           MigrationConfig config,
                           MigrationLog migrationLog,
                           MigrationState migrationState,
                           ObjectMapper mapper,
                           UidGenerator uids,
                           Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.txManager = Objects.requireNonNull(txManager, "txManager");
        this.config = Objects.requireNonNull(config, "config");
        this.migrationLog = Objects.requireNonNull(migrationLog, "migrationLog");
        this.migrationState = Objects.requireNonNull(migrationState, "migrationState");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.uids = Objects.requireNonNull(uids, "uids");
        this.clock = Objects.requireNonNull(clock, "clock");
        MigrationAlertLogger.setAlertLevel(config.alertLevel());
    }

    public MigrationState getMigrationState() {
        return migrationState;
    }

    /**
     * Decides what {@link #run()} would do, without side effects.
     *
     * @throws StoreException if the migration log cannot be read
     */
    public Decision decide() throws StoreException {
        if (!config.backupAcknowledged()) {
            return Decision.NONE;
        }
        Map<String, MigrationLogEntry> entries = migrationLog.entries();
        boolean migrated = entries.containsKey(AlertMigration.NAME);
        if (config.ngAlertEnabled()) {
            return migrated ? Decision.NONE : Decision.MIGRATE;
        }
        return migrated ? Decision.REMOVE : Decision.NONE;
    }

    /**
     * Runs the migration that {@link #decide()} selects.
     *
     * @throws MigrateException if the selected migration fails; its changes and
     *                          its log registration are rolled back
     */
    public Outcome run() throws MigrateException {
        if (!config.backupAcknowledged()) {
            log.info("Alert migration skipped: backup not acknowledged");
            return Outcome.none();
        }

        Decision decision = decide();
        switch (decision) {
            case MIGRATE: {
                AlertMigration migration = new AlertMigration(jdbc, txManager, config, migrationState, mapper, uids, clock);
                MigrationReport report = migration.execute(() -> record(AlertMigration.NAME, UnifiedAlertingRemoval.NAME));
                return new Outcome(decision, report, null);
            }
            case REMOVE: {
                UnifiedAlertingRemoval removal = new UnifiedAlertingRemoval(jdbc, txManager, migrationState, clock);
                RemovalReport report = removal.execute(() -> record(UnifiedAlertingRemoval.NAME, AlertMigration.NAME));
                return new Outcome(decision, null, report);
            }
            default:
                log.debug("No alert migration to run (ngAlertEnabled={})", config.ngAlertEnabled());
                return Outcome.none();
        }
    }

    // Runs inside the migration's transaction, right before commit. The clear
    // gets its own savepoint so a failed delete leaves the transaction usable.
    private void record(String executed, String opposite) throws StoreException {
        TransactionStatus savepoint;
        try {
            savepoint = txManager.getTransaction(NESTED);
        } catch (TransactionException e) {
            throw new StoreException("failed to create savepoint for migration log", e);
        }
        boolean cleared = false;
        try {
            migrationLog.clear(opposite);
            cleared = true;
        } catch (StoreException e) {
            log.error("Failed to clear migration log entry '{}', continuing", opposite, e);
        } finally {
            if (cleared) {
                txManager.commit(savepoint);
            } else {
                txManager.rollback(savepoint);
            }
        }
        migrationLog.register(executed);
    }
}
