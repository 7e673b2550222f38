package alertmigrator.engine;

import alertmigrator.alert.MigrationAlertLogger;
import alertmigrator.config.FailurePolicy;
import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.AlertMigrationException;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.StoreException;
import alertmigrator.exceptions.UnresolvedDashboardException;
import alertmigrator.folder.FolderResolver;
import alertmigrator.folder.FolderStore;
import alertmigrator.metrics.MigrationMetrics;
import alertmigrator.metrics.MigrationMetrics.Phase;
import alertmigrator.metrics.MigrationMetricsCollector;
import alertmigrator.model.AlertRule;
import alertmigrator.model.Dashboard;
import alertmigrator.model.LegacyAlert;
import alertmigrator.model.OrgScopedId;
import alertmigrator.rule.CollisionRetry;
import alertmigrator.rule.RuleStore;
import alertmigrator.rule.RuleSynthesizer;
import alertmigrator.rule.UidGenerator;
import alertmigrator.state.MigrationState;
import alertmigrator.store.ReferenceStore;
import alertmigrator.translate.ConditionTranslator;
import alertmigrator.translate.TranslatedCondition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves dashboard alerts to unified alerting.
 *
 * <p>A run loads every legacy alert and the datasource and dashboard UID maps
 * once, then processes the alerts sequentially in load order:
 * <ol>
 *   <li>translate the condition</li>
 *   <li>look up the dashboard by UID</li>
 *   <li>validate the dashboard's parent folder</li>
 *   <li>resolve the destination folder</li>
 *   <li>build the rule and its first version</li>
 *   <li>insert the rule, retrying once with a UID suffix on collision</li>
 *   <li>insert the rule version</li>
 * </ol>
 *
 * <p>The run executes in a single transaction. With {@link FailurePolicy#ABORT}
 * (the default) the first failing alert rolls back everything. With
 * {@link FailurePolicy#SKIP_AND_REPORT} each alert runs in a savepoint; a
 * failing alert is rolled back alone and reported in
 * {@link MigrationReport#skipped()}. Store failures abort under both policies.
 *
 * <p>An instance runs once. Alerts share folder lookups, so they are never
 * processed concurrently.
 */
public final class AlertMigration {

    private static final Logger log = LoggerFactory.getLogger(AlertMigration.class);

    /** Name of this migration in the migration log. */
    public static final String NAME = "move dashboard alerts to unified alerting";

    private final TransactionalRun transactionalRun;
    private final ReferenceStore references;
    private final FolderStore folderStore;
    private final FolderResolver folders;
    private final ConditionTranslator translator;
    private final RuleSynthesizer synthesizer;
    private final RuleStore rules;
    private final CollisionRetry collisionRetry;
    private final FailurePolicy failurePolicy;
    private final MigrationState migrationState;
    private final MigrationMetricsCollector metrics;
    private final long runId = RunIds.next();

    private volatile RunState state = RunState.NOT_STARTED;

    private Map<OrgScopedId, String> datasourceRefs;
    private Map<OrgScopedId, String> dashboardRefs;

    public AlertMigration(JdbcTemplate jdbc,
                          PlatformTransactionManager txManager,
                          MigrationConfig config,
                          MigrationState migrationState) {
        this(jdbc, txManager, config, migrationState, new ObjectMapper(), UidGenerator.shortUids(), Clock.systemUTC());
    }

    public AlertMigration(JdbcTemplate jdbc,
                          PlatformTransactionManager txManager,
                          MigrationConfig config,
                          MigrationState migrationState,
                          ObjectMapper mapper,
                          UidGenerator uids,
                          Clock clock) {
        Objects.requireNonNull(jdbc, "jdbc");
        Objects.requireNonNull(config, "config");
        this.transactionalRun = new TransactionalRun(txManager);
        this.references = new ReferenceStore(jdbc, mapper);
        this.folderStore = new FolderStore(jdbc, mapper, clock);
        this.folders = new FolderResolver(folderStore, uids);
        this.translator = new ConditionTranslator(mapper, config.defaultIntervalSeconds());
        this.synthesizer = new RuleSynthesizer(uids, clock);
        this.rules = new RuleStore(jdbc, mapper);
        this.collisionRetry = new CollisionRetry(rules);
        this.failurePolicy = config.failurePolicy();
        this.migrationState = Objects.requireNonNull(migrationState, "migrationState");
        this.metrics = new MigrationMetricsCollector(clock);
    }

    public long runId() {
        return runId;
    }

    public RunState state() {
        return state;
    }

    /**
     * Runs the migration and commits it.
     *
     * @return the report of the committed run
     * @throws AlertMigrationException if an alert fails under the abort policy
     * @throws StoreException if the store fails
     */
    public MigrationReport execute() throws MigrateException {
        return execute(BeforeCommit.NONE);
    }

    /**
     * Runs the migration, then the hook, then commits.
     *
     * @param beforeCommit work joining the run's transaction, such as registering
     *                     the migration in the migration log
     * @return the report of the committed run
     * @throws IllegalStateException if this instance already ran
     */
    public MigrationReport execute(BeforeCommit beforeCommit) throws MigrateException {
        Objects.requireNonNull(beforeCommit, "beforeCommit");
        synchronized (this) {
            if (state != RunState.NOT_STARTED) {
                throw new IllegalStateException("migration run " + runId + " already " + state);
            }
            state = RunState.RUNNING;
        }

        migrationState.runStarted(runId, NAME);
        MigrationAlertLogger.migrationStarted(runId, NAME);
        metrics.start(runId, NAME);

        List<AlertMigrationException> skipped = new ArrayList<>();
        try {
            transactionalRun.execute(tx -> {
                migrateAll(tx, skipped);
                return null;
            }, beforeCommit);
        } catch (MigrateException | RuntimeException e) {
            state = RunState.ABORTED;
            MigrationMetrics partial = metrics.foldersCreated(folders.foldersCreated()).finish();
            MigrationAlertLogger.migrationFailed(runId, e, migrationState.getCurrentPhase());
            migrationState.runFailed(e, partial);
            throw e;
        }

        state = RunState.COMMITTED;
        MigrationMetrics result = metrics.foldersCreated(folders.foldersCreated()).finish();
        migrationState.runCompleted(result, skipped.stream().map(AlertMigrationException::getAlertId).toList());
        MigrationAlertLogger.migrationCompleted(runId, result);
        log.info("Alert migration committed: {}", result.summary());
        return new MigrationReport(runId, result, skipped);
    }

    private void migrateAll(TransactionStatus tx, List<AlertMigrationException> skipped) throws MigrateException {
        migrationState.setCurrentPhase(Phase.LOAD_REFERENCES);
        List<LegacyAlert> alerts = metrics.timed(Phase.LOAD_REFERENCES, () -> {
            List<LegacyAlert> loaded = references.loadLegacyAlerts();
            datasourceRefs = references.loadDatasourceRefs();
            dashboardRefs = references.loadDashboardRefs();
            return loaded;
        });
        metrics.alertsLoaded(alerts.size());
        log.debug("Loaded {} legacy alerts, {} datasources, {} dashboards",
                alerts.size(), datasourceRefs.size(), dashboardRefs.size());

        migrationState.setCurrentPhase(Phase.MIGRATE_ALERTS);
        metrics.timed(Phase.MIGRATE_ALERTS, () -> {
            for (LegacyAlert alert : alerts) {
                if (failurePolicy == FailurePolicy.SKIP_AND_REPORT) {
                    migrateOrSkip(alert, tx, skipped);
                } else {
                    migrateAlert(alert, tx);
                    folders.commitPending();
                }
            }
        });
    }

    private void migrateOrSkip(LegacyAlert alert, TransactionStatus tx, List<AlertMigrationException> skipped)
            throws AlertMigrationException {
        Object savepoint = tx.createSavepoint();
        try {
            migrateAlert(alert, tx);
        } catch (AlertMigrationException e) {
            if (e.isStoreFailure()) throw e;
            tx.rollbackToSavepoint(savepoint);
            folders.discardPending();
            skipped.add(e);
            metrics.alertSkipped();
            MigrationAlertLogger.alertSkipped(runId, e);
            return;
        }
        tx.releaseSavepoint(savepoint);
        folders.commitPending();
    }

    private void migrateAlert(LegacyAlert legacy, TransactionStatus tx) throws AlertMigrationException {
        try {
            TranslatedCondition condition = translator.translate(legacy.settings(), legacy.orgId(), datasourceRefs);

            String dashboardUid = dashboardRefs.get(OrgScopedId.of(legacy.orgId(), legacy.dashboardId()));
            if (dashboardUid == null) {
                throw new UnresolvedDashboardException(legacy.orgId(), legacy.dashboardId(), null);
            }
            LegacyAlert alert = legacy.withDashboardUid(dashboardUid);

            Dashboard dashboard = folderStore.findByUid(alert.orgId(), dashboardUid)
                    .orElseThrow(() -> new UnresolvedDashboardException(
                            alert.orgId(), alert.dashboardId(), dashboardUid));
            Dashboard parentFolder = folders.parentFolder(dashboard);
            Dashboard folder = folders.resolve(alert, dashboard, parentFolder);

            AlertRule rule = synthesizer.build(alert, condition, folder.uid());
            CollisionRetry.Insertion insertion = collisionRetry.insert(rule, tx);
            rules.insertVersion(insertion.rule().toVersion());

            metrics.ruleCreated(insertion.retried());
            if (insertion.retried()) {
                MigrationAlertLogger.ruleCollisionRetried(runId, alert.id(), insertion.rule().title());
            }
            MigrationAlertLogger.alertMigrated(runId, alert.id(), insertion.rule().uid(), folder.uid());
        } catch (MigrateException e) {
            throw new AlertMigrationException(legacy.id(), e);
        } catch (DataAccessException e) {
            throw new AlertMigrationException(legacy.id(), new StoreException("store failure", e));
        }
    }
}
