package alertmigrator.engine;

import alertmigrator.TestDatabase;
import alertmigrator.config.FailurePolicy;
import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.AlertMigrationException;
import alertmigrator.exceptions.InvalidAlertSettingsException;
import alertmigrator.exceptions.InvalidFolderReferenceException;
import alertmigrator.exceptions.RuleCollisionException;
import alertmigrator.exceptions.StoreException;
import alertmigrator.exceptions.UnresolvedDashboardException;
import alertmigrator.exceptions.UnresolvedDatasourceException;
import alertmigrator.folder.FolderResolver;
import alertmigrator.model.AclEntry;
import alertmigrator.rule.UidGenerator;
import alertmigrator.state.MigrationState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static alertmigrator.TestDatabase.settings;
import static org.assertj.core.api.Assertions.*;

@DisplayName("AlertMigration")
class AlertMigrationTest {

    private static final long ORG = 1;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper mapper = new ObjectMapper();
    private TestDatabase db;
    private MigrationState migrationState;
    private long datasourceId;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        migrationState = new MigrationState();
        datasourceId = db.insertDatasource(ORG, "prom");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private static UidGenerator sequentialUids() {
        AtomicInteger n = new AtomicInteger();
        return () -> "uid" + n.incrementAndGet();
    }

    private AlertMigration migration(FailurePolicy policy, UidGenerator uids) {
        MigrationConfig config = MigrationConfig.builder().failurePolicy(policy).build();
        return new AlertMigration(db.jdbc(), db.txManager(), config, migrationState, mapper, uids, CLOCK);
    }

    private AlertMigration migration() {
        return migration(FailurePolicy.ABORT, sequentialUids());
    }

    private int migratedFolders() {
        Integer n = db.jdbc().queryForObject(
                "SELECT COUNT(*) FROM dashboard WHERE created_by = -8 AND is_folder = TRUE", Integer.class);
        return n == null ? 0 : n;
    }

    @Nested
    @DisplayName("single alert")
    class SingleAlert {

        @Test
        void rootDashboardAlertLandsInGeneralAlerting() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            long alertId = db.insertAlert(ORG, dash, 2, "High CPU", "CPU is high", settings(datasourceId, 80));

            MigrationReport report = migration().execute();

            assertThat(report.rulesCreated()).isEqualTo(1);
            assertThat(report.foldersCreated()).isEqualTo(1);
            assertThat(report.isComplete()).isTrue();

            Map<String, Object> folder = db.rows("SELECT * FROM dashboard WHERE created_by = -8").get(0);
            assertThat(folder.get("TITLE")).isEqualTo(FolderResolver.GENERAL_FOLDER);
            assertThat(folder.get("UID")).isEqualTo("uid1");
            assertThat(folder.get("IS_FOLDER")).isEqualTo(true);
            assertThat(folder.get("HAS_ACL")).isEqualTo(false);

            Map<String, Object> rule = db.rows("SELECT * FROM alert_rule").get(0);
            assertThat(rule.get("UID")).isEqualTo("uid2");
            assertThat(rule.get("NAMESPACE_UID")).isEqualTo("uid1");
            assertThat(rule.get("TITLE")).isEqualTo("High CPU");
            assertThat(rule.get("RULE_GROUP")).isEqualTo("High CPU");
            assertThat(rule.get("CONDITION")).isEqualTo("B");
            assertThat(rule.get("INTERVAL_SECONDS")).isEqualTo(60L);
            assertThat(rule.get("FOR_DURATION")).isEqualTo(300L);
            assertThat(rule.get("NO_DATA_STATE")).isEqualTo("NoData");
            assertThat(rule.get("EXEC_ERR_STATE")).isEqualTo("Alerting");
            assertThat(rule.get("DASHBOARD_UID")).isEqualTo("dash");
            assertThat(rule.get("PANEL_ID")).isEqualTo(2L);
            assertThat(rule.get("CREATED_BY")).isEqualTo(-8L);

            JsonNode annotations = mapper.readTree((String) rule.get("ANNOTATIONS"));
            assertThat(annotations.path("__alertId__").asText()).isEqualTo(Long.toString(alertId));
            assertThat(annotations.path("__dashboardUid__").asText()).isEqualTo("dash");
            assertThat(annotations.path("message").asText()).isEqualTo("CPU is high");
            assertThat(mapper.readTree((String) rule.get("LABELS")).path("team").asText()).isEqualTo("infra");

            JsonNode data = mapper.readTree((String) rule.get("DATA"));
            assertThat(data).hasSize(2);
            assertThat(data.get(0).path("datasourceUid").asText()).isEqualTo("prom");
            assertThat(data.get(1).path("model").path("type").asText()).isEqualTo("classic_conditions");

            Map<String, Object> version = db.rows("SELECT * FROM alert_rule_version").get(0);
            assertThat(version.get("RULE_UID")).isEqualTo("uid2");
            assertThat(version.get("VERSION")).isEqualTo(1);
            assertThat(version.get("PARENT_VERSION")).isEqualTo(0);
        }

        @Test
        void dashboardInFolderUsesThatFolder() throws Exception {
            long folder = db.insertFolder(ORG, "team", "Team");
            long dash = db.insertDashboard(ORG, "dash", "Servers", folder);
            db.insertAlert(ORG, dash, 2, "High CPU", "", settings(datasourceId, 80));

            MigrationReport report = migration().execute();

            assertThat(report.foldersCreated()).isZero();
            assertThat(migratedFolders()).isZero();
            assertThat(db.rows("SELECT namespace_uid FROM alert_rule"))
                    .extracting(row -> row.get("NAMESPACE_UID")).containsExactly("team");
            JsonNode annotations = mapper.readTree(
                    (String) db.rows("SELECT annotations FROM alert_rule").get(0).get("ANNOTATIONS"));
            assertThat(annotations.has("message")).isFalse();
        }

        @Test
        void dashboardWithAclGetsFolderWithEqualAcl() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            db.grant(AclEntry.forUser(ORG, dash, 42, AclEntry.PERMISSION_EDIT));
            db.grant(AclEntry.forTeam(ORG, dash, 7, AclEntry.PERMISSION_ADMIN));
            long alertId = db.insertAlert(ORG, dash, 3, "Disk", "", settings(datasourceId, 90));

            migration().execute();

            Map<String, Object> folder = db.rows("SELECT * FROM dashboard WHERE created_by = -8").get(0);
            assertThat(folder.get("TITLE")).isEqualTo("Migrated dashUID:dash panelId:3 alertId:" + alertId);
            assertThat(folder.get("HAS_ACL")).isEqualTo(true);

            List<String> folderAcl = grants((Long) folder.get("ID"));
            assertThat(folderAcl).containsExactlyInAnyOrder(
                    "user:42:2", "team:7:4", "role:Viewer:1", "role:Editor:2");
            assertThat(grants(dash)).containsExactlyInAnyOrder("user:42:2", "team:7:4");
        }

        @Test
        void dashboardWithAclInheritsParentFolderAcl() throws Exception {
            long parent = db.insertFolder(ORG, "team", "Team");
            db.grant(AclEntry.forRole(ORG, parent, "Admin", AclEntry.PERMISSION_ADMIN));
            long dash = db.insertDashboard(ORG, "dash", "Servers", parent);
            db.grant(AclEntry.forUser(ORG, dash, 42, AclEntry.PERMISSION_VIEW));
            db.insertAlert(ORG, dash, 3, "Disk", "", settings(datasourceId, 90));

            migration().execute();

            long folderId = db.jdbc().queryForObject(
                    "SELECT id FROM dashboard WHERE created_by = -8", Long.class);
            assertThat(grants(folderId)).containsExactlyInAnyOrder("user:42:1", "role:Admin:4");
        }

        private List<String> grants(long dashboardId) {
            List<String> grants = new ArrayList<>();
            for (Map<String, Object> row : db.rows(
                    "SELECT user_id, team_id, role, permission FROM dashboard_acl WHERE dashboard_id = ?", dashboardId)) {
                String principal = row.get("USER_ID") != null ? "user:" + row.get("USER_ID")
                        : row.get("TEAM_ID") != null ? "team:" + row.get("TEAM_ID")
                        : "role:" + row.get("ROLE");
                grants.add(principal + ":" + row.get("PERMISSION"));
            }
            return grants;
        }
    }

    @Nested
    @DisplayName("several alerts")
    class SeveralAlerts {

        @Test
        void rootDashboardsShareOneGeneralAlertingFolderPerOrganisation() throws Exception {
            long other = db.insertDatasource(2, "prom2");
            long dash1 = db.insertDashboard(ORG, "d1", "One", 0);
            long dash2 = db.insertDashboard(ORG, "d2", "Two", 0);
            long dash3 = db.insertDashboard(2, "d3", "Three", 0);
            db.insertAlert(ORG, dash1, 1, "A1", "", settings(datasourceId, 1));
            db.insertAlert(ORG, dash2, 1, "A2", "", settings(datasourceId, 2));
            db.insertAlert(2, dash3, 1, "A3", "", settings(other, 3));

            MigrationReport report = migration().execute();

            assertThat(report.rulesCreated()).isEqualTo(3);
            assertThat(report.foldersCreated()).isEqualTo(2);
            assertThat(db.rows("SELECT org_id FROM dashboard WHERE title = ?", FolderResolver.GENERAL_FOLDER))
                    .extracting(row -> row.get("ORG_ID")).containsExactlyInAnyOrder(1L, 2L);
            assertThat(db.count("alert_rule_version")).isEqualTo(3);
        }

        @Test
        void existingGeneralAlertingFolderIsReused() throws Exception {
            db.insertFolder(ORG, "general", FolderResolver.GENERAL_FOLDER);
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            db.insertAlert(ORG, dash, 1, "A1", "", settings(datasourceId, 1));

            MigrationReport report = migration().execute();

            assertThat(report.foldersCreated()).isZero();
            assertThat(db.rows("SELECT namespace_uid FROM alert_rule"))
                    .extracting(row -> row.get("NAMESPACE_UID")).containsExactly("general");
        }

        @Test
        void sameTitleInFolderIsRetriedWithUidSuffix() throws Exception {
            long folder = db.insertFolder(ORG, "team", "Team");
            long dash = db.insertDashboard(ORG, "dash", "Servers", folder);
            db.insertAlert(ORG, dash, 1, "CPU", "", settings(datasourceId, 80));
            db.insertAlert(ORG, dash, 2, "CPU", "", settings(datasourceId, 90));

            MigrationReport report = migration().execute();

            assertThat(report.rulesCreated()).isEqualTo(2);
            assertThat(report.metrics().collisionsRetried()).isEqualTo(1);
            assertThat(db.rows("SELECT title, rule_group FROM alert_rule ORDER BY id"))
                    .extracting(row -> row.get("TITLE") + "|" + row.get("RULE_GROUP"))
                    .containsExactly("CPU|CPU", "CPU uid2|CPU uid2");
            assertThat(db.rows("SELECT title FROM alert_rule_version ORDER BY id"))
                    .extracting(row -> row.get("TITLE")).containsExactly("CPU", "CPU uid2");
        }
    }

    @Nested
    @DisplayName("abort policy")
    class AbortPolicy {

        @Test
        void unresolvedDatasourceRollsBackEverything() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            db.insertAlert(ORG, dash, 1, "Good", "", settings(datasourceId, 1));
            long bad = db.insertAlert(ORG, dash, 2, "Bad", "", settings(999, 1));
            AlertMigration migration = migration();

            assertThatThrownBy(migration::execute)
                    .isInstanceOfSatisfying(AlertMigrationException.class, e -> {
                        assertThat(e.getAlertId()).isEqualTo(bad);
                        assertThat(e.unwrap()).isInstanceOfSatisfying(UnresolvedDatasourceException.class,
                                ds -> assertThat(ds.getDatasourceId()).isEqualTo(999));
                    });

            assertThat(db.count("alert_rule")).isZero();
            assertThat(db.count("alert_rule_version")).isZero();
            assertThat(migratedFolders()).isZero();
            assertThat(migration.state()).isEqualTo(RunState.ABORTED);
            assertThat(migrationState.getStatus()).isEqualTo(MigrationState.Status.FAILED);
            assertThat(migrationState.getLastError()).contains("failed to migrate alert " + bad);
        }

        @Test
        void missingDashboardIsReported() throws Exception {
            long alertId = db.insertAlert(ORG, 12345, 1, "Orphan", "", settings(datasourceId, 1));

            assertThatThrownBy(() -> migration().execute())
                    .isInstanceOfSatisfying(AlertMigrationException.class, e -> {
                        assertThat(e.getAlertId()).isEqualTo(alertId);
                        assertThat(e.unwrap()).isInstanceOf(UnresolvedDashboardException.class);
                    });
        }

        @Test
        void parentThatIsNotAFolderIsReported() throws Exception {
            long notAFolder = db.insertDashboard(ORG, "plain", "Plain", 0);
            long dash = db.insertDashboard(ORG, "dash", "Servers", notAFolder);
            db.insertAlert(ORG, dash, 1, "A", "", settings(datasourceId, 1));

            assertThatThrownBy(() -> migration().execute())
                    .isInstanceOfSatisfying(AlertMigrationException.class,
                            e -> assertThat(e.unwrap()).isInstanceOf(InvalidFolderReferenceException.class));
        }

        @Test
        void unparseableSettingsAreReported() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            db.insertAlert(ORG, dash, 1, "A", "", "{not json");

            assertThatThrownBy(() -> migration().execute())
                    .isInstanceOfSatisfying(AlertMigrationException.class,
                            e -> assertThat(e.unwrap()).isInstanceOf(InvalidAlertSettingsException.class));
        }

        @Test
        void oversizedForDurationIsWrapped() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            long alertId = db.insertAlert(ORG, dash, 1, "A", "",
                    settings(datasourceId, 1).replace("\"for\":\"5m\"", "\"for\":\"9999999999999999y\""));

            assertThatThrownBy(() -> migration().execute())
                    .isInstanceOfSatisfying(AlertMigrationException.class, e -> {
                        assertThat(e.getAlertId()).isEqualTo(alertId);
                        assertThat(e.unwrap()).isInstanceOf(InvalidAlertSettingsException.class);
                    });
            assertThat(db.count("alert_rule")).isZero();
        }

        @Test
        void failingHookRollsBackRun() throws Exception {
            long dash = db.insertDashboard(ORG, "dash", "Servers", 0);
            db.insertAlert(ORG, dash, 1, "A", "", settings(datasourceId, 1));

            assertThatThrownBy(() -> migration().execute(() -> {
                throw new StoreException("log unavailable", null);
            })).isInstanceOf(StoreException.class);

            assertThat(db.count("alert_rule")).isZero();
            assertThat(migratedFolders()).isZero();
        }
    }

    @Nested
    @DisplayName("skip-and-report policy")
    class SkipPolicy {

        /**
         * Hands out the given UIDs in order, then a counter. Reusing a rule UID
         * makes both insert attempts of that rule collide.
         */
        private UidGenerator scriptedUids(String... uids) {
            Iterator<String> scripted = List.of(uids).iterator();
            AtomicInteger n = new AtomicInteger();
            return () -> scripted.hasNext() ? scripted.next() : "gen" + n.incrementAndGet();
        }

        @Test
        void failingAlertIsRolledBackAloneAndReported() throws Exception {
            long root = db.insertDashboard(ORG, "root", "Root", 0);
            long withAcl = db.insertDashboard(ORG, "acl", "Private", 0);
            db.grant(AclEntry.forUser(ORG, withAcl, 42, AclEntry.PERMISSION_VIEW));
            db.insertAlert(ORG, root, 1, "First", "", settings(datasourceId, 1));
            long failing = db.insertAlert(ORG, withAcl, 1, "Second", "", settings(datasourceId, 2));
            long unresolved = db.insertAlert(ORG, root, 2, "Third", "", settings(999, 3));
            db.insertAlert(ORG, root, 3, "Fourth", "", settings(datasourceId, 4));

            // General folder, first rule, dedicated folder, colliding rule UID
            MigrationReport report = migration(FailurePolicy.SKIP_AND_REPORT,
                    scriptedUids("general", "rule1", "dedicated", "rule1")).execute();

            assertThat(report.isComplete()).isFalse();
            assertThat(report.skipped()).extracting(AlertMigrationException::getAlertId)
                    .containsExactly(failing, unresolved);
            assertThat(report.skipped().get(0).unwrap()).isInstanceOf(RuleCollisionException.class);
            assertThat(report.skipped().get(1).unwrap()).isInstanceOf(UnresolvedDatasourceException.class);
            assertThat(report.metrics().alertsSkipped()).isEqualTo(2);
            assertThat(migrationState.skippedAlertIds(AlertMigration.NAME)).containsExactly(failing, unresolved);

            assertThat(db.rows("SELECT title FROM alert_rule ORDER BY id"))
                    .extracting(row -> row.get("TITLE")).containsExactly("First", "Fourth");
            assertThat(db.count("alert_rule_version")).isEqualTo(2);
            assertThat(db.rows("SELECT uid FROM dashboard WHERE created_by = -8"))
                    .extracting(row -> row.get("UID")).containsExactly("general");
            assertThat(report.foldersCreated()).isEqualTo(1);
            assertThat(db.count("dashboard_acl")).isEqualTo(1);
        }

        @Test
        void oversizedFrequencyIsSkipped() throws Exception {
            long root = db.insertDashboard(ORG, "root", "Root", 0);
            db.insertAlert(ORG, root, 1, "Good", "", settings(datasourceId, 1));
            long huge = db.insertAlert(ORG, root, 2, "Huge", "",
                    settings(datasourceId, 2).replace("\"frequency\":\"1m\"", "\"frequency\":\"99999999999999999999m\""));

            MigrationReport report = migration(FailurePolicy.SKIP_AND_REPORT, sequentialUids()).execute();

            assertThat(report.skipped()).singleElement().satisfies(e -> {
                assertThat(e.getAlertId()).isEqualTo(huge);
                assertThat(e.unwrap()).isInstanceOf(InvalidAlertSettingsException.class)
                        .hasMessageContaining("invalid duration");
            });
            assertThat(db.rows("SELECT title FROM alert_rule"))
                    .extracting(row -> row.get("TITLE")).containsExactly("Good");
        }

        @Test
        void abortPolicyFailsOnSameData() throws Exception {
            long root = db.insertDashboard(ORG, "root", "Root", 0);
            db.insertAlert(ORG, root, 1, "First", "", settings(datasourceId, 1));
            db.insertAlert(ORG, root, 2, "Third", "", settings(999, 3));

            assertThatThrownBy(() -> migration(FailurePolicy.ABORT, sequentialUids()).execute())
                    .isInstanceOf(AlertMigrationException.class);
            assertThat(db.count("alert_rule")).isZero();
        }
    }

    @Test
    void emptyStoreCommitsNothing() throws Exception {
        MigrationReport report = migration().execute();

        assertThat(report.rulesCreated()).isZero();
        assertThat(report.metrics().alertsLoaded()).isZero();
        assertThat(migrationState.getStatus()).isEqualTo(MigrationState.Status.SUCCESS);
    }

    @Test
    void runsOnlyOnce() throws Exception {
        AlertMigration migration = migration();
        migration.execute();

        assertThat(migration.state()).isEqualTo(RunState.COMMITTED);
        assertThat(migration.state().isTerminal()).isTrue();
        assertThatThrownBy(migration::execute).isInstanceOf(IllegalStateException.class);
    }
}
