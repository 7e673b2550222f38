package alertmigrator.engine;

import alertmigrator.TestDatabase;
import alertmigrator.config.MigrationConfig;
import alertmigrator.exceptions.StoreException;
import alertmigrator.model.AclEntry;
import alertmigrator.state.MigrationState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static alertmigrator.TestDatabase.settings;
import static org.assertj.core.api.Assertions.*;

@DisplayName("UnifiedAlertingRemoval")
class UnifiedAlertingRemovalTest {

    private static final long ORG = 1;

    private TestDatabase db;
    private MigrationState migrationState;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        migrationState = new MigrationState();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private UnifiedAlertingRemoval removal() {
        return new UnifiedAlertingRemoval(db.jdbc(), db.txManager(), migrationState);
    }

    private List<Map<String, Object>> dashboards() {
        return db.rows("SELECT id, uid, title, folder_id, has_acl, is_folder FROM dashboard ORDER BY id");
    }

    private List<Map<String, Object>> acl() {
        return db.rows("SELECT dashboard_id, user_id, team_id, role, permission FROM dashboard_acl ORDER BY id");
    }

    @Test
    void emptyStoreIsNoOp() throws Exception {
        RemovalReport report = removal().execute();

        assertThat(report.total()).isZero();
        assertThat(migrationState.getStatus()).isEqualTo(MigrationState.Status.SUCCESS);
    }

    @Test
    void migrationThenRemovalRestoresLegacyShape() throws Exception {
        long ds = db.insertDatasource(ORG, "prom");
        long folder = db.insertFolder(ORG, "team", "Team");
        long inFolder = db.insertDashboard(ORG, "d1", "In folder", folder);
        long atRoot = db.insertDashboard(ORG, "d2", "At root", 0);
        long withAcl = db.insertDashboard(ORG, "d3", "Private", 0);
        db.grant(AclEntry.forUser(ORG, withAcl, 42, AclEntry.PERMISSION_EDIT));
        db.insertAlert(ORG, inFolder, 1, "A", "", settings(ds, 1));
        db.insertAlert(ORG, atRoot, 1, "B", "", settings(ds, 2));
        db.insertAlert(ORG, withAcl, 1, "C", "", settings(ds, 3));

        List<Map<String, Object>> dashboardsBefore = dashboards();
        List<Map<String, Object>> aclBefore = acl();

        new AlertMigration(db.jdbc(), db.txManager(), MigrationConfig.DEFAULTS, migrationState).execute();
        db.jdbc().update("INSERT INTO alert_configuration (org_id, alertmanager_configuration, configuration_version,"
                + " created_at) VALUES (1, '{}', 'v1', 0)");
        db.jdbc().update("INSERT INTO alert_instance (rule_org_id, rule_uid, labels, labels_hash, current_state,"
                + " current_state_since, last_eval_time) VALUES (1, 'r', '{}', 'h', 'Normal', 0, 0)");
        assertThat(db.count("alert_rule")).isEqualTo(3);

        RemovalReport report = removal().execute();

        assertThat(report.rules()).isEqualTo(3);
        assertThat(report.ruleVersions()).isEqualTo(3);
        assertThat(report.folders()).isEqualTo(2);
        assertThat(report.aclEntries()).isEqualTo(3);
        assertThat(report.configurations()).isEqualTo(1);
        assertThat(report.instances()).isEqualTo(1);

        assertThat(dashboards()).isEqualTo(dashboardsBefore);
        assertThat(acl()).isEqualTo(aclBefore);
        assertThat(db.count("alert")).isEqualTo(3);
        assertThat(db.count("alert_rule")).isZero();
        assertThat(db.count("alert_rule_version")).isZero();
        assertThat(db.count("alert_configuration")).isZero();
        assertThat(db.count("alert_instance")).isZero();
    }

    @Test
    void secondRemovalDeletesNothing() throws Exception {
        removal().execute();

        assertThat(removal().execute().total()).isZero();
    }

    @Test
    void failureDeletesNothing() {
        db.jdbc().update("INSERT INTO alert_configuration (org_id, alertmanager_configuration, configuration_version,"
                + " created_at) VALUES (1, '{}', 'v1', 0)");
        db.jdbc().execute("DROP TABLE alert_instance");
        UnifiedAlertingRemoval removal = removal();

        assertThatThrownBy(removal::execute).isInstanceOf(StoreException.class);

        assertThat(db.count("alert_configuration")).isEqualTo(1);
        assertThat(removal.state()).isEqualTo(RunState.ABORTED);
        assertThat(migrationState.getStatus()).isEqualTo(MigrationState.Status.FAILED);
    }
}
