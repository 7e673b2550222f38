package alertmigrator.folder;

import alertmigrator.model.AclEntry;
import alertmigrator.model.Dashboard;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads dashboards and folders and writes the folders synthesized by the
 * migration together with their ACL entries.
 *
 * <p>Failures surface as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public class FolderStore {

    /** Role grants in effect where no explicit ACL exists. */
    static final List<AclEntry> DEFAULT_ROLE_GRANTS = List.of(
            AclEntry.forRole(-1, -1, "Viewer", AclEntry.PERMISSION_VIEW),
            AclEntry.forRole(-1, -1, "Editor", AclEntry.PERMISSION_EDIT));

    private static final String DASHBOARD_COLUMNS =
            "id, org_id, uid, title, folder_id, has_acl, is_folder, created_by";

    private static final RowMapper<Dashboard> DASHBOARD_MAPPER = (rs, rowNum) -> new Dashboard(
            rs.getLong("id"),
            rs.getLong("org_id"),
            rs.getString("uid"),
            rs.getString("title"),
            rs.getLong("folder_id"),
            rs.getBoolean("has_acl"),
            rs.getBoolean("is_folder"),
            rs.getLong("created_by"));

    private static final RowMapper<AclEntry> ACL_MAPPER = (rs, rowNum) -> new AclEntry(
            rs.getLong("org_id"),
            rs.getLong("dashboard_id"),
            rs.getObject("user_id", Long.class),
            rs.getObject("team_id", Long.class),
            rs.getString("role"),
            rs.getInt("permission"));

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final Clock clock;

    public FolderStore(JdbcTemplate jdbc, ObjectMapper mapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.mapper = Objects.requireNonNull(mapper);
        this.clock = Objects.requireNonNull(clock);
    }

    public Optional<Dashboard> findByUid(long orgId, String uid) {
        return jdbc.query("SELECT " + DASHBOARD_COLUMNS + " FROM dashboard WHERE org_id = ? AND uid = ?",
                DASHBOARD_MAPPER, orgId, uid).stream().findFirst();
    }

    public Optional<Dashboard> findById(long id) {
        return jdbc.query("SELECT " + DASHBOARD_COLUMNS + " FROM dashboard WHERE id = ?",
                DASHBOARD_MAPPER, id).stream().findFirst();
    }

    /**
     * Finds a root-level folder by title.
     */
    public Optional<Dashboard> findRootFolder(long orgId, String title) {
        return jdbc.query("SELECT " + DASHBOARD_COLUMNS + " FROM dashboard"
                        + " WHERE org_id = ? AND title = ? AND folder_id = 0 AND is_folder = ?",
                DASHBOARD_MAPPER, orgId, title, true).stream().findFirst();
    }

    /**
     * Creates a root-level folder marked with {@link Dashboard#FOLDER_CREATED_BY}.
     *
     * @return the created folder with its generated id
     */
    public Dashboard createFolder(long orgId, String uid, String title) {
        Timestamp now = Timestamp.from(clock.instant());
        ObjectNode data = mapper.createObjectNode()
                .put("title", title)
                .put("uid", uid)
                .put("version", 1);
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO dashboard (org_id, uid, title, slug, folder_id, has_acl, is_folder,"
                            + " created_by, updated_by, version, data, created, updated)"
                            + " VALUES (?, ?, ?, ?, 0, ?, ?, ?, ?, 1, ?, ?, ?)",
                    new String[] {"id"});
            ps.setLong(1, orgId);
            ps.setString(2, uid);
            ps.setString(3, title);
            ps.setString(4, slugify(title));
            ps.setBoolean(5, false);
            ps.setBoolean(6, true);
            ps.setLong(7, Dashboard.FOLDER_CREATED_BY);
            ps.setLong(8, Dashboard.FOLDER_CREATED_BY);
            ps.setString(9, data.toString());
            ps.setTimestamp(10, now);
            ps.setTimestamp(11, now);
            return ps;
        }, keys);
        Number id = Objects.requireNonNull(keys.getKey(), "no generated id for folder " + title);
        return new Dashboard(id.longValue(), orgId, uid, title, 0, false, true, Dashboard.FOLDER_CREATED_BY);
    }

    /**
     * Returns the ACL entries stored directly on a dashboard or folder.
     */
    public List<AclEntry> explicitAcl(long dashboardId) {
        return jdbc.query("SELECT org_id, dashboard_id, user_id, team_id, role, permission"
                        + " FROM dashboard_acl WHERE dashboard_id = ? ORDER BY id",
                ACL_MAPPER, dashboardId);
    }

    /**
     * Returns the effective ACL of a dashboard: its explicit entries followed by
     * those inherited from its parent folder, or the default role grants when
     * the parent has no ACL of its own.
     *
     * @param dashboard the dashboard
     * @param parentFolder the dashboard's folder, or null at the root
     */
    public List<AclEntry> effectiveAcl(Dashboard dashboard, Dashboard parentFolder) {
        List<AclEntry> entries = new ArrayList<>(explicitAcl(dashboard.id()));
        if (parentFolder != null && parentFolder.hasAcl()) {
            entries.addAll(explicitAcl(parentFolder.id()));
        } else {
            entries.addAll(DEFAULT_ROLE_GRANTS);
        }
        return entries;
    }

    /**
     * Stores the given grants on a newly created folder and flags the folder as
     * having its own ACL.
     *
     * @return the folder with {@code hasAcl} set
     */
    public Dashboard insertAcl(Dashboard folder, List<AclEntry> grants) {
        Timestamp now = Timestamp.from(clock.instant());
        for (AclEntry grant : grants) {
            AclEntry entry = grant.onDashboard(folder.orgId(), folder.id());
            jdbc.update("INSERT INTO dashboard_acl (org_id, dashboard_id, user_id, team_id, role, permission,"
                            + " created, updated) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                    new Object[] {entry.orgId(), entry.dashboardId(), entry.userId(), entry.teamId(),
                            entry.role(), entry.permission(), now, now},
                    new int[] {Types.BIGINT, Types.BIGINT, Types.BIGINT, Types.BIGINT,
                            Types.VARCHAR, Types.INTEGER, Types.TIMESTAMP, Types.TIMESTAMP});
        }
        jdbc.update("UPDATE dashboard SET has_acl = ? WHERE id = ?", true, folder.id());
        return folder.withAcl();
    }

    static String slugify(String title) {
        String slug = title.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        return slug.replaceAll("^-+|-+$", "");
    }
}
