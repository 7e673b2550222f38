package alertmigrator.store;

import alertmigrator.exceptions.StoreException;
import alertmigrator.model.LegacyAlert;
import alertmigrator.model.OrgScopedId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Bulk lookups read once at the start of a migration run.
 *
 * <p>Loading legacy alerts and both id-to-UID maps up front turns the per-alert
 * datasource and dashboard lookups into in-memory reads. Every method reads
 * the whole table or fails; no partial result is ever returned.
 */
public class ReferenceStore {

    private static final Logger log = LoggerFactory.getLogger(ReferenceStore.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public ReferenceStore(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.mapper = Objects.requireNonNull(mapper);
    }

    /**
     * Loads every legacy alert, ordered by id.
     *
     * <p>Alerts whose settings are not valid JSON are returned with null
     * settings; translating them fails for that alert only.
     *
     * @throws StoreException if the alerts cannot be read
     */
    public List<LegacyAlert> loadLegacyAlerts() throws StoreException {
        try {
            return jdbc.query(
                    "SELECT id, org_id, dashboard_id, panel_id, name, message, state, settings FROM alert ORDER BY id",
                    (rs, rowNum) -> new LegacyAlert(
                            rs.getLong("id"),
                            rs.getLong("org_id"),
                            rs.getLong("dashboard_id"),
                            null,
                            rs.getLong("panel_id"),
                            rs.getString("name"),
                            rs.getString("message"),
                            parseSettings(rs.getLong("id"), rs.getString("settings")),
                            rs.getString("state")));
        } catch (DataAccessException e) {
            throw new StoreException("failed to load legacy alerts", e);
        }
    }

    /**
     * Loads datasource UIDs keyed by organization and datasource id.
     *
     * @throws StoreException if the datasources cannot be read
     */
    public Map<OrgScopedId, String> loadDatasourceRefs() throws StoreException {
        try {
            return loadUidMap("SELECT org_id, id, uid FROM data_source");
        } catch (DataAccessException e) {
            throw new StoreException("failed to load datasource UIDs", e);
        }
    }

    /**
     * Loads dashboard UIDs keyed by organization and dashboard id.
     *
     * @throws StoreException if the dashboards cannot be read
     */
    public Map<OrgScopedId, String> loadDashboardRefs() throws StoreException {
        try {
            return loadUidMap("SELECT org_id, id, uid FROM dashboard");
        } catch (DataAccessException e) {
            throw new StoreException("failed to load dashboard UIDs", e);
        }
    }

    private Map<OrgScopedId, String> loadUidMap(String sql) {
        Map<OrgScopedId, String> refs = new HashMap<>();
        jdbc.query(sql, rs -> {
            refs.put(OrgScopedId.of(rs.getLong("org_id"), rs.getLong("id")), rs.getString("uid"));
        });
        return refs;
    }

    private JsonNode parseSettings(long alertId, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Alert {} has unreadable settings: {}", alertId, e.getOriginalMessage());
            return null;
        }
    }
}
