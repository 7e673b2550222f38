package alertmigrator.rule;

import alertmigrator.model.AlertQuery;
import alertmigrator.model.AlertRule;
import alertmigrator.model.AlertRuleVersion;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes rules and rule versions.
 *
 * <p>Queries, annotations and labels are stored as JSON text. A uniqueness
 * violation surfaces as {@link org.springframework.dao.DuplicateKeyException}.
 */
public class RuleStore {

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public RuleStore(JdbcTemplate jdbc, ObjectMapper mapper) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public void insertRule(AlertRule rule) {
        jdbc.update("INSERT INTO alert_rule (org_id, uid, namespace_uid, title, rule_group, condition, data,"
                        + " interval_seconds, version, dashboard_uid, panel_id, for_duration, no_data_state,"
                        + " exec_err_state, annotations, labels, updated, created_by)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                rule.orgId(), rule.uid(), rule.namespaceUid(), rule.title(), rule.ruleGroup(),
                rule.condition(), queriesJson(rule.data()), rule.intervalSeconds(), rule.version(),
                rule.dashboardUid(), rule.panelId(), rule.forSeconds(), rule.noDataState().value(),
                rule.execErrState().value(), json(rule.annotations()), json(rule.labels()),
                Timestamp.from(rule.updated()), rule.createdBy());
    }

    public void insertVersion(AlertRuleVersion version) {
        jdbc.update("INSERT INTO alert_rule_version (rule_org_id, rule_uid, rule_namespace_uid, rule_group,"
                        + " parent_version, restored_from, version, created, title, condition, data,"
                        + " interval_seconds, no_data_state, exec_err_state, for_duration, annotations, labels)"
                        + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                version.ruleOrgId(), version.ruleUid(), version.ruleNamespaceUid(), version.ruleGroup(),
                version.parentVersion(), version.restoredFrom(), version.version(),
                Timestamp.from(version.created()), version.title(), version.condition(),
                queriesJson(version.data()), version.intervalSeconds(), version.noDataState().value(),
                version.execErrState().value(), version.forSeconds(), json(version.annotations()),
                json(version.labels()));
    }

    String queriesJson(List<AlertQuery> queries) {
        ArrayNode array = mapper.createArrayNode();
        for (AlertQuery q : queries) {
            ObjectNode node = array.addObject();
            node.put("refId", q.refId());
            node.put("queryType", q.queryType());
            node.putObject("relativeTimeRange")
                    .put("from", q.relativeTimeRange().from())
                    .put("to", q.relativeTimeRange().to());
            node.put("datasourceUid", q.datasourceUid());
            node.set("model", q.model());
        }
        return array.toString();
    }

    private String json(Map<String, String> map) {
        try {
            return mapper.writeValueAsString(map);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize string map", e);
        }
    }
}
