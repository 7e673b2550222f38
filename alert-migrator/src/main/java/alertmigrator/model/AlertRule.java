package alertmigrator.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A unified alerting rule, scoped to a folder and grouped by rule group.
 *
 * @param orgId the organization id
 * @param uid the generated rule UID
 * @param namespaceUid UID of the folder holding the rule
 * @param title the rule title
 * @param ruleGroup the rule group name
 * @param condition refId of the query or expression deciding the alert state
 * @param data the queries and expressions
 * @param intervalSeconds the evaluation interval of the rule group
 * @param version the rule version, starting at 1
 * @param dashboardUid UID of the dashboard the legacy alert belonged to
 * @param panelId id of the panel the legacy alert belonged to
 * @param forSeconds how long the condition must hold before firing
 * @param noDataState the state on missing data
 * @param execErrState the state on evaluation errors
 * @param annotations the rule annotations
 * @param labels the rule labels
 * @param updated the creation timestamp
 * @param createdBy creator marker, {@link #CREATED_BY_MIGRATION} for migrated rules
 */
public record AlertRule(
        long orgId,
        String uid,
        String namespaceUid,
        String title,
        String ruleGroup,
        String condition,
        List<AlertQuery> data,
        long intervalSeconds,
        long version,
        String dashboardUid,
        long panelId,
        long forSeconds,
        NoDataState noDataState,
        ExecutionErrorState execErrState,
        Map<String, String> annotations,
        Map<String, String> labels,
        Instant updated,
        long createdBy
) {
    /** Creator marker of rules produced by the migration. */
    public static final long CREATED_BY_MIGRATION = Dashboard.FOLDER_CREATED_BY;

    public AlertRule {
        data = List.copyOf(data);
        annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    /**
     * Returns a copy whose title and rule group are suffixed with the rule UID.
     */
    public AlertRule withUidSuffix() {
        return new AlertRule(orgId, uid, namespaceUid, title + " " + uid, ruleGroup + " " + uid,
                condition, data, intervalSeconds, version, dashboardUid, panelId, forSeconds,
                noDataState, execErrState, annotations, labels, updated, createdBy);
    }

    /**
     * Builds the first version record of this rule.
     */
    public AlertRuleVersion toVersion() {
        return new AlertRuleVersion(orgId, uid, namespaceUid, ruleGroup, 0, 0, version, updated,
                title, condition, data, intervalSeconds, noDataState, execErrState, forSeconds,
                annotations, labels);
    }
}
