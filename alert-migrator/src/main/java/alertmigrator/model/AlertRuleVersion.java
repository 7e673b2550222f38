package alertmigrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of an {@link AlertRule} appended to the rule history.
 */
public record AlertRuleVersion(
        long ruleOrgId,
        String ruleUid,
        String ruleNamespaceUid,
        String ruleGroup,
        long parentVersion,
        long restoredFrom,
        long version,
        Instant created,
        String title,
        String condition,
        List<AlertQuery> data,
        long intervalSeconds,
        NoDataState noDataState,
        ExecutionErrorState execErrState,
        long forSeconds,
        Map<String, String> annotations,
        Map<String, String> labels
) {
    public AlertRuleVersion {
        data = List.copyOf(data);
        annotations = Map.copyOf(annotations);
        labels = Map.copyOf(labels);
    }
}
