package alertmigrator.rule;

import alertmigrator.model.AlertRule;
import alertmigrator.model.LegacyAlert;
import alertmigrator.translate.TranslatedCondition;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds unified alerting rules from legacy alerts.
 *
 * <p>Title and rule group both default to the legacy alert name. The rule
 * keeps a link to its origin through the {@code __dashboardUid__},
 * {@code __panelId__} and {@code __alertId__} annotations.
 */
public class RuleSynthesizer {

    static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    static final String PANEL_ID_ANNOTATION = "__panelId__";
    static final String ALERT_ID_ANNOTATION = "__alertId__";
    static final String MESSAGE_ANNOTATION = "message";

    private final UidGenerator uids;
    private final Clock clock;

    public RuleSynthesizer(UidGenerator uids, Clock clock) {
        this.uids = Objects.requireNonNull(uids);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Builds the rule for a legacy alert.
     *
     * @param alert the legacy alert, with its dashboard UID resolved
     * @param condition the translated condition
     * @param folderUid UID of the destination folder
     * @return a version 1 rule with a freshly generated UID
     */
    public AlertRule build(LegacyAlert alert, TranslatedCondition condition, String folderUid) {
        Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(DASHBOARD_UID_ANNOTATION, alert.dashboardUid());
        annotations.put(PANEL_ID_ANNOTATION, Long.toString(alert.panelId()));
        annotations.put(ALERT_ID_ANNOTATION, Long.toString(alert.id()));
        if (alert.message() != null && !alert.message().isEmpty()) {
            annotations.put(MESSAGE_ANNOTATION, alert.message());
        }

        Instant now = clock.instant();
        return new AlertRule(
                alert.orgId(),
                uids.next(),
                folderUid,
                alert.name(),
                alert.name(),
                condition.condition(),
                condition.data(),
                condition.intervalSeconds(),
                1,
                alert.dashboardUid(),
                alert.panelId(),
                condition.forSeconds(),
                condition.noDataState(),
                condition.execErrState(),
                annotations,
                condition.labels(),
                now,
                AlertRule.CREATED_BY_MIGRATION);
    }
}
