package alertmigrator.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A dashboard-panel-embedded alert rule as stored before the migration.
 *
 * @param id the alert id
 * @param orgId the organization id
 * @param dashboardId id of the dashboard the alert panel lives on
 * @param dashboardUid UID of that dashboard, null until resolved
 * @param panelId id of the panel carrying the alert
 * @param name the alert name
 * @param message the notification message, may be empty
 * @param settings the parsed condition and query settings
 * @param state the last evaluated state
 */
public record LegacyAlert(
        long id,
        long orgId,
        long dashboardId,
        String dashboardUid,
        long panelId,
        String name,
        String message,
        JsonNode settings,
        String state
) {
    /**
     * Returns a copy with the dashboard UID set.
     */
    public LegacyAlert withDashboardUid(String uid) {
        return new LegacyAlert(id, orgId, dashboardId, uid, panelId, name, message, settings, state);
    }

    /**
     * Identity string used to name per-dashboard migration folders.
     */
    public String migrationString() {
        return "dashUID:" + dashboardUid + " panelId:" + panelId + " alertId:" + id;
    }
}
