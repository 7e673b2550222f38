package alertmigrator.exceptions;

/**
 * The dashboard a legacy alert belongs to cannot be found, either because the
 * dashboard id has no UID mapping or because no dashboard row has that UID.
 */
public class UnresolvedDashboardException extends MigrateException {

    private final long orgId;
    private final long dashboardId;
    private final String dashboardUid;

    public UnresolvedDashboardException(long orgId, long dashboardId, String dashboardUid) {
        super(dashboardUid == null
                ? "dashboard with id " + dashboardId + " under organisation " + orgId + " has no UID"
                : "dashboard with UID " + dashboardUid + " under organisation " + orgId + " not found");
        this.orgId = orgId;
        this.dashboardId = dashboardId;
        this.dashboardUid = dashboardUid;
    }

    public long getOrgId() {
        return orgId;
    }

    public long getDashboardId() {
        return dashboardId;
    }

    /** Returns the resolved UID, or null if the id had no mapping. */
    public String getDashboardUid() {
        return dashboardUid;
    }
}
