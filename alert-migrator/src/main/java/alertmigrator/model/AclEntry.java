package alertmigrator.model;

import java.util.Objects;

/**
 * A single permission grant on a dashboard or folder.
 *
 * <p>Exactly one of {@code userId}, {@code teamId} or {@code role} names the
 * principal; the others are null.
 *
 * @param orgId the organization id
 * @param dashboardId the dashboard or folder the grant applies to
 * @param userId the granted user, or null
 * @param teamId the granted team, or null
 * @param role the granted organization role, or null
 * @param permission the permission level
 */
public record AclEntry(
        long orgId,
        long dashboardId,
        Long userId,
        Long teamId,
        String role,
        int permission
) {
    public static final int PERMISSION_VIEW = 1;
    public static final int PERMISSION_EDIT = 2;
    public static final int PERMISSION_ADMIN = 4;

    public static AclEntry forRole(long orgId, long dashboardId, String role, int permission) {
        return new AclEntry(orgId, dashboardId, null, null, role, permission);
    }

    public static AclEntry forUser(long orgId, long dashboardId, long userId, int permission) {
        return new AclEntry(orgId, dashboardId, userId, null, null, permission);
    }

    public static AclEntry forTeam(long orgId, long dashboardId, long teamId, int permission) {
        return new AclEntry(orgId, dashboardId, null, teamId, null, permission);
    }

    /**
     * Returns a copy of this grant attached to another dashboard.
     */
    public AclEntry onDashboard(long orgId, long dashboardId) {
        return new AclEntry(orgId, dashboardId, userId, teamId, role, permission);
    }

    /**
     * Returns true if both entries grant the same level to the same principal,
     * regardless of the dashboard they are attached to.
     */
    public boolean sameGrant(AclEntry other) {
        return other != null
                && Objects.equals(userId, other.userId)
                && Objects.equals(teamId, other.teamId)
                && Objects.equals(role, other.role)
                && permission == other.permission;
    }
}
