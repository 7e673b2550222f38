package alertmigrator.model;

/**
 * A dashboard row. Folders are dashboards with {@code isFolder} set.
 *
 * @param id the row id
 * @param orgId the organization id
 * @param uid the dashboard UID
 * @param title the dashboard title
 * @param folderId id of the parent folder, 0 for the root
 * @param hasAcl whether the dashboard overrides permissions with its own ACL
 * @param isFolder whether this row is a folder
 * @param createdBy id of the creating user, or a reserved marker
 */
public record Dashboard(
        long id,
        long orgId,
        String uid,
        String title,
        long folderId,
        boolean hasAcl,
        boolean isFolder,
        long createdBy
) {
    /** Creator marker of folders synthesized by the migration. */
    public static final long FOLDER_CREATED_BY = -8;

    public boolean hasParentFolder() {
        return folderId > 0;
    }

    public boolean isMigrationFolder() {
        return isFolder && createdBy == FOLDER_CREATED_BY;
    }

    public Dashboard withAcl() {
        return new Dashboard(id, orgId, uid, title, folderId, true, isFolder, createdBy);
    }
}
