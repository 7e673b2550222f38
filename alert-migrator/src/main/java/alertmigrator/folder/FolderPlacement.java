package alertmigrator.folder;

import alertmigrator.model.Dashboard;

/**
 * Where the rules migrated from a dashboard's alerts are placed.
 *
 * <p>Constants are declared in precedence order; {@link #of(Dashboard)}
 * returns the first one that applies.
 */
public enum FolderPlacement {
    /** The dashboard has its own ACL: a dedicated folder copies it. */
    HAS_ACL,
    /** The dashboard lives in a folder: the rules go to that folder. */
    HAS_PARENT_FOLDER,
    /** The dashboard lives at the root: the shared General Alerting folder. */
    ROOT;

    public static FolderPlacement of(Dashboard dashboard) {
        if (dashboard.hasAcl()) return HAS_ACL;
        if (dashboard.hasParentFolder()) return HAS_PARENT_FOLDER;
        return ROOT;
    }
}
