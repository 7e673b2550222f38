package alertmigrator.folder;

import alertmigrator.exceptions.EmptyFolderIdentifierException;
import alertmigrator.exceptions.InvalidFolderReferenceException;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.model.AclEntry;
import alertmigrator.model.Dashboard;
import alertmigrator.model.LegacyAlert;
import alertmigrator.rule.UidGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Determines, and creates when needed, the folder that receives the rules
 * migrated from a dashboard's alerts.
 *
 * <p>The decision follows {@link FolderPlacement}:
 * <ol>
 *   <li>{@code HAS_ACL}: a new folder named {@code "Migrated <alert identity>"}
 *       receiving a verbatim copy of the dashboard's effective ACL;</li>
 *   <li>{@code HAS_PARENT_FOLDER}: the dashboard's own folder;</li>
 *   <li>{@code ROOT}: the organization's {@code "General Alerting"} folder,
 *       created once per organization without explicit ACL.</li>
 * </ol>
 *
 * <p>General Alerting folders are cached per organization. A caller that
 * rolls back the writes of an alert must call {@link #discardPending()} so
 * folders created by that alert are forgotten; {@link #commitPending()}
 * keeps them.
 *
 * <p>Instances are meant for a single migration run and are not thread-safe.
 */
public class FolderResolver {

    private static final Logger log = LoggerFactory.getLogger(FolderResolver.class);

    public static final String GENERAL_FOLDER = "General Alerting";
    public static final String DASHBOARD_FOLDER_PREFIX = "Migrated ";

    private final FolderStore store;
    private final UidGenerator uids;

    private final Map<Long, Dashboard> generalFolders = new HashMap<>();
    private final List<Dashboard> pending = new ArrayList<>();
    private int foldersCreated;

    public FolderResolver(FolderStore store, UidGenerator uids) {
        this.store = Objects.requireNonNull(store);
        this.uids = Objects.requireNonNull(uids);
    }

    /**
     * Loads and validates the parent folder of a dashboard.
     *
     * @return the parent folder, or null if the dashboard lives at the root
     * @throws InvalidFolderReferenceException if the parent is missing or not a folder
     */
    public Dashboard parentFolder(Dashboard dashboard) throws InvalidFolderReferenceException {
        if (!dashboard.hasParentFolder()) return null;
        Dashboard folder = store.findById(dashboard.folderId())
                .orElseThrow(() -> InvalidFolderReferenceException.missing(dashboard.folderId()));
        if (!folder.isFolder()) {
            throw InvalidFolderReferenceException.notAFolder(dashboard.folderId());
        }
        return folder;
    }

    /**
     * Resolves the destination folder for an alert.
     *
     * @param alert the legacy alert, with its dashboard UID resolved
     * @param dashboard the alert's dashboard
     * @param parentFolder the dashboard's validated parent folder, or null at the root
     * @return a folder with a non-empty UID
     * @throws EmptyFolderIdentifierException if the resolved folder has no UID
     */
    public Dashboard resolve(LegacyAlert alert, Dashboard dashboard, Dashboard parentFolder) throws MigrateException {
        FolderPlacement placement = FolderPlacement.of(dashboard);
        Dashboard folder = switch (placement) {
            case HAS_ACL -> dedicatedFolder(alert, dashboard, parentFolder);
            case HAS_PARENT_FOLDER -> {
                if (parentFolder == null) {
                    throw InvalidFolderReferenceException.missing(dashboard.folderId());
                }
                yield parentFolder;
            }
            case ROOT -> generalFolder(dashboard.orgId());
        };

        if (folder.uid() == null || folder.uid().isEmpty()) {
            throw new EmptyFolderIdentifierException(folder.title());
        }
        log.debug("Alert {} placed in folder {} ({})", alert.id(), folder.uid(), placement);
        return folder;
    }

    private Dashboard dedicatedFolder(LegacyAlert alert, Dashboard dashboard, Dashboard parentFolder) {
        List<AclEntry> acl = store.effectiveAcl(dashboard, parentFolder);
        Dashboard folder = create(dashboard.orgId(), DASHBOARD_FOLDER_PREFIX + alert.migrationString());
        return store.insertAcl(folder, acl);
    }

    private Dashboard generalFolder(long orgId) {
        Dashboard cached = generalFolders.get(orgId);
        if (cached != null) return cached;

        Dashboard folder = store.findRootFolder(orgId, GENERAL_FOLDER)
                .orElseGet(() -> create(orgId, GENERAL_FOLDER));
        generalFolders.put(orgId, folder);
        return folder;
    }

    private Dashboard create(long orgId, String title) {
        Dashboard folder = store.createFolder(orgId, uids.next(), title);
        pending.add(folder);
        foldersCreated++;
        log.info("Created folder '{}' ({}) in organisation {}", title, folder.uid(), orgId);
        return folder;
    }

    /**
     * Keeps the folders created since the last commit or discard.
     */
    public void commitPending() {
        pending.clear();
    }

    /**
     * Forgets the folders created since the last commit or discard, after
     * their rows were rolled back.
     */
    public void discardPending() {
        for (Dashboard folder : pending) {
            generalFolders.remove(folder.orgId(), folder);
            foldersCreated--;
        }
        pending.clear();
    }

    /** Number of folders created and not discarded. */
    public int foldersCreated() {
        return foldersCreated;
    }
}
