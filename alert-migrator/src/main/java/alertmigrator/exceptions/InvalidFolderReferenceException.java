package alertmigrator.exceptions;

/**
 * A dashboard's folder id points to a missing record or to a regular dashboard.
 */
public class InvalidFolderReferenceException extends MigrateException {

    private final long folderId;

    public InvalidFolderReferenceException(long folderId, String message) {
        super(message);
        this.folderId = folderId;
    }

    public static InvalidFolderReferenceException missing(long folderId) {
        return new InvalidFolderReferenceException(folderId, "folder with id " + folderId + " not found");
    }

    public static InvalidFolderReferenceException notAFolder(long folderId) {
        return new InvalidFolderReferenceException(folderId, "id " + folderId + " is a dashboard not a folder");
    }

    public long getFolderId() {
        return folderId;
    }
}
