package alertmigrator.exceptions;

/**
 * Folder resolution produced a folder without a usable UID.
 */
public class EmptyFolderIdentifierException extends MigrateException {

    public EmptyFolderIdentifierException(String folderTitle) {
        super("empty folder identifier" + (folderTitle != null ? " for folder '" + folderTitle + "'" : ""));
    }
}
