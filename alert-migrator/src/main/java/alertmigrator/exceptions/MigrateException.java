package alertmigrator.exceptions;

/**
 * Exception thrown when an alert migration operation fails.
 *
 * <p>This is the root of the checked failures raised while translating legacy
 * alerts, resolving folders and persisting rules.
 *
 * @see AlertMigrationException
 * @see alertmigrator.engine.AlertMigration
 */
public class MigrateException extends Exception {

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        super(message);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        super(message, cause);
    }
}
