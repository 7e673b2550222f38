package alertmigrator.exceptions;

import java.util.Objects;

/**
 * Failure to migrate one legacy alert.
 *
 * <p>Identifies the alert by id and wraps the typed cause that made the
 * migration of that alert impossible. The cause is never replaced, so callers
 * can inspect it through {@link #unwrap()} or {@link #getCause()}.
 *
 * <h2>Example:</h2>
 * <pre>
 * try {
 *     migration.execute();
 * } catch (AlertMigrationException e) {
 *     if (e.unwrap() instanceof UnresolvedDatasourceException ds) {
 *         log.warn("alert {} uses deleted datasource {}", e.getAlertId(), ds.getDatasourceId());
 *     }
 * }
 * </pre>
 */
public class AlertMigrationException extends MigrateException {

    private final long alertId;

    /**
     * Creates a new exception for the given alert.
     *
     * @param alertId id of the legacy alert that failed
     * @param cause the underlying cause (must not be null)
     */
    public AlertMigrationException(long alertId, Throwable cause) {
        super(formatMessage(alertId, cause), Objects.requireNonNull(cause, "cause"));
        this.alertId = alertId;
    }

    /**
     * Returns the id of the legacy alert that failed to migrate.
     */
    public long getAlertId() {
        return alertId;
    }

    /**
     * Returns the underlying cause of the failure.
     */
    public Throwable unwrap() {
        return getCause();
    }

    /**
     * Returns true when the cause is a store failure, which always aborts the run.
     */
    public boolean isStoreFailure() {
        return getCause() instanceof StoreException;
    }

    private static String formatMessage(long alertId, Throwable cause) {
        return "failed to migrate alert " + alertId + ": " + (cause != null ? cause.getMessage() : "unknown error");
    }
}
