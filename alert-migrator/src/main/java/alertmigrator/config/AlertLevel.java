package alertmigrator.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link alertmigrator.alert.MigrationAlertLogger}. This can be configured
 * via the {@code migration.alert.level} property.
 *
 * <ul>
 *   <li>{@link #DEBUG} - All events: run started, each migrated alert, completion, warnings, errors</li>
 *   <li>{@link #WARNING} - Rule collisions, skipped alerts, removals and errors</li>
 *   <li>{@link #ERROR} - Errors only</li>
 * </ul>
 *
 * @see MigrationConfig#alertLevel()
 */
public enum AlertLevel {
    DEBUG,
    WARNING,
    ERROR
}
