package alertmigrator.state;

import java.time.Instant;

/**
 * One row of the migration log.
 *
 * @param migrationId the migration name
 * @param success whether the migration succeeded
 * @param error the error message of a failed migration, otherwise empty
 * @param timestamp when the entry was recorded
 */
public record MigrationLogEntry(String migrationId, boolean success, String error, Instant timestamp) {
}
