package alertmigrator.state;

import alertmigrator.exceptions.StoreException;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MigrationLog} stored in the {@code migration_log} table.
 *
 * <p>Writes join the transaction bound to the current thread, so a
 * registration commits or rolls back together with the migration it records.
 */
public class JdbcMigrationLog implements MigrationLog {

    static final String CODE_MIGRATION = "code migration";

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcMigrationLog(JdbcTemplate jdbc, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public Map<String, MigrationLogEntry> entries() throws StoreException {
        try {
            Map<String, MigrationLogEntry> entries = new LinkedHashMap<>();
            jdbc.query("SELECT migration_id, success, error, timestamp FROM migration_log ORDER BY id", rs -> {
                Timestamp ts = rs.getTimestamp("timestamp");
                entries.put(rs.getString("migration_id"), new MigrationLogEntry(
                        rs.getString("migration_id"),
                        rs.getBoolean("success"),
                        rs.getString("error"),
                        ts != null ? ts.toInstant() : null));
            });
            return entries;
        } catch (DataAccessException e) {
            throw new StoreException("failed to read migration log", e);
        }
    }

    @Override
    public void clear(String migrationName) throws StoreException {
        try {
            jdbc.update("DELETE FROM migration_log WHERE migration_id = ?", migrationName);
        } catch (DataAccessException e) {
            throw new StoreException("failed to clear migration log entry '" + migrationName + "'", e);
        }
    }

    @Override
    public void register(String migrationName) throws StoreException {
        try {
            jdbc.update("INSERT INTO migration_log (migration_id, sql, success, error, timestamp)"
                            + " VALUES (?, ?, ?, ?, ?)",
                    migrationName, CODE_MIGRATION, true, "", Timestamp.from(clock.instant()));
        } catch (DataAccessException e) {
            throw new StoreException("failed to register migration '" + migrationName + "'", e);
        }
    }
}
