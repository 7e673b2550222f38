package alertmigrator.state;

import alertmigrator.exceptions.StoreException;

import java.util.Map;

/**
 * Record of the named migrations that already executed.
 *
 * <p>Consulted before running so a migration runs once, and cleared so the
 * opposite migration can run again after a toggle flip.
 */
public interface MigrationLog {

    /**
     * Returns every log entry keyed by migration name.
     *
     * @throws StoreException if the log cannot be read
     */
    Map<String, MigrationLogEntry> entries() throws StoreException;

    /**
     * Removes the entries of a migration.
     *
     * @throws StoreException if the entries cannot be removed
     */
    void clear(String migrationName) throws StoreException;

    /**
     * Records a successful execution of a migration.
     *
     * @throws StoreException if the entry cannot be written
     */
    void register(String migrationName) throws StoreException;
}
