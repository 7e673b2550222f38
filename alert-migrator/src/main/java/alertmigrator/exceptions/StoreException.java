package alertmigrator.exceptions;

/**
 * I/O failure against the relational store.
 *
 * <p>Wraps the {@link org.springframework.dao.DataAccessException} raised by
 * the JDBC layer. A store failure is always fatal and aborts the whole run.
 */
public class StoreException extends MigrateException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
