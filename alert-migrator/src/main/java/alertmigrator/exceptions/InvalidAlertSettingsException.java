package alertmigrator.exceptions;

/**
 * The serialized settings of a legacy alert cannot be translated.
 */
public class InvalidAlertSettingsException extends MigrateException {

    public InvalidAlertSettingsException(String message) {
        super(message);
    }

    public InvalidAlertSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
