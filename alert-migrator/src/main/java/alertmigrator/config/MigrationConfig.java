package alertmigrator.config;

/**
 * Configuration of an alert migration invocation.
 *
 * <p>Holds the two switches that gate the migration (the backup
 * acknowledgment and the unified alerting feature toggle) together with the
 * tuning of the run itself:
 * <ul>
 *   <li>failure policy (abort or skip-and-report)</li>
 *   <li>default evaluation interval for rules without a frequency</li>
 *   <li>history size and alert level for reporting</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code alert-migration.properties} or
 * {@code alert-migration.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    /** Value that acknowledges a database backup was taken. */
    public static final String BACKUP_ACKNOWLEDGMENT = "iDidBackup";

    public static final MigrationConfig DEFAULTS = builder().build();

    private final boolean backupAcknowledged;
    private final boolean ngAlertEnabled;
    private final FailurePolicy failurePolicy;
    private final long defaultIntervalSeconds;
    private final int historySize;
    private final AlertLevel alertLevel;

    private MigrationConfig(Builder b) {
        this.backupAcknowledged = b.backupAcknowledged;
        this.ngAlertEnabled = b.ngAlertEnabled;
        this.failurePolicy = b.failurePolicy;
        this.defaultIntervalSeconds = b.defaultIntervalSeconds;
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns true if the operator acknowledged a backup, which enables any migration at all. */
    public boolean backupAcknowledged() { return backupAcknowledged; }

    /** Returns true if unified alerting is enabled. */
    public boolean ngAlertEnabled() { return ngAlertEnabled; }

    /** Returns the per-alert failure policy. */
    public FailurePolicy failurePolicy() { return failurePolicy; }

    /** Returns the interval used when a legacy alert has no frequency. */
    public long defaultIntervalSeconds() { return defaultIntervalSeconds; }

    /** Returns the maximum number of run history entries to keep. */
    public int historySize() { return historySize; }

    /** Returns the alert level for event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "backupAcknowledged=" + backupAcknowledged +
                ", ngAlertEnabled=" + ngAlertEnabled +
                ", failurePolicy=" + failurePolicy +
                ", defaultIntervalSeconds=" + defaultIntervalSeconds +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                '}';
    }

    public static final class Builder {
        private boolean backupAcknowledged = false;
        private boolean ngAlertEnabled = false;
        private FailurePolicy failurePolicy = FailurePolicy.ABORT;
        private long defaultIntervalSeconds = 60;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder backupAcknowledged(boolean acknowledged) {
            this.backupAcknowledged = acknowledged;
            return this;
        }

        /**
         * Acknowledges the backup if the value equals {@link #BACKUP_ACKNOWLEDGMENT}.
         */
        public Builder backupAcknowledgment(String value) {
            this.backupAcknowledged = BACKUP_ACKNOWLEDGMENT.equals(value);
            return this;
        }

        public Builder ngAlertEnabled(boolean enabled) {
            this.ngAlertEnabled = enabled;
            return this;
        }

        public Builder failurePolicy(FailurePolicy policy) {
            this.failurePolicy = policy != null ? policy : FailurePolicy.ABORT;
            return this;
        }

        public Builder defaultIntervalSeconds(long seconds) {
            if (seconds <= 0) throw new IllegalArgumentException("defaultIntervalSeconds must be positive");
            this.defaultIntervalSeconds = seconds;
            return this;
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigrationConfig build() {
            return new MigrationConfig(this);
        }
    }
}
