package alertmigrator.config;

/**
 * What the migration does when a single legacy alert cannot be migrated.
 */
public enum FailurePolicy {
    /**
     * Abort the whole run and roll back every row written so far. Default.
     */
    ABORT,

    /**
     * Roll back only the failing alert, report it and continue with the next
     * one. Store failures still abort the run.
     */
    SKIP_AND_REPORT
}
