package alertmigrator.model;

/**
 * State a rule takes when evaluation fails.
 */
public enum ExecutionErrorState {
    ALERTING("Alerting"),
    ERROR("Error");

    private final String value;

    ExecutionErrorState(String value) {
        this.value = value;
    }

    /** The value stored in the rule tables. */
    public String value() {
        return value;
    }
}
