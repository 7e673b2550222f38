package alertmigrator.model;

/**
 * State a rule takes when its queries return no data.
 */
public enum NoDataState {
    ALERTING("Alerting"),
    NO_DATA("NoData"),
    OK("OK");

    private final String value;

    NoDataState(String value) {
        this.value = value;
    }

    /** The value stored in the rule tables. */
    public String value() {
        return value;
    }
}
