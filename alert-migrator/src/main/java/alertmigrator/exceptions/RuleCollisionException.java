package alertmigrator.exceptions;

/**
 * Inserting a rule violated a uniqueness constraint even after the single
 * retry with a UID-suffixed title and rule group.
 */
public class RuleCollisionException extends MigrateException {

    private final String ruleUid;
    private final String title;

    public RuleCollisionException(String ruleUid, String title, Throwable cause) {
        super("rule '" + title + "' (uid " + ruleUid + ") still collides after retry", cause);
        this.ruleUid = ruleUid;
        this.title = title;
    }

    public String getRuleUid() {
        return ruleUid;
    }

    /** Returns the suffixed title used by the failed retry. */
    public String getTitle() {
        return title;
    }
}
