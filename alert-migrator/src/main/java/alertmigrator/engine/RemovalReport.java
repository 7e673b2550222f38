package alertmigrator.engine;

/**
 * Row counts deleted by a removal run.
 */
public record RemovalReport(
        int ruleVersions,
        int rules,
        int aclEntries,
        int folders,
        int configurations,
        int instances
) {
    public int total() {
        return ruleVersions + rules + aclEntries + folders + configurations + instances;
    }
}
