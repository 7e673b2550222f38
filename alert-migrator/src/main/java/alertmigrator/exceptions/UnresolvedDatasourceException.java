package alertmigrator.exceptions;

/**
 * A legacy condition references a datasource id that has no UID mapping,
 * usually because the datasource was deleted.
 */
public class UnresolvedDatasourceException extends MigrateException {

    private final long orgId;
    private final long datasourceId;

    public UnresolvedDatasourceException(long orgId, long datasourceId) {
        super("could not find datasource with id " + datasourceId + " under organisation " + orgId);
        this.orgId = orgId;
        this.datasourceId = datasourceId;
    }

    public long getOrgId() {
        return orgId;
    }

    public long getDatasourceId() {
        return datasourceId;
    }
}
