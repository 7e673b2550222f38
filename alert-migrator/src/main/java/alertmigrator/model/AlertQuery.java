package alertmigrator.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One query or expression of a unified alerting rule.
 *
 * @param refId the reference id the condition and expressions refer to
 * @param queryType the query type, empty for datasource queries
 * @param relativeTimeRange the time range relative to evaluation time
 * @param datasourceUid UID of the datasource, {@link #EXPRESSION_DATASOURCE_UID} for expressions
 * @param model the datasource specific query model
 */
public record AlertQuery(
        String refId,
        String queryType,
        RelativeTimeRange relativeTimeRange,
        String datasourceUid,
        ObjectNode model
) {
    /** Datasource UID reserved for server-side expressions. */
    public static final String EXPRESSION_DATASOURCE_UID = "-100";

    public boolean isExpression() {
        return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
    }

    /**
     * Time range in seconds before evaluation time.
     *
     * @param from start of the range, seconds ago
     * @param to end of the range, seconds ago
     */
    public record RelativeTimeRange(long from, long to) {
        public static final RelativeTimeRange NONE = new RelativeTimeRange(0, 0);
    }
}
