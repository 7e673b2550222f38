package alertmigrator.translate;

import alertmigrator.model.AlertQuery;
import alertmigrator.model.ExecutionErrorState;
import alertmigrator.model.NoDataState;

import java.util.List;
import java.util.Map;

/**
 * Result of translating the settings of a legacy alert.
 *
 * @param condition refId of the classic condition expression
 * @param data the datasource queries followed by the condition expression
 * @param intervalSeconds evaluation interval taken from the legacy frequency
 * @param forSeconds pending period taken from the legacy {@code for}
 * @param noDataState the translated no-data state
 * @param execErrState the translated execution error state
 * @param labels labels taken from the legacy alert rule tags
 */
public record TranslatedCondition(
        String condition,
        List<AlertQuery> data,
        long intervalSeconds,
        long forSeconds,
        NoDataState noDataState,
        ExecutionErrorState execErrState,
        Map<String, String> labels
) {
    public TranslatedCondition {
        data = List.copyOf(data);
        labels = Map.copyOf(labels);
    }
}
