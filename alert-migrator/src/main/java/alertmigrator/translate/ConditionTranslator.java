package alertmigrator.translate;

import alertmigrator.exceptions.InvalidAlertSettingsException;
import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.UnresolvedDatasourceException;
import alertmigrator.model.AlertQuery;
import alertmigrator.model.AlertQuery.RelativeTimeRange;
import alertmigrator.model.ExecutionErrorState;
import alertmigrator.model.NoDataState;
import alertmigrator.model.OrgScopedId;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates the settings of a legacy dashboard alert into the queries and
 * condition of a unified alerting rule.
 *
 * <p>Every legacy condition operand becomes a datasource query, with its
 * datasource id mapped to a UID and its {@code [refId, from, to]} parameters
 * mapped to a relative time range. All conditions are then carried, in their
 * original order and with their evaluator, operator and reducer untouched, by
 * a single {@code classic_conditions} expression which becomes the rule
 * condition.
 *
 * <p>Operands sharing refId, time range and datasource share one query. A
 * refId reused with a different time range or datasource is renamed to the
 * next unused letter.
 *
 * <p>The translator does no I/O and holds no state between calls.
 */
public final class ConditionTranslator {

    static final String CLASSIC_CONDITIONS = "classic_conditions";

    private final ObjectMapper mapper;
    private final long defaultIntervalSeconds;

    public ConditionTranslator(ObjectMapper mapper, long defaultIntervalSeconds) {
        this.mapper = Objects.requireNonNull(mapper);
        if (defaultIntervalSeconds <= 0) {
            throw new IllegalArgumentException("defaultIntervalSeconds must be positive");
        }
        this.defaultIntervalSeconds = defaultIntervalSeconds;
    }

    /**
     * Translates legacy alert settings.
     *
     * @param settings the parsed legacy settings
     * @param orgId organization of the alert
     * @param datasourceRefs datasource UIDs keyed by organization and datasource id
     * @return the translated condition
     * @throws UnresolvedDatasourceException if an operand references an unmapped datasource
     * @throws InvalidAlertSettingsException if the settings are malformed
     */
    public TranslatedCondition translate(JsonNode settings,
                                         long orgId,
                                         Map<OrgScopedId, String> datasourceRefs) throws MigrateException {
        if (settings == null || !settings.isObject()) {
            throw new InvalidAlertSettingsException("alert settings must be an object");
        }
        JsonNode conditions = settings.path("conditions");
        if (!conditions.isArray() || conditions.isEmpty()) {
            throw new InvalidAlertSettingsException("alert settings have no conditions");
        }

        Set<String> usedRefIds = new HashSet<>();
        for (JsonNode cond : conditions) {
            usedRefIds.add(operandRefId(cond));
        }

        Map<OperandKey, AlertQuery> queries = new LinkedHashMap<>();
        Set<String> claimedOriginals = new HashSet<>();
        ArrayNode classicConditions = mapper.createArrayNode();

        for (JsonNode cond : conditions) {
            JsonNode query = cond.path("query");
            JsonNode params = query.path("params");
            String refId = operandRefId(cond);
            RelativeTimeRange range = new RelativeTimeRange(
                    DurationParser.parseSeconds(params.path(1).asText("")),
                    DurationParser.parseSeconds(params.path(2).asText("")));

            long datasourceId = query.path("datasourceId").asLong(0);
            String datasourceUid = datasourceRefs.get(OrgScopedId.of(orgId, datasourceId));
            if (datasourceUid == null) {
                throw new UnresolvedDatasourceException(orgId, datasourceId);
            }

            OperandKey key = new OperandKey(refId, range, datasourceUid);
            AlertQuery existing = queries.get(key);
            String newRefId;
            if (existing != null) {
                newRefId = existing.refId();
            } else {
                if (claimedOriginals.add(refId)) {
                    newRefId = refId;
                } else {
                    newRefId = nextRefId(usedRefIds);
                    usedRefIds.add(newRefId);
                }
                queries.put(key, new AlertQuery(newRefId, "", range, datasourceUid,
                        queryModel(query.path("model"), newRefId, datasourceUid)));
            }
            classicConditions.add(classicCondition(cond, newRefId));
        }

        String conditionRefId = nextRefId(usedRefIds);
        List<AlertQuery> data = new ArrayList<>(queries.values());
        data.add(expression(conditionRefId, classicConditions));

        return new TranslatedCondition(
                conditionRefId,
                data,
                interval(settings),
                DurationParser.parseSeconds(settings.path("for").asText("")),
                noDataState(settings.path("noDataState").asText("")),
                execErrState(settings.path("executionErrorState").asText("")),
                labels(settings.path("alertRuleTags")));
    }

    private static String operandRefId(JsonNode cond) throws InvalidAlertSettingsException {
        String refId = cond.path("query").path("params").path(0).asText("");
        if (refId.isEmpty()) {
            throw new InvalidAlertSettingsException("condition has no query refId");
        }
        return refId;
    }

    private ObjectNode queryModel(JsonNode legacyModel, String refId, String datasourceUid) {
        ObjectNode model = legacyModel.isObject()
                ? ((ObjectNode) legacyModel).deepCopy()
                : mapper.createObjectNode();
        model.put("refId", refId);
        model.putObject("datasource").put("uid", datasourceUid);
        return model;
    }

    private ObjectNode classicCondition(JsonNode legacy, String refId) {
        ObjectNode cond = mapper.createObjectNode();
        cond.set("evaluator", copyOf(legacy.path("evaluator")));
        cond.set("operator", copyOf(legacy.path("operator")));
        cond.putObject("query").putArray("params").add(refId);
        cond.set("reducer", copyOf(legacy.path("reducer")));
        return cond;
    }

    private static JsonNode copyOf(JsonNode node) {
        return node.isMissingNode() ? NullNode.getInstance() : node.deepCopy();
    }

    private AlertQuery expression(String refId, ArrayNode classicConditions) {
        ObjectNode model = mapper.createObjectNode();
        model.put("refId", refId);
        model.put("type", CLASSIC_CONDITIONS);
        model.putObject("datasource")
                .put("uid", AlertQuery.EXPRESSION_DATASOURCE_UID)
                .put("type", "__expr__");
        model.set("conditions", classicConditions);
        return new AlertQuery(refId, "", RelativeTimeRange.NONE, AlertQuery.EXPRESSION_DATASOURCE_UID, model);
    }

    private long interval(JsonNode settings) throws InvalidAlertSettingsException {
        long seconds = DurationParser.parseSeconds(settings.path("frequency").asText(""));
        return seconds > 0 ? seconds : defaultIntervalSeconds;
    }

    static NoDataState noDataState(String legacy) throws InvalidAlertSettingsException {
        return switch (legacy) {
            case "ok" -> NoDataState.OK;
            case "alerting" -> NoDataState.ALERTING;
            case "no_data", "keep_state", "" -> NoDataState.NO_DATA;
            default -> throw new InvalidAlertSettingsException("unknown noDataState: " + legacy);
        };
    }

    static ExecutionErrorState execErrState(String legacy) throws InvalidAlertSettingsException {
        return switch (legacy) {
            case "alerting", "keep_state", "" -> ExecutionErrorState.ALERTING;
            case "error" -> ExecutionErrorState.ERROR;
            default -> throw new InvalidAlertSettingsException("unknown executionErrorState: " + legacy);
        };
    }

    private static Map<String, String> labels(JsonNode tags) {
        Map<String, String> labels = new LinkedHashMap<>();
        if (tags.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = tags.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                labels.put(e.getKey(), e.getValue().asText());
            }
        }
        return labels;
    }

    /**
     * Returns the first refId in the sequence A..Z, AA..AZ, BA.. not in {@code used}.
     */
    static String nextRefId(Set<String> used) {
        for (int i = 0; ; i++) {
            String candidate = letters(i);
            if (!used.contains(candidate)) return candidate;
        }
    }

    private static String letters(int index) {
        StringBuilder sb = new StringBuilder();
        int n = index;
        do {
            sb.insert(0, (char) ('A' + n % 26));
            n = n / 26 - 1;
        } while (n >= 0);
        return sb.toString();
    }

    private record OperandKey(String refId, RelativeTimeRange range, String datasourceUid) {}
}
