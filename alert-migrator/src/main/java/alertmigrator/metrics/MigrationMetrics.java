package alertmigrator.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during a migration or removal run.
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()}
 * for JSON serialization.
 *
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long runId,
        String migrationName,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int alertsLoaded,
        int rulesCreated,
        int foldersCreated,
        int collisionsRetried,
        int alertsSkipped,
        int rowsDeleted
) {
    /**
     * Run phases for timing breakdown.
     */
    public enum Phase {
        /** Bulk load of legacy alerts and the datasource and dashboard maps */
        LOAD_REFERENCES,
        /** Per-alert translation, folder resolution and persistence */
        MIGRATE_ALERTS,
        /** Deletion of unified alerting data */
        REMOVE_DATA
    }

    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @param phase the phase to query
     * @return duration in milliseconds, or 0 if phase not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Run #%d '%s' in %dms | Alerts: %d loaded, %d skipped | Rules: %d created, %d renamed | Folders: %d created | Rows deleted: %d",
                runId, migrationName, totalDurationMs, alertsLoaded, alertsSkipped,
                rulesCreated, collisionsRetried, foldersCreated, rowsDeleted);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("migrationName", migrationName);
        map.put("startTime", startTime != null ? startTime.toString() : null);
        map.put("endTime", endTime != null ? endTime.toString() : null);
        map.put("totalDurationMs", totalDurationMs);
        map.put("alertsLoaded", alertsLoaded);
        map.put("rulesCreated", rulesCreated);
        map.put("foldersCreated", foldersCreated);
        map.put("collisionsRetried", collisionsRetried);
        map.put("alertsSkipped", alertsSkipped);
        map.put("rowsDeleted", rowsDeleted);
        phaseDurations.forEach((phase, duration) ->
                map.put(phase.name().toLowerCase(Locale.ROOT) + "DurationMs", duration));
        return map;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private long runId;
        private String migrationName;
        private Instant startTime;
        private Instant endTime;
        private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
        private long totalDurationMs;
        private int alertsLoaded;
        private int rulesCreated;
        private int foldersCreated;
        private int collisionsRetried;
        private int alertsSkipped;
        private int rowsDeleted;

        public Builder runId(long v) { this.runId = v; return this; }
        public Builder migrationName(String v) { this.migrationName = v; return this; }
        public Builder startTime(Instant v) { this.startTime = v; return this; }
        public Builder endTime(Instant v) { this.endTime = v; return this; }

        public Builder phaseDurations(Map<Phase, Long> durations) {
            this.phaseDurations.putAll(durations);
            return this;
        }

        public Builder totalDurationMs(long v) { this.totalDurationMs = v; return this; }
        public Builder alertsLoaded(int v) { this.alertsLoaded = v; return this; }
        public Builder rulesCreated(int v) { this.rulesCreated = v; return this; }
        public Builder foldersCreated(int v) { this.foldersCreated = v; return this; }
        public Builder collisionsRetried(int v) { this.collisionsRetried = v; return this; }
        public Builder alertsSkipped(int v) { this.alertsSkipped = v; return this; }
        public Builder rowsDeleted(int v) { this.rowsDeleted = v; return this; }

        public MigrationMetrics build() {
            return new MigrationMetrics(
                    runId, migrationName, startTime, endTime,
                    new EnumMap<>(phaseDurations),
                    totalDurationMs, alertsLoaded, rulesCreated, foldersCreated,
                    collisionsRetried, alertsSkipped, rowsDeleted);
        }
    }
}
