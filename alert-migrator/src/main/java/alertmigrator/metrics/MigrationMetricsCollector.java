package alertmigrator.metrics;

import alertmigrator.metrics.MigrationMetrics.Phase;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timings and counters during a run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector(clock);
 * collector.start(runId, name);
 *
 * List&lt;LegacyAlert&gt; alerts = collector.timed(Phase.LOAD_REFERENCES, store::loadLegacyAlerts);
 * collector.ruleCreated();
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 */
public final class MigrationMetricsCollector {

    private final Clock clock;
    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);
    private MigrationMetrics.Builder builder;

    private Instant startTime;
    private int rulesCreated;
    private int collisionsRetried;
    private int alertsSkipped;

    public MigrationMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    public MigrationMetricsCollector() {
        this(Clock.systemUTC());
    }

    /**
     * Starts metrics collection for a new run.
     *
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long runId, String migrationName) {
        this.startTime = clock.instant();
        this.phaseDurations.clear();
        this.rulesCreated = 0;
        this.collisionsRetried = 0;
        this.alertsSkipped = 0;
        this.builder = MigrationMetrics.builder()
                .runId(runId)
                .migrationName(migrationName)
                .startTime(startTime);
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(phase, start);
        }
    }

    private void record(Phase phase, long startNanos) {
        long elapsed = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        phaseDurations.merge(phase, elapsed, Long::sum);
    }

    public MigrationMetricsCollector alertsLoaded(int count) {
        builder.alertsLoaded(count);
        return this;
    }

    public MigrationMetricsCollector ruleCreated(boolean retried) {
        rulesCreated++;
        if (retried) collisionsRetried++;
        return this;
    }

    public MigrationMetricsCollector alertSkipped() {
        alertsSkipped++;
        return this;
    }

    public MigrationMetricsCollector foldersCreated(int count) {
        builder.foldersCreated(count);
        return this;
    }

    public MigrationMetricsCollector rowsDeleted(int count) {
        builder.rowsDeleted(count);
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     */
    public MigrationMetrics finish() {
        Instant endTime = clock.instant();
        return builder
                .endTime(endTime)
                .phaseDurations(phaseDurations)
                .rulesCreated(rulesCreated)
                .collisionsRetried(collisionsRetried)
                .alertsSkipped(alertsSkipped)
                .totalDurationMs(Duration.between(startTime, endTime).toMillis())
                .build();
    }
}
