package alertmigrator.engine;

/**
 * Lifecycle of a single migration or removal run.
 *
 * <pre>
 * NOT_STARTED -&gt; RUNNING -&gt; COMMITTED
 *                        \-&gt; ABORTED
 * </pre>
 */
public enum RunState {
    NOT_STARTED,
    RUNNING,
    COMMITTED,
    ABORTED;

    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
