package alertmigrator.rule;

import alertmigrator.exceptions.RuleCollisionException;
import alertmigrator.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.SavepointManager;

import java.util.Objects;

/**
 * Inserts a rule, retrying exactly once with a UID-suffixed title and rule
 * group when the first insert violates a uniqueness constraint.
 *
 * <p>Each attempt runs inside a savepoint of the surrounding transaction so a
 * failed insert leaves the transaction usable on every database.
 */
public class CollisionRetry {

    private static final Logger log = LoggerFactory.getLogger(CollisionRetry.class);

    private final RuleStore store;

    public CollisionRetry(RuleStore store) {
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Outcome of an insert.
     *
     * @param rule the rule as stored
     * @param retried true if the suffixed retry was needed
     */
    public record Insertion(AlertRule rule, boolean retried) {}

    /**
     * Inserts the rule.
     *
     * @param rule the rule to insert
     * @param tx the transaction to create savepoints in
     * @return the stored rule and whether it was renamed
     * @throws RuleCollisionException if the renamed rule collides as well
     */
    public Insertion insert(AlertRule rule, SavepointManager tx) throws RuleCollisionException {
        try {
            attempt(rule, tx);
            return new Insertion(rule, false);
        } catch (DuplicateKeyException first) {
            AlertRule renamed = rule.withUidSuffix();
            log.debug("Rule '{}' collides in folder {}, retrying as '{}'",
                    rule.title(), rule.namespaceUid(), renamed.title());
            try {
                attempt(renamed, tx);
                return new Insertion(renamed, true);
            } catch (DuplicateKeyException second) {
                second.addSuppressed(first);
                throw new RuleCollisionException(renamed.uid(), renamed.title(), second);
            }
        }
    }

    private void attempt(AlertRule rule, SavepointManager tx) {
        Object savepoint = tx.createSavepoint();
        try {
            store.insertRule(rule);
        } catch (RuntimeException e) {
            tx.rollbackToSavepoint(savepoint);
            throw e;
        }
        tx.releaseSavepoint(savepoint);
    }
}
