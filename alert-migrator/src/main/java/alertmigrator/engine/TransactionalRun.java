package alertmigrator.engine;

import alertmigrator.exceptions.MigrateException;
import alertmigrator.exceptions.StoreException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import java.util.Objects;

/**
 * Runs work in one transaction that commits only if the work and the
 * {@link BeforeCommit} hook both succeed.
 */
final class TransactionalRun {

    @FunctionalInterface
    interface Work<T> {
        T execute(TransactionStatus tx) throws MigrateException;
    }

    private final PlatformTransactionManager txManager;

    TransactionalRun(PlatformTransactionManager txManager) {
        this.txManager = Objects.requireNonNull(txManager);
    }

    <T> T execute(Work<T> work, BeforeCommit beforeCommit) throws MigrateException {
        TransactionStatus tx;
        try {
            tx = txManager.getTransaction(new DefaultTransactionDefinition());
        } catch (TransactionException e) {
            throw new StoreException("failed to begin transaction", e);
        }

        T result;
        try {
            result = work.execute(tx);
            beforeCommit.run();
        } catch (MigrateException | RuntimeException | Error e) {
            rollbackQuietly(tx, e);
            throw e;
        }

        try {
            txManager.commit(tx);
        } catch (TransactionException e) {
            throw new StoreException("failed to commit transaction", e);
        }
        return result;
    }

    private void rollbackQuietly(TransactionStatus tx, Throwable failure) {
        try {
            txManager.rollback(tx);
        } catch (TransactionException e) {
            failure.addSuppressed(e);
        }
    }
}
