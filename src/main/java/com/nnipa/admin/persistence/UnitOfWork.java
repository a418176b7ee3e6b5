package com.nnipa.admin.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.UnexpectedRollbackException;

/**
 * Scoped handle to one database transaction.
 *
 * <p>Every repository call made on the owning thread while the unit of work is
 * {@link UnitOfWorkState#ACTIVE} joins its transaction. The handle must be closed;
 * use it with try-with-resources:
 *
 * <pre>{@code
 * try (UnitOfWork uow = unitOfWorkManager.acquire()) {
 *     repository.save(entity);
 *     uow.commit();
 * }
 * }</pre>
 *
 * Closing without a commit rolls back. Commit and rollback both end in
 * {@link UnitOfWorkState#RELEASED}; {@link #getCompletion()} keeps the terminal outcome.
 * Not thread-safe: a unit of work belongs to the thread that acquired it.
 */
@Slf4j
public class UnitOfWork implements AutoCloseable {

    private final String name;
    private final PlatformTransactionManager transactionManager;
    private final TransactionDefinition definition;
    private final Thread owner;

    private TransactionStatus status;
    private UnitOfWorkState state = UnitOfWorkState.CREATED;
    private UnitOfWorkState completion;

    UnitOfWork(String name, PlatformTransactionManager transactionManager, TransactionDefinition definition) {
        this.name = name;
        this.transactionManager = transactionManager;
        this.definition = definition;
        this.owner = Thread.currentThread();
    }

    void begin() {
        requireState(UnitOfWorkState.CREATED, "begin");
        try {
            this.status = transactionManager.getTransaction(definition);
        } catch (RuntimeException ex) {
            release();
            throw ex;
        }
        this.state = UnitOfWorkState.ACTIVE;
        log.debug("Unit of work {} active", name);
    }

    /**
     * Commit the transaction. If the commit itself fails the transaction is rolled back
     * and the failure is rethrown; it is never retried.
     */
    public void commit() {
        requireState(UnitOfWorkState.ACTIVE, "commit");
        try {
            if (status.isRollbackOnly()) {
                transactionManager.rollback(status);
                this.state = UnitOfWorkState.ROLLED_BACK;
                throw new UnexpectedRollbackException(
                        "Unit of work " + name + " was marked rollback-only");
            }
            transactionManager.commit(status);
            this.state = UnitOfWorkState.COMMITTED;
            log.debug("Unit of work {} committed", name);
        } catch (RuntimeException ex) {
            this.state = UnitOfWorkState.ROLLED_BACK;
            log.error("Unit of work {} failed to commit, rolled back: {}", name, ex.getMessage());
            throw ex;
        } finally {
            release();
        }
    }

    public void rollback() {
        requireState(UnitOfWorkState.ACTIVE, "rollback");
        try {
            transactionManager.rollback(status);
            log.debug("Unit of work {} rolled back", name);
        } finally {
            this.state = UnitOfWorkState.ROLLED_BACK;
            release();
        }
    }

    /**
     * Roll back if still active, for a request that was cancelled or failed. No-op once
     * the unit of work has completed.
     */
    public void abandon(String reason) {
        if (state != UnitOfWorkState.ACTIVE) {
            return;
        }
        log.info("Abandoning unit of work {}: {}", name, reason);
        rollback();
    }

    @Override
    public void close() {
        if (state == UnitOfWorkState.ACTIVE) {
            abandon("closed without commit");
        } else if (state == UnitOfWorkState.CREATED) {
            release();
        }
    }

    public boolean isActive() {
        return state == UnitOfWorkState.ACTIVE;
    }

    public UnitOfWorkState getState() {
        return state;
    }

    /**
     * @return {@code COMMITTED} or {@code ROLLED_BACK} once completed, otherwise null
     */
    public UnitOfWorkState getCompletion() {
        return completion;
    }

    public String getName() {
        return name;
    }

    private void release() {
        if (state == UnitOfWorkState.COMMITTED || state == UnitOfWorkState.ROLLED_BACK) {
            this.completion = state;
        }
        // the transaction manager returns the pooled connection when the transaction completes
        this.state = UnitOfWorkState.RELEASED;
    }

    private void requireState(UnitOfWorkState expected, String operation) {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Unit of work " + name + " used outside its owning thread");
        }
        if (state != expected) {
            throw new IllegalStateException(
                    "Cannot " + operation + " unit of work " + name + " in state " + state);
        }
    }
}
