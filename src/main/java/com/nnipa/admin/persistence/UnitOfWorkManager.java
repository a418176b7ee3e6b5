package com.nnipa.admin.persistence;

import com.nnipa.admin.config.AdminProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Hands out {@link UnitOfWork}s backed by the pooled data source.
 *
 * <p>Acquisition may block while the pool is saturated, up to the pool's connection
 * timeout. Units of work do not nest: acquiring on a thread that already runs a
 * transaction fails fast instead of silently joining it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnitOfWorkManager {

    private final PlatformTransactionManager transactionManager;
    private final AdminProperties adminProperties;

    private final AtomicLong sequence = new AtomicLong();

    public UnitOfWork acquire() {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("A unit of work is already active on this thread");
        }

        String name = "uow-" + sequence.incrementAndGet();
        DefaultTransactionDefinition definition =
                new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        definition.setName(name);
        definition.setTimeout(adminProperties.getUnitOfWork().getTimeoutSeconds());

        UnitOfWork unitOfWork = new UnitOfWork(name, transactionManager, definition);
        unitOfWork.begin();
        return unitOfWork;
    }

    /**
     * Run {@code work} in a fresh unit of work: commit on normal return, roll back on any
     * exception (which is rethrown), release in every case.
     */
    public <T> T execute(Function<UnitOfWork, T> work) {
        try (UnitOfWork unitOfWork = acquire()) {
            T result = work.apply(unitOfWork);
            if (unitOfWork.isActive()) {
                unitOfWork.commit();
            }
            return result;
        }
    }

    public void run(Consumer<UnitOfWork> work) {
        execute(unitOfWork -> {
            work.accept(unitOfWork);
            return null;
        });
    }
}
