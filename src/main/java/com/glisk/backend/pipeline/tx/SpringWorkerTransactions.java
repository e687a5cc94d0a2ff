package com.glisk.backend.pipeline.tx;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * Programmatic transactions over the JPA transaction manager. Each {@link #begin()} starts a
 * fresh REQUIRES_NEW scope, so a worker can commit the attempt counter and then decide the
 * outcome in a second, independent commit.
 */
@RequiredArgsConstructor
@Component
public class SpringWorkerTransactions implements WorkerTransactions {

    private final PlatformTransactionManager txManager;

    @Override
    public WorkerTransaction begin() {
        DefaultTransactionDefinition def = new DefaultTransactionDefinition();
        def.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName("worker-tx");
        return new Handle(txManager, txManager.getTransaction(def));
    }

    private static final class Handle implements WorkerTransaction {

        private final PlatformTransactionManager txManager;
        private final TransactionStatus status;

        private Handle(PlatformTransactionManager txManager, TransactionStatus status) {
            this.txManager = txManager;
            this.status = status;
        }

        @Override
        public void commit() {
            if (status.isCompleted()) throw new IllegalStateException("transaction already completed");
            txManager.commit(status);
        }

        @Override
        public void rollback() {
            if (status.isCompleted()) return;
            txManager.rollback(status);
        }

        @Override
        public boolean isCompleted() {
            return status.isCompleted();
        }
    }
}
