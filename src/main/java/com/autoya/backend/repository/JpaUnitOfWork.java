package com.autoya.backend.repository;

import java.util.function.Supplier;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import lombok.extern.slf4j.Slf4j;

/**
 * {@link UnitOfWork} backed by the JPA transaction manager.
 *
 * Always opens a new transaction so a failed unit never leaves an enclosing
 * transaction marked rollback-only. Declared as a {@code @Repository} so JPA
 * exceptions raised by the flush are translated into Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy.
 */
@Slf4j
@Repository
public class JpaUnitOfWork implements UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public <T> T complete(Supplier<T> work) {
        return transactionTemplate.execute(status -> {
            T result = work.get();
            // Flush inside the transaction so constraint errors are raised here
            entityManager.flush();
            log.trace("Unit of work flushed");
            return result;
        });
    }
}
