package com.autoya.backend.repository;

import java.util.function.Supplier;

/**
 * Groups repository calls into one database transaction.
 *
 * {@link #complete(Supplier)} runs the work, flushes pending changes and
 * commits, so constraint violations surface as exceptions from this call
 * rather than later at an outer transaction boundary.
 */
public interface UnitOfWork {

    /**
     * Runs the work in a new transaction and commits it.
     *
     * @param work repository calls to execute
     * @param <T> result type
     * @return the work's result
     * @throws org.springframework.dao.DataAccessException if a statement fails
     * @throws org.springframework.transaction.TransactionException if commit fails
     */
    <T> T complete(Supplier<T> work);
}
