package com.e2eq.persistence.backend;

/**
 * Work executed inside {@link StorageBackend#transaction(TransactionWork)}.
 *
 * @param <T> result type
 * @param <E> checked exception the work may raise, rethrown unchanged after rollback
 */
@FunctionalInterface
public interface TransactionWork<T, E extends Exception> {
    T execute(StorageBackend backend) throws E;
}
