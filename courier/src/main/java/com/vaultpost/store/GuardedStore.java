package com.vaultpost.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Base for the local table stores.
 *
 * Storage failures never escape a store: reads degrade to an empty result and
 * writes to a no-op, each logged at WARN, so callers keep working in a reduced
 * mode while the database is unavailable or not yet initialized.
 */
abstract class GuardedStore {

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final DatabaseClient db;
    protected final TransactionalOperator tx;

    protected GuardedStore(DatabaseClient db, TransactionalOperator tx) {
        this.db = db;
        this.tx = tx;
    }

    protected <T> Flux<T> readMany(String operation, Flux<T> query) {
        return query.onErrorResume(DataAccessException.class, e -> {
            degraded(operation, e);
            return Flux.empty();
        });
    }

    protected <T> Mono<T> readOne(String operation, Mono<T> query) {
        return query.onErrorResume(DataAccessException.class, e -> {
            degraded(operation, e);
            return Mono.empty();
        });
    }

    protected Mono<Long> count(String operation, Mono<Long> query) {
        return query.defaultIfEmpty(0L).onErrorResume(DataAccessException.class, e -> {
            degraded(operation, e);
            return Mono.just(0L);
        });
    }

    protected Mono<Void> write(String operation, Mono<?> statement) {
        return statement.then().onErrorResume(DataAccessException.class, e -> {
            degraded(operation, e);
            return Mono.empty();
        });
    }

    /** Runs a read-modify-write unit in one transaction; empty when storage is unavailable. */
    protected <T> Mono<T> atomically(String operation, Mono<T> work) {
        return tx.transactional(work).onErrorResume(DataAccessException.class, e -> {
            degraded(operation, e);
            return Mono.empty();
        });
    }

    protected static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
            String name, Object value, Class<?> type) {
        return value == null ? spec.bindNull(name, type) : spec.bind(name, value);
    }

    private void degraded(String operation, Throwable e) {
        log.warn("Local store unavailable during {}: {}", operation, e.getMessage());
    }
}
