package de.t14d3.clientdb.store;

import de.t14d3.clientdb.query.Dialect;
import de.t14d3.clientdb.query.Query;

import java.util.List;
import java.util.function.Function;

/**
 * Persistent row store behind the cache.
 *
 * Outside of {@link #inTransaction} each {@link #execute} runs in its own transaction.
 * Implementations must be safe to call from several threads.
 */
public interface StoreAdapter extends StoreSession, AutoCloseable {

    Dialect getDialect();

    /**
     * Run {@code work} in one transaction: committed if it returns, rolled back if it throws.
     */
    <T> T inTransaction(Function<StoreSession, T> work);

    /**
     * Run several statements in one transaction.
     */
    default void executeAll(List<Query> statements) {
        inTransaction(session -> {
            for (Query statement : statements) {
                session.execute(statement);
            }
            return null;
        });
    }

    /**
     * Run a statement outside of any transaction. Only used for storage compaction.
     */
    void executeNonTransactional(Query query);

    @Override
    void close();
}
