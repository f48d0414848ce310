package de.t14d3.clientdb.store;

import de.t14d3.clientdb.query.Query;

import java.util.List;

/**
 * Statement execution against the store. Inside {@link StoreAdapter#inTransaction} every call
 * joins the surrounding transaction.
 */
public interface StoreSession {

    <T> List<T> query(Query query, RowMapper<T> mapper);

    /**
     * @return the number of affected rows
     */
    int execute(Query query);
}
