package com.pgschema.core.query;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * SPI through which the engine runs a {@link BoundStatement} against the
 * relational store.
 *
 * <p>Implementations own the connection lifecycle (acquire, release on every
 * exit path, pooling) and any timeout or cancellation policy; the engine
 * neither retries nor times out a call. They must be safe to call from
 * several threads at once.
 */
@FunctionalInterface
public interface StatementExecutor {

    /**
     * Executes {@code statement}, whose text refers to each parameter as
     * {@code :name}.
     *
     * @param statement the statement text and its named parameter values
     * @return one map per row, keyed by column label
     * @throws SQLException on connectivity, syntax or permission failures
     */
    List<Map<String, Object>> execute(BoundStatement statement) throws SQLException;
}
