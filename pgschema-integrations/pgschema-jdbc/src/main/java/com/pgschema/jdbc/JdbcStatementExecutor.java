package com.pgschema.jdbc;

import com.pgschema.core.query.BoundStatement;
import com.pgschema.core.query.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link StatementExecutor} that runs bound statements over plain JDBC.
 *
 * <p>Every call opens its own connection from the {@link ConnectionFactory}
 * and closes it before returning, whether the query succeeded or not. The
 * {@code :name} markers of the statement are rewritten to positional
 * {@code ?} placeholders and bound with {@link PreparedStatement#setObject},
 * so restriction values never become part of the SQL text.
 *
 * <p>The configured query timeout is applied to every statement; it is the
 * only cancellation mechanism on this path.
 */
public class JdbcStatementExecutor implements StatementExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);

    private final ConnectionFactory  connections;
    private final JdbcExecutorConfig config;

    public JdbcStatementExecutor(JdbcExecutorConfig config) {
        this(ConnectionFactory.driverManager(config), config);
    }

    public JdbcStatementExecutor(ConnectionFactory connections, JdbcExecutorConfig config) {
        this.connections = Objects.requireNonNull(connections, "connections");
        this.config      = Objects.requireNonNull(config, "config");
    }

    @Override
    public List<Map<String, Object>> execute(BoundStatement statement) throws SQLException {
        NamedParameterSql sql = NamedParameterSql.parse(statement.getText());
        List<Object> values = resolveValues(sql, statement);

        log.debug("Executing metadata query with parameters {}: {}", sql.getNames(), sql.getSql());
        long start = System.currentTimeMillis();

        try (Connection conn = connections.open();
             PreparedStatement ps = conn.prepareStatement(sql.getSql())) {

            ps.setQueryTimeout(config.getQueryTimeoutSeconds());
            ps.setFetchSize(config.getFetchSize());
            for (int i = 0; i < values.size(); i++) {
                ps.setObject(i + 1, values.get(i));
            }

            try (ResultSet rs = ps.executeQuery()) {
                List<Map<String, Object>> rows = toRows(rs);
                log.debug("Metadata query returned {} rows in {}ms", rows.size(), System.currentTimeMillis() - start);
                return rows;
            }
        }
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private static List<Object> resolveValues(NamedParameterSql sql, BoundStatement statement) throws SQLException {
        Map<String, Object> bound = new HashMap<>();
        for (BoundStatement.Parameter p : statement.getParameters()) {
            bound.put(p.getName(), p.getValue());
        }
        List<Object> values = new ArrayList<>(sql.getNames().size());
        for (String name : sql.getNames()) {
            if (!bound.containsKey(name)) {
                throw new SQLException("No value bound for parameter :" + name);
            }
            values.add(bound.get(name));
        }
        return values;
    }

    private static List<Map<String, Object>> toRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int colCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(colCount);
        for (int i = 1; i <= colCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= colCount; i++) {
                row.put(columns.get(i - 1), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
