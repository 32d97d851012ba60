package io.flowcheck.cli.persistence;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;

/// Small JDBC helper shared by the store queries.
///
/// SQL is always a `static final` constant and parameters are bound through a
/// {@link StatementPreparer}, so query text is never built from input.
///
/// ### Contracts
/// - **Postcondition**: every acquired connection is released via try-with-resources
/// - Every {@link SQLException} surfaces as {@link StoreException}
///
/// @implNote Thread-safe. Each call acquires and releases its own connection.
/// @see JdbcTaskStore
final class JdbcSupport {

    private final DataSource dataSource;

    JdbcSupport(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /// Executes a SELECT returning zero or more mapped rows.
    ///
    /// @param <T> the record type produced by the mapper
    /// @param sql the SELECT statement, not null
    /// @param preparer binds parameters, not null
    /// @param mapper converts each row, not null
    /// @param errorContext message prefix for {@link StoreException}, not null
    /// @return mapped rows in result order, never null
    /// @throws StoreException if the query fails
    <T> List<T> queryList(
            String sql, StatementPreparer preparer, RowMapper<T> mapper, String errorContext) {
        try (var conn = dataSource.getConnection();
                var ps = conn.prepareStatement(sql)) {
            preparer.prepare(ps);
            try (var rs = ps.executeQuery()) {
                var results = new ArrayList<T>();
                while (rs.next()) {
                    results.add(mapper.map(rs));
                }
                return results;
            }
        } catch (SQLException e) {
            throw new StoreException(errorContext + ": " + e.getMessage(), e);
        }
    }

    /// Executes a parameterless SELECT.
    <T> List<T> queryList(String sql, RowMapper<T> mapper, String errorContext) {
        return queryList(sql, ps -> {}, mapper, errorContext);
    }

    /// Binds parameters to a {@link PreparedStatement} before execution.
    @FunctionalInterface
    interface StatementPreparer {

        /// @param ps the statement to bind parameters to, not null
        /// @throws SQLException if binding fails
        void prepare(PreparedStatement ps) throws SQLException;
    }

    /// Maps the current {@link ResultSet} row.
    @FunctionalInterface
    interface RowMapper<T> {

        /// @param rs positioned at the current row, not null
        /// @return the mapped record, not null
        /// @throws SQLException if column access fails
        T map(ResultSet rs) throws SQLException;
    }
}
