package io.flowcheck.cli.persistence;

import javax.sql.DataSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

/// Creates an unpooled {@link DataSource} for a task-store JDBC URL.
///
/// Supported URLs:
/// - `jdbc:sqlite:<path>`, opened read-only
/// - `jdbc:postgresql://host:port/db`, with optional user and password
public final class DataSourceFactory {

    private DataSourceFactory() {}

    /// @param url JDBC URL, not null
    /// @param user database user, may be null (ignored for SQLite)
    /// @param password database password, may be null (ignored for SQLite)
    /// @return a data source for the URL, never null
    /// @throws IllegalArgumentException if the URL names an unsupported database
    public static DataSource create(String url, String user, String password) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("A database URL is required");
        }
        if (url.startsWith("jdbc:sqlite:")) {
            SQLiteConfig config = new SQLiteConfig();
            config.setReadOnly(true);
            SQLiteDataSource dataSource = new SQLiteDataSource(config);
            dataSource.setUrl(url);
            return dataSource;
        }
        if (url.startsWith("jdbc:postgresql:")) {
            PGSimpleDataSource dataSource = new PGSimpleDataSource();
            dataSource.setUrl(url);
            if (user != null && !user.isBlank()) {
                dataSource.setUser(user);
            }
            if (password != null) {
                dataSource.setPassword(password);
            }
            dataSource.setReadOnly(true);
            return dataSource;
        }
        throw new IllegalArgumentException(
                "Unsupported database URL: " + url + ". Use jdbc:sqlite: or jdbc:postgresql:");
    }
}
