package io.flowcheck.cli.persistence;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

/// Temporary SQLite database created from `db/schema.sql`, with row helpers.
///
/// @implNote Test fixture shared by the persistence and command tests.
public final class SqliteTestDatabase {

    public static final String CREATED = "2026-01-02T09:00:00Z";
    public static final String UPDATED = "2026-01-03 10:15:00";

    private final String url;

    private SqliteTestDatabase(String url) {
        this.url = url;
    }

    /// Creates the schema in a new database file.
    public static SqliteTestDatabase create(Path file) throws SQLException, IOException {
        var database = new SqliteTestDatabase("jdbc:sqlite:" + file.toAbsolutePath());
        String schema;
        try (InputStream in = SqliteTestDatabase.class.getResourceAsStream("/db/schema.sql")) {
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = database.connect();
                Statement statement = conn.createStatement()) {
            for (String sql : schema.split(";")) {
                String trimmed = stripComments(sql);
                if (!trimmed.isBlank()) {
                    statement.execute(trimmed);
                }
            }
        }
        return database;
    }

    /// Creates a database holding one project, one active sprint and two linked tasks
    /// with nothing wrong.
    public static SqliteTestDatabase createClean(Path file) throws SQLException, IOException {
        var database = create(file);
        database.insertProject("P1", "active");
        database.insertSprint("S1", "P1", "active");
        database.insertTask("T1", "new", null, "[]", "[\"T2\"]");
        database.insertTask("T2", "in_progress", "ana", "[\"T1\"]", "[]");
        return database;
    }

    private static String stripComments(String sql) {
        StringBuilder sb = new StringBuilder();
        for (String line : sql.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }

    public String getUrl() {
        return url;
    }

    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url);
    }

    public void insertProject(String id, String status) throws SQLException {
        execute(
                "INSERT INTO projects VALUES (?, ?, ?, ?, ?)",
                id, "Project " + id, status, CREATED, UPDATED);
    }

    public void insertSprint(String id, String projectId, String status) throws SQLException {
        execute(
                "INSERT INTO sprints VALUES (?, ?, ?, ?, ?, ?)",
                id, "Sprint " + id, status, projectId, CREATED, UPDATED);
    }

    public void insertTask(String id, String status, String owner, String dependsOn, String blocks)
            throws SQLException {
        execute(
                "INSERT INTO tasks (id, title, status, priority, owner, project_id, sprint_id,"
                        + " depends_on, blocks, assignees, created_at, updated_at, audit_tag)"
                        + " VALUES (?, ?, ?, 'medium', ?, 'P1', 'S1', ?, ?, '[\"ana\"]', ?, ?, ?)",
                id, "Task " + id, status, owner, dependsOn, blocks, CREATED, UPDATED,
                "audit-" + id);
    }

    public void execute(String sql, Object... params) throws SQLException {
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                ps.setObject(i + 1, params[i]);
            }
            ps.executeUpdate();
        }
    }
}
