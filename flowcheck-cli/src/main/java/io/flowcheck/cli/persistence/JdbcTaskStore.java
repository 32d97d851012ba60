package io.flowcheck.cli.persistence;

import io.flowcheck.core.store.DuplicateKey;
import io.flowcheck.core.store.ProjectRecord;
import io.flowcheck.core.store.SprintRecord;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.core.store.TaskRecord;
import io.flowcheck.core.store.TaskStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// Task store backed by the `tasks`, `sprints` and `projects` tables of a
/// SQLite or PostgreSQL database.
///
/// Timestamp columns are read as text when the column is textual and converted
/// to ISO-8601 when the driver returns a temporal value, so malformed stored
/// values reach the integrity check instead of failing the read.
///
/// ### Contracts
/// - **Precondition**: the three tables exist with the columns named in the SQL constants
/// - Every method is a single read-only query
///
/// @implNote Thread-safe. Each call acquires its own connection via {@link JdbcSupport}.
public class JdbcTaskStore implements TaskStore {

    // --- SQL constants ---

    private static final String TASK_COLUMNS =
            """
            id, title, status, priority, owner, project_id, sprint_id, depends_on, blocks,
            assignees, risk_notes, created_at, updated_at, done_date, deleted_at, audit_tag,
            correlation_hint
            """;

    private static final String SQL_FIND_TASKS =
            "SELECT "
                    + TASK_COLUMNS
                    + """
                    FROM tasks
                    WHERE (CAST(? AS VARCHAR) IS NULL OR project_id = ?)
                      AND (CAST(? AS VARCHAR) IS NULL OR sprint_id = ?)
                      AND (CAST(? AS VARCHAR) IS NULL OR status = ?)
                    ORDER BY id
                    """;

    private static final String SQL_FIND_TASK =
            "SELECT " + TASK_COLUMNS + " FROM tasks WHERE id = ?";

    private static final String SQL_FIND_SPRINTS =
            """
            SELECT id, name, status, project_id, created_at, updated_at
            FROM sprints
            WHERE (CAST(? AS VARCHAR) IS NULL OR project_id = ?)
              AND (CAST(? AS VARCHAR) IS NULL OR id = ?)
            ORDER BY id
            """;

    private static final String SQL_FIND_PROJECTS =
            "SELECT id, name, status, created_at, updated_at FROM projects ORDER BY id";

    private static final String SQL_DUPLICATE_TASKS =
            """
            SELECT id, count(*) AS occurrences FROM tasks
            GROUP BY id HAVING count(*) > 1 ORDER BY id
            """;

    private static final String SQL_DUPLICATE_SPRINTS =
            """
            SELECT id, count(*) AS occurrences FROM sprints
            GROUP BY id HAVING count(*) > 1 ORDER BY id
            """;

    private static final String SQL_DUPLICATE_PROJECTS =
            """
            SELECT id, count(*) AS occurrences FROM projects
            GROUP BY id HAVING count(*) > 1 ORDER BY id
            """;

    // --- Fields ---

    private final JdbcSupport jdbc;

    public JdbcTaskStore(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
    }

    @Override
    public List<TaskRecord> findTasks(StoreFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");

        return jdbc.queryList(
                SQL_FIND_TASKS,
                ps -> {
                    ps.setString(1, filter.projectId());
                    ps.setString(2, filter.projectId());
                    ps.setString(3, filter.sprintId());
                    ps.setString(4, filter.sprintId());
                    ps.setString(5, filter.status());
                    ps.setString(6, filter.status());
                },
                JdbcTaskStore::mapTask,
                "Failed to list tasks");
    }

    @Override
    public Optional<TaskRecord> findTask(String id) {
        Objects.requireNonNull(id, "id must not be null");

        return jdbc
                .queryList(
                        SQL_FIND_TASK,
                        ps -> ps.setString(1, id),
                        JdbcTaskStore::mapTask,
                        "Failed to find task: " + id)
                .stream()
                .findFirst();
    }

    @Override
    public List<SprintRecord> findSprints(StoreFilter filter) {
        Objects.requireNonNull(filter, "filter must not be null");

        return jdbc.queryList(
                SQL_FIND_SPRINTS,
                ps -> {
                    ps.setString(1, filter.projectId());
                    ps.setString(2, filter.projectId());
                    ps.setString(3, filter.sprintId());
                    ps.setString(4, filter.sprintId());
                },
                rs ->
                        new SprintRecord(
                                rs.getString("id"),
                                rs.getString("name"),
                                rs.getString("status"),
                                rs.getString("project_id"),
                                timestampText(rs, "created_at"),
                                timestampText(rs, "updated_at")),
                "Failed to list sprints");
    }

    @Override
    public List<ProjectRecord> findProjects() {
        return jdbc.queryList(
                SQL_FIND_PROJECTS,
                rs ->
                        new ProjectRecord(
                                rs.getString("id"),
                                rs.getString("name"),
                                rs.getString("status"),
                                timestampText(rs, "created_at"),
                                timestampText(rs, "updated_at")),
                "Failed to list projects");
    }

    @Override
    public List<DuplicateKey> findDuplicateKeys() {
        List<DuplicateKey> duplicates = new ArrayList<>();
        duplicates.addAll(duplicates(SQL_DUPLICATE_TASKS, "tasks"));
        duplicates.addAll(duplicates(SQL_DUPLICATE_SPRINTS, "sprints"));
        duplicates.addAll(duplicates(SQL_DUPLICATE_PROJECTS, "projects"));
        return duplicates;
    }

    private List<DuplicateKey> duplicates(String sql, String table) {
        return jdbc.queryList(
                sql,
                rs -> new DuplicateKey(table, rs.getString("id"), rs.getInt("occurrences")),
                "Failed to scan duplicate keys in " + table);
    }

    private static TaskRecord mapTask(ResultSet rs) throws SQLException {
        return TaskRecord.builder()
                .id(rs.getString("id"))
                .title(rs.getString("title"))
                .status(rs.getString("status"))
                .priority(rs.getString("priority"))
                .owner(rs.getString("owner"))
                .projectId(rs.getString("project_id"))
                .sprintId(rs.getString("sprint_id"))
                .dependsOn(rs.getString("depends_on"))
                .blocks(rs.getString("blocks"))
                .assignees(rs.getString("assignees"))
                .riskNotes(rs.getString("risk_notes"))
                .createdAt(timestampText(rs, "created_at"))
                .updatedAt(timestampText(rs, "updated_at"))
                .doneDate(timestampText(rs, "done_date"))
                .deletedAt(timestampText(rs, "deleted_at"))
                .auditTag(rs.getString("audit_tag"))
                .correlationHint(rs.getString("correlation_hint"))
                .build();
    }

    /// Reads a timestamp column as text, normalizing driver temporal types to ISO-8601.
    static String timestampText(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().toString();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant().toString();
        }
        return value.toString();
    }
}
