package io.flowcheck.core.store;

/// Restricts store queries to a single project, sprint, or task status.
///
/// Every component is optional. A `null` component matches all records.
///
/// @param projectId project to restrict to, may be null
/// @param sprintId sprint to restrict to, may be null
/// @param status task status to restrict to, may be null
public record StoreFilter(String projectId, String sprintId, String status) {

    private static final StoreFilter NONE = new StoreFilter(null, null, null);

    /// Returns the filter that matches every record.
    ///
    /// @return the shared unrestricted filter, never null
    public static StoreFilter none() {
        return NONE;
    }

    /// Returns a filter restricted to the given project and sprint.
    ///
    /// @param projectId project id, may be null
    /// @param sprintId sprint id, may be null
    /// @return new filter, never null
    public static StoreFilter of(String projectId, String sprintId) {
        return new StoreFilter(projectId, sprintId, null);
    }

    /// Returns a copy of this filter additionally restricted to the given status.
    ///
    /// @param status task status, may be null to clear the restriction
    /// @return new filter, never null
    public StoreFilter withStatus(String status) {
        return new StoreFilter(projectId, sprintId, status);
    }

    /// Returns whether this filter restricts nothing.
    public boolean isEmpty() {
        return projectId == null && sprintId == null && status == null;
    }

    /// Tests a task against this filter.
    ///
    /// @param task the task to test, not null
    /// @return `true` if every set component equals the task's value
    public boolean matches(TaskRecord task) {
        return (projectId == null || projectId.equals(task.projectId()))
                && (sprintId == null || sprintId.equals(task.sprintId()))
                && (status == null || status.equals(task.status()));
    }

    /// Tests a sprint against the project and sprint components of this filter.
    ///
    /// @param sprint the sprint to test, not null
    /// @return `true` if the sprint is inside the filtered scope
    public boolean matches(SprintRecord sprint) {
        return (projectId == null || projectId.equals(sprint.projectId()))
                && (sprintId == null || sprintId.equals(sprint.id()));
    }
}
