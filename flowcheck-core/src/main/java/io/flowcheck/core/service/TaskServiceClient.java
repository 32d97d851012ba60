package io.flowcheck.core.service;

import java.util.Map;

/// Client for the task service's external interface, used by behavior checks.
///
/// Covers the `/api/v1/tasks` resource: list, create, read, partial update and
/// delete. HTTP error statuses are returned as {@link ServiceResponse} values,
/// never thrown, because the checks assert on them.
///
/// ### Contracts
/// - **Postcondition**: every method returns a response or throws {@link TaskServiceException}
/// - Transport failures (connection refused, I/O error, interrupt) throw {@link TaskServiceException}
///
/// @implNote Implementations must be safe for concurrent use.
public interface TaskServiceClient {

    /// Lists tasks, optionally filtered by `status`, `priority`, `sprint_id`,
    /// `project_id` or `per_page`.
    ///
    /// @param query query parameters, not null, may be empty
    /// @return the service response, never null
    ServiceResponse listTasks(Map<String, String> query);

    /// Creates a task. A successful create answers `201`.
    ///
    /// @param draft the task payload, not null
    /// @return the service response, never null
    ServiceResponse createTask(TaskDraft draft);

    /// Reads one task. A missing task answers `404`.
    ///
    /// @param id task id, not null
    /// @return the service response, never null
    ServiceResponse getTask(String id);

    /// Applies a partial update to one task.
    ///
    /// @param id task id, not null
    /// @param changes fields to change, not null
    /// @return the service response, never null
    ServiceResponse updateTask(String id, Map<String, Object> changes);

    /// Deletes one task. A successful delete answers `204`.
    ///
    /// @param id task id, not null
    /// @return the service response, never null
    ServiceResponse deleteTask(String id);
}
