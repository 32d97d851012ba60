package io.flowcheck.core.store;

import java.util.List;
import java.util.Optional;

/// Read-only view over the task-tracking store inspected by the validation checks.
///
/// Implementations are owned by the caller. The flow never pools, retries or
/// closes them; a transient failure surfaces as an unchecked exception from the
/// failing call and is recorded as a fault of the check that made it.
///
/// ### Contracts
/// - Every method is a pure read. No method mutates the store.
/// - Soft-deleted tasks are returned; callers decide how to treat them.
/// - Returned lists are ordered by primary key.
///
/// @implNote Implementations must be safe for concurrent use, since checks in
/// the same layer query the store from different worker threads.
///
/// @see InMemoryTaskStore
public interface TaskStore {

    /// Returns tasks inside the filter, including soft-deleted ones.
    ///
    /// @param filter scope restriction, not null
    /// @return matching tasks ordered by id, never null
    List<TaskRecord> findTasks(StoreFilter filter);

    /// Looks up one task by id, including a soft-deleted one.
    ///
    /// @param id task id, not null
    /// @return the task if present, never null
    Optional<TaskRecord> findTask(String id);

    /// Returns sprints inside the project and sprint components of the filter.
    ///
    /// @param filter scope restriction, not null
    /// @return matching sprints ordered by id, never null
    List<SprintRecord> findSprints(StoreFilter filter);

    /// Returns every project.
    ///
    /// @return all projects ordered by id, never null
    List<ProjectRecord> findProjects();

    /// Returns primary keys that occur more than once in the task, sprint and project tables.
    ///
    /// @return duplicated keys, empty for a healthy store, never null
    List<DuplicateKey> findDuplicateKeys();
}
