package io.flowcheck.core.store;

/// One sprint row as read from the task store.
///
/// @param id primary key, not null
/// @param name display name, may be null
/// @param status sprint status (`planned`, `active`, `closed`), may be null
/// @param projectId parent project reference, may be null
/// @param createdAt creation timestamp text, may be null
/// @param updatedAt last-update timestamp text, may be null
public record SprintRecord(
        String id,
        String name,
        String status,
        String projectId,
        String createdAt,
        String updatedAt) {

    /// Sprint status whose member tasks are expected to be live.
    public static final String ACTIVE = "active";

    /// Returns whether the sprint is currently running.
    public boolean isActive() {
        return ACTIVE.equalsIgnoreCase(status);
    }
}
