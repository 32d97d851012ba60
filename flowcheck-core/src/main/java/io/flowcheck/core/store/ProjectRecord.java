package io.flowcheck.core.store;

/// One project row as read from the task store.
///
/// @param id primary key, not null
/// @param name display name, may be null
/// @param status project status, may be null
/// @param createdAt creation timestamp text, may be null
/// @param updatedAt last-update timestamp text, may be null
public record ProjectRecord(
        String id, String name, String status, String createdAt, String updatedAt) {}
