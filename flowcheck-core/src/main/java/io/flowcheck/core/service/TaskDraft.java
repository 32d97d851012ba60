package io.flowcheck.core.service;

import java.util.LinkedHashMap;
import java.util.Map;

/// Payload for creating a task through the task service.
///
/// Only non-null components are sent.
///
/// @param title task title, null to exercise the missing-title rejection
/// @param status initial status, may be null
/// @param priority priority label, may be null
/// @param owner owner, may be null
/// @param projectId parent project, may be null
/// @param sprintId parent sprint, may be null
/// @param description free text, may be null
public record TaskDraft(
        String title,
        String status,
        String priority,
        String owner,
        String projectId,
        String sprintId,
        String description) {

    /// Returns a draft carrying only a title.
    public static TaskDraft minimal(String title) {
        return new TaskDraft(title, null, null, null, null, null, null);
    }

    /// Returns a copy with a different status.
    public TaskDraft withStatus(String newStatus) {
        return new TaskDraft(title, newStatus, priority, owner, projectId, sprintId, description);
    }

    /// Returns the wire payload with snake_case keys.
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        putIfPresent(payload, "title", title);
        putIfPresent(payload, "status", status);
        putIfPresent(payload, "priority", priority);
        putIfPresent(payload, "owner", owner);
        putIfPresent(payload, "project_id", projectId);
        putIfPresent(payload, "sprint_id", sprintId);
        putIfPresent(payload, "description", description);
        return payload;
    }

    private static void putIfPresent(Map<String, Object> payload, String key, String value) {
        if (value != null) {
            payload.put(key, value);
        }
    }
}
