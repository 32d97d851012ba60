package io.flowcheck.core.store;

/// One work item row as read from the task store.
///
/// Timestamps are kept as the raw text the store returned so that unparseable
/// values can be reported instead of failing the read. The `dependsOn`, `blocks`
/// and `assignees` columns hold serialized lists and are likewise kept raw.
///
/// @param id primary key, not null
/// @param title display title, may be null
/// @param status lifecycle status (`new`, `in_progress`, `blocked`, `review`, `done`, `dropped`)
/// @param priority priority label, may be null
/// @param owner responsible person, may be null
/// @param projectId parent project reference, may be null
/// @param sprintId parent sprint reference, may be null
/// @param dependsOn serialized list of task ids this task depends on, may be null
/// @param blocks serialized list of task ids this task blocks, may be null
/// @param assignees serialized list of assignee names, may be null
/// @param riskNotes free-text risk notes, may be null
/// @param createdAt creation timestamp text, may be null
/// @param updatedAt last-update timestamp text, may be null
/// @param doneDate completion timestamp text, may be null
/// @param deletedAt soft-delete timestamp text, null for live rows
/// @param auditTag audit tag, may be null
/// @param correlationHint correlation hint, may be null
public record TaskRecord(
        String id,
        String title,
        String status,
        String priority,
        String owner,
        String projectId,
        String sprintId,
        String dependsOn,
        String blocks,
        String assignees,
        String riskNotes,
        String createdAt,
        String updatedAt,
        String doneDate,
        String deletedAt,
        String auditTag,
        String correlationHint) {

    /// Returns whether the row carries a soft-delete timestamp.
    public boolean isDeleted() {
        return deletedAt != null;
    }

    /// Returns a builder seeded with this record's values.
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .status(status)
                .priority(priority)
                .owner(owner)
                .projectId(projectId)
                .sprintId(sprintId)
                .dependsOn(dependsOn)
                .blocks(blocks)
                .assignees(assignees)
                .riskNotes(riskNotes)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .doneDate(doneDate)
                .deletedAt(deletedAt)
                .auditTag(auditTag)
                .correlationHint(correlationHint);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String title;
        private String status;
        private String priority;
        private String owner;
        private String projectId;
        private String sprintId;
        private String dependsOn;
        private String blocks;
        private String assignees;
        private String riskNotes;
        private String createdAt;
        private String updatedAt;
        private String doneDate;
        private String deletedAt;
        private String auditTag;
        private String correlationHint;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder projectId(String projectId) {
            this.projectId = projectId;
            return this;
        }

        public Builder sprintId(String sprintId) {
            this.sprintId = sprintId;
            return this;
        }

        public Builder dependsOn(String dependsOn) {
            this.dependsOn = dependsOn;
            return this;
        }

        public Builder blocks(String blocks) {
            this.blocks = blocks;
            return this;
        }

        public Builder assignees(String assignees) {
            this.assignees = assignees;
            return this;
        }

        public Builder riskNotes(String riskNotes) {
            this.riskNotes = riskNotes;
            return this;
        }

        public Builder createdAt(String createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(String updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder doneDate(String doneDate) {
            this.doneDate = doneDate;
            return this;
        }

        public Builder deletedAt(String deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public Builder auditTag(String auditTag) {
            this.auditTag = auditTag;
            return this;
        }

        public Builder correlationHint(String correlationHint) {
            this.correlationHint = correlationHint;
            return this;
        }

        public TaskRecord build() {
            if (id == null) {
                throw new IllegalStateException("Task id is required");
            }
            return new TaskRecord(
                    id,
                    title,
                    status,
                    priority,
                    owner,
                    projectId,
                    sprintId,
                    dependsOn,
                    blocks,
                    assignees,
                    riskNotes,
                    createdAt,
                    updatedAt,
                    doneDate,
                    deletedAt,
                    auditTag,
                    correlationHint);
        }
    }
}
