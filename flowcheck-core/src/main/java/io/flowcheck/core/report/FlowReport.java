package io.flowcheck.core.report;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The terminal artifact of one flow run.
///
/// Produced exactly once per run by {@link ReportAggregator} and immutable
/// thereafter. Every node of the graph appears in {@link #getNodes()} with its
/// terminal status, including `BLOCKED` and `SKIPPED` nodes, so a reader can tell
/// a check that found problems from a check that never ran.
///
/// @implNote Immutable and thread-safe. Collections are defensively copied.
/// @see ReportAggregator
public final class FlowReport {

    private final String flowId;
    private final String flowType;
    private final Instant startedAt;
    private final Instant completedAt;
    private final double durationSeconds;
    private final RunConfiguration configuration;
    private final List<String> executionOrder;
    private final List<List<String>> layers;
    private final List<NodeSummary> nodes;
    private final ValidationSummary validationSummary;
    private final FlowSummary flowSummary;
    private final OverallStatus overallStatus;
    private final List<String> recommendations;

    private FlowReport(Builder builder) {
        this.flowId = Objects.requireNonNull(builder.flowId, "flowId is required");
        this.flowType = builder.flowType;
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt is required");
        this.completedAt = Objects.requireNonNull(builder.completedAt, "completedAt is required");
        this.durationSeconds = builder.durationSeconds;
        this.configuration = builder.configuration;
        this.executionOrder = List.copyOf(builder.executionOrder);
        this.layers = builder.layers.stream().map(List::copyOf).toList();
        this.nodes = List.copyOf(builder.nodes);
        this.validationSummary =
                Objects.requireNonNull(builder.validationSummary, "validationSummary is required");
        this.flowSummary = builder.flowSummary;
        this.overallStatus =
                Objects.requireNonNull(builder.overallStatus, "overallStatus is required");
        this.recommendations = List.copyOf(builder.recommendations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFlowId() {
        return flowId;
    }

    public String getFlowType() {
        return flowType;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public RunConfiguration getConfiguration() {
        return configuration;
    }

    public List<String> getExecutionOrder() {
        return executionOrder;
    }

    public List<List<String>> getLayers() {
        return layers;
    }

    /// Returns one summary per graph node, in execution order.
    public List<NodeSummary> getNodes() {
        return nodes;
    }

    /// Looks up the summary of one node.
    ///
    /// @param id node id, not null
    /// @return the summary if the node exists, never null
    public Optional<NodeSummary> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public ValidationSummary getValidationSummary() {
        return validationSummary;
    }

    public FlowSummary getFlowSummary() {
        return flowSummary;
    }

    public OverallStatus getOverallStatus() {
        return overallStatus;
    }

    /// Returns actionable recommendations, most severe first.
    public List<String> getRecommendations() {
        return recommendations;
    }

    /// Returns the process exit code for this report's verdict.
    public int exitCode() {
        return overallStatus.exitCode();
    }

    @Override
    public String toString() {
        return "FlowReport{flowId=" + flowId + ", overallStatus=" + overallStatus + "}";
    }

    public static final class Builder {
        private String flowId;
        private String flowType;
        private Instant startedAt;
        private Instant completedAt;
        private double durationSeconds;
        private RunConfiguration configuration;
        private List<String> executionOrder = List.of();
        private List<List<String>> layers = List.of();
        private List<NodeSummary> nodes = List.of();
        private ValidationSummary validationSummary;
        private FlowSummary flowSummary;
        private OverallStatus overallStatus;
        private List<String> recommendations = List.of();

        private Builder() {}

        public Builder flowId(String flowId) {
            this.flowId = flowId;
            return this;
        }

        public Builder flowType(String flowType) {
            this.flowType = flowType;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder durationSeconds(double durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder configuration(RunConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder executionOrder(List<String> executionOrder) {
            this.executionOrder = executionOrder;
            return this;
        }

        public Builder layers(List<List<String>> layers) {
            this.layers = layers;
            return this;
        }

        public Builder nodes(List<NodeSummary> nodes) {
            this.nodes = nodes;
            return this;
        }

        public Builder validationSummary(ValidationSummary validationSummary) {
            this.validationSummary = validationSummary;
            return this;
        }

        public Builder flowSummary(FlowSummary flowSummary) {
            this.flowSummary = flowSummary;
            return this;
        }

        public Builder overallStatus(OverallStatus overallStatus) {
            this.overallStatus = overallStatus;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        /// @throws NullPointerException if a required field is missing
        public FlowReport build() {
            return new FlowReport(this);
        }
    }
}
