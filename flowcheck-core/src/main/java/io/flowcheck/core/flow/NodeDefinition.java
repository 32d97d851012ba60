package io.flowcheck.core.flow;

import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.ValidationScope;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/// Declarative description of one node: identity, check id, dependencies and
/// the configuration under which it is scheduled.
///
/// @implNote Immutable and thread-safe.
/// @see FlowGraph#build
public final class NodeDefinition {

    private final String id;
    private final String name;
    private final String checkId;
    private final Set<String> dependencies;
    private final Set<ValidationScope> scopes;
    private final boolean performance;

    private NodeDefinition(Builder builder) {
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.checkId = builder.checkId != null ? builder.checkId : builder.id;
        this.dependencies = Collections.unmodifiableSet(new TreeSet<>(builder.dependencies));
        this.scopes = Collections.unmodifiableSet(EnumSet.copyOf(builder.scopes));
        this.performance = builder.performance;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCheckId() {
        return checkId;
    }

    /// Returns dependency ids in lexicographic order.
    public Set<String> getDependencies() {
        return dependencies;
    }

    public Set<ValidationScope> getScopes() {
        return scopes;
    }

    /// Returns whether this node is a performance check gated by `includePerformance`.
    public boolean isPerformance() {
        return performance;
    }

    /// Explains why the configuration excludes this node.
    ///
    /// @param config the run configuration, not null
    /// @return the skip reason, or empty if the node is scheduled
    public Optional<String> exclusionReason(FlowConfig config) {
        if (!scopes.contains(config.getScope())) {
            return Optional.of(
                    "excluded by " + config.getScope().name().toLowerCase() + " scope");
        }
        if (performance && !config.isIncludePerformance()) {
            return Optional.of("performance checks disabled");
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodeDefinition that)) {
            return false;
        }
        return performance == that.performance
                && id.equals(that.id)
                && name.equals(that.name)
                && checkId.equals(that.checkId)
                && dependencies.equals(that.dependencies)
                && scopes.equals(that.scopes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, checkId, dependencies, scopes, performance);
    }

    @Override
    public String toString() {
        return "NodeDefinition{id=" + id + ", check=" + checkId + ", deps=" + dependencies + "}";
    }

    public static final class Builder {
        private String id;
        private String name;
        private String checkId;
        private final Set<String> dependencies = new TreeSet<>();
        private Set<ValidationScope> scopes = EnumSet.allOf(ValidationScope.class);
        private boolean performance;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /// Sets the display name. Defaults to the id.
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Sets the registry id of the check. Defaults to the node id.
        public Builder checkId(String checkId) {
            this.checkId = checkId;
            return this;
        }

        public Builder dependsOn(String... nodeIds) {
            dependencies.addAll(List.of(nodeIds));
            return this;
        }

        public Builder dependsOn(Set<String> nodeIds) {
            dependencies.addAll(nodeIds);
            return this;
        }

        /// Restricts the scopes this node runs in. Defaults to every scope.
        public Builder scopes(ValidationScope first, ValidationScope... rest) {
            this.scopes = EnumSet.of(first, rest);
            return this;
        }

        public Builder performance(boolean performance) {
            this.performance = performance;
            return this;
        }

        /// @throws IllegalStateException if the id is missing or blank
        public NodeDefinition build() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Node id is required");
            }
            return new NodeDefinition(this);
        }
    }
}
