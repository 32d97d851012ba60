package io.flowcheck.core;

import io.flowcheck.core.store.StoreFilter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/// Configuration options for one validation flow run.
///
/// Use the {@link Builder} for fluent configuration or construct directly
/// with setters for mutable configuration.
///
/// ### Default Values
/// | Option | Default |
/// |--------|---------|
/// | `scope` | `FULL` |
/// | `includePerformance` | `false` |
/// | `parallel` | `true` |
/// | `workerPoolSize` | `4` |
/// | `checkTimeout` | 60 s |
/// | `flowTimeout` | 10 min |
/// | `failFast` | `false` |
/// | `filter` | unrestricted |
/// | `maxRecommendations` | `10` |
/// | `performanceThresholds` | {@link PerformanceThresholds#defaults()} |
/// | `evidenceDirectory` | none |
///
/// @implNote **Not thread-safe**. This is a mutable configuration object
/// intended to be configured before passing to {@link FlowFactory}.
/// Do not modify after environment creation.
///
/// @see FlowFactory
/// @see Builder
public class FlowConfig {

    private ValidationScope scope = ValidationScope.FULL;
    private boolean includePerformance = false;
    private boolean parallel = true;
    private int workerPoolSize = 4;
    private Duration checkTimeout = Duration.ofSeconds(60);
    private Duration flowTimeout = Duration.ofMinutes(10);
    private boolean failFast = false;
    private StoreFilter filter = StoreFilter.none();
    private int maxRecommendations = 10;
    private PerformanceThresholds performanceThresholds = PerformanceThresholds.defaults();
    private Path evidenceDirectory;

    /// Creates a configuration with default values.
    public FlowConfig() {}

    public ValidationScope getScope() {
        return scope;
    }

    public void setScope(ValidationScope scope) {
        this.scope = scope;
    }

    /// Returns whether the performance node may run.
    ///
    /// When `false` the performance node is `SKIPPED` regardless of its
    /// dependencies' outcomes.
    public boolean isIncludePerformance() {
        return includePerformance;
    }

    public void setIncludePerformance(boolean includePerformance) {
        this.includePerformance = includePerformance;
    }

    /// Returns whether ready nodes of a layer run concurrently.
    ///
    /// When `false` they run one at a time in id order. Verdicts and counts are
    /// identical either way.
    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    /// Returns the maximum number of checks executing at once.
    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets the maximum number of checks executing at once.
    ///
    /// ### Contracts
    /// - **Precondition**: `workerPoolSize` should be positive
    ///
    /// @param workerPoolSize the worker count, must be positive
    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    /// Returns the budget of a single check. A check exceeding it is a fault.
    public Duration getCheckTimeout() {
        return checkTimeout;
    }

    public void setCheckTimeout(Duration checkTimeout) {
        this.checkTimeout = checkTimeout;
    }

    /// Returns the budget of the whole run. Exceeding it aborts the run.
    public Duration getFlowTimeout() {
        return flowTimeout;
    }

    public void setFlowTimeout(Duration flowTimeout) {
        this.flowTimeout = flowTimeout;
    }

    /// Returns whether the run stops scheduling after the first failing layer.
    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public StoreFilter getFilter() {
        return filter;
    }

    public void setFilter(StoreFilter filter) {
        this.filter = filter;
    }

    public int getMaxRecommendations() {
        return maxRecommendations;
    }

    public void setMaxRecommendations(int maxRecommendations) {
        this.maxRecommendations = maxRecommendations;
    }

    public PerformanceThresholds getPerformanceThresholds() {
        return performanceThresholds;
    }

    public void setPerformanceThresholds(PerformanceThresholds performanceThresholds) {
        this.performanceThresholds = performanceThresholds;
    }

    /// Returns the directory evidence files are written to and read from, if any.
    public Optional<Path> getEvidenceDirectory() {
        return Optional.ofNullable(evidenceDirectory);
    }

    public void setEvidenceDirectory(Path evidenceDirectory) {
        this.evidenceDirectory = evidenceDirectory;
    }

    /// Checks option ranges.
    ///
    /// @throws IllegalStateException if a numeric option is out of range or a
    /// required option is null
    public void validate() {
        if (scope == null) {
            throw new IllegalStateException("Validation scope is required");
        }
        if (workerPoolSize < 1) {
            throw new IllegalStateException("Worker pool size must be positive: " + workerPoolSize);
        }
        if (checkTimeout == null || checkTimeout.isNegative() || checkTimeout.isZero()) {
            throw new IllegalStateException("Check timeout must be positive: " + checkTimeout);
        }
        if (flowTimeout == null || flowTimeout.isNegative() || flowTimeout.isZero()) {
            throw new IllegalStateException("Flow timeout must be positive: " + flowTimeout);
        }
        if (maxRecommendations < 0) {
            throw new IllegalStateException(
                    "Max recommendations must not be negative: " + maxRecommendations);
        }
        if (filter == null || performanceThresholds == null) {
            throw new IllegalStateException("Filter and performance thresholds are required");
        }
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link FlowConfig} instances.
    ///
    /// @implNote The builder mutates a single config instance and returns
    /// it on {@link #build()}. The returned config can still be modified
    /// via setters after building.
    public static class Builder {

        private final FlowConfig config = new FlowConfig();

        public Builder scope(ValidationScope scope) {
            config.scope = scope;
            return this;
        }

        public Builder includePerformance(boolean includePerformance) {
            config.includePerformance = includePerformance;
            return this;
        }

        public Builder parallel(boolean parallel) {
            config.parallel = parallel;
            return this;
        }

        public Builder workerPoolSize(int workerPoolSize) {
            config.workerPoolSize = workerPoolSize;
            return this;
        }

        public Builder checkTimeout(Duration checkTimeout) {
            config.checkTimeout = checkTimeout;
            return this;
        }

        public Builder flowTimeout(Duration flowTimeout) {
            config.flowTimeout = flowTimeout;
            return this;
        }

        public Builder failFast(boolean failFast) {
            config.failFast = failFast;
            return this;
        }

        public Builder filter(StoreFilter filter) {
            config.filter = filter;
            return this;
        }

        public Builder maxRecommendations(int maxRecommendations) {
            config.maxRecommendations = maxRecommendations;
            return this;
        }

        public Builder performanceThresholds(PerformanceThresholds performanceThresholds) {
            config.performanceThresholds = performanceThresholds;
            return this;
        }

        public Builder evidenceDirectory(Path evidenceDirectory) {
            config.evidenceDirectory = evidenceDirectory;
            return this;
        }

        /// Validates and returns the configured {@link FlowConfig} instance.
        ///
        /// @return the configured instance, never null
        /// @throws IllegalStateException if an option is out of range
        public FlowConfig build() {
            config.validate();
            return config;
        }
    }
}
