package io.flowcheck.core.check;

import io.flowcheck.core.exception.CheckNotFoundException;
import java.util.Set;
import java.util.function.Supplier;

/// Maps stable check ids to factories producing {@link Check} instances.
///
/// Flow definitions name checks by id. The graph resolves each id through the
/// registry when it is built, so an unknown id fails construction instead of a run.
///
/// ### Contracts
/// - **Precondition**: check ids are non-null and non-blank
/// - **Postcondition**: a registered id is immediately resolvable
///
/// @implNote Implementations must be thread-safe.
/// @see DefaultCheckRegistry
public interface CheckRegistry {

    /// Registers or replaces the factory for an id.
    ///
    /// @param checkId stable id, not null or blank
    /// @param factory produces a fresh check per call, not null
    /// @throws IllegalArgumentException if checkId is blank
    void register(String checkId, Supplier<? extends Check> factory);

    /// Creates a check for the given id.
    ///
    /// @param checkId the id to resolve, not null
    /// @return a new check instance, never null
    /// @throws CheckNotFoundException if no factory is registered for the id
    Check createCheck(String checkId) throws CheckNotFoundException;

    /// Checks whether an id is registered.
    ///
    /// @param checkId the id, not null
    /// @return `true` if resolvable
    boolean hasCheck(String checkId);

    /// Returns every registered id.
    ///
    /// @return registered ids, never null
    Set<String> getCheckIds();
}
