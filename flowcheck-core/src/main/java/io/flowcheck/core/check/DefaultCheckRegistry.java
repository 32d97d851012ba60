package io.flowcheck.core.check;

import io.flowcheck.core.exception.CheckNotFoundException;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Default {@link CheckRegistry} backed by a concurrent map.
///
/// @implNote Thread-safe. Uses {@link ConcurrentHashMap} for factory storage.
/// @see io.flowcheck.core.check.builtin.BuiltinChecks#registerAll(CheckRegistry)
public class DefaultCheckRegistry implements CheckRegistry {

    private static final Logger logger = Logger.getLogger(DefaultCheckRegistry.class.getName());

    private final Map<String, Supplier<? extends Check>> factories = new ConcurrentHashMap<>();

    @Override
    public void register(String checkId, Supplier<? extends Check> factory) {
        Objects.requireNonNull(checkId, "checkId");
        Objects.requireNonNull(factory, "factory");
        if (checkId.isBlank()) {
            throw new IllegalArgumentException("Check id must not be blank");
        }
        if (factories.put(checkId, factory) != null) {
            logger.warning("Check already registered: " + checkId + ". Replacing...");
        } else {
            logger.fine("Registered check: " + checkId);
        }
    }

    @Override
    public Check createCheck(String checkId) throws CheckNotFoundException {
        Supplier<? extends Check> factory = factories.get(checkId);
        if (factory == null) {
            throw new CheckNotFoundException("Check not found: " + checkId);
        }
        return factory.get();
    }

    @Override
    public boolean hasCheck(String checkId) {
        return factories.containsKey(checkId);
    }

    @Override
    public Set<String> getCheckIds() {
        return new TreeSet<>(factories.keySet());
    }
}
