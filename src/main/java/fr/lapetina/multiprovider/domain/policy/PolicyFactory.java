package fr.lapetina.multiprovider.domain.policy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory for creating selection policies by configuration name.
 *
 * Every call returns a fresh instance: a rotating cursor belongs to exactly one pool.
 */
public final class PolicyFactory {

    private static final Map<String, Supplier<SelectionPolicy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(RotatingPolicy.NAME, RotatingPolicy::new);
        register(FallbackPolicy.NAME, FallbackPolicy::new);
    }

    private PolicyFactory() {
        // Utility class
    }

    /**
     * Registers a custom policy.
     *
     * @param name Policy name (used in configuration)
     * @param supplier Factory for creating policy instances
     */
    public static void register(String name, Supplier<SelectionPolicy> supplier) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), supplier);
    }

    /**
     * Creates a policy by name.
     *
     * @param name Policy name from configuration
     * @return Policy instance, or empty if not found
     */
    public static Optional<SelectionPolicy> create(String name) {
        Supplier<SelectionPolicy> supplier = REGISTRY.get(name.toLowerCase(Locale.ROOT));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Returns all registered policy names.
     */
    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
