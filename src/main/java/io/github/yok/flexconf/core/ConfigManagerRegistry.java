package io.github.yok.flexconf.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Name to {@link ConfigManager} registry owned by the application.
 *
 * <p>
 * Lets several components share one manager per configuration name without a global singleton.
 * The registry is thread-safe; {@link #getOrCreate(String, Function)} creates at most one manager
 * per name.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConfigManagerRegistry {

    private final ConcurrentMap<String, ConfigManager> managers = new ConcurrentHashMap<>();

    /**
     * Returns the manager registered under {@code name}, creating it on first use.
     *
     * @param name registration name
     * @param factory creates the manager from the name
     * @return registered manager
     */
    public ConfigManager getOrCreate(String name, Function<String, ConfigManager> factory) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkNotNull(factory, "factory must not be null");
        return managers.computeIfAbsent(name, n -> {
            log.debug("Creating configuration manager '{}'", n);
            return Preconditions.checkNotNull(factory.apply(n),
                    "factory returned null for '%s'", n);
        });
    }

    /**
     * Registers an existing manager.
     *
     * @param name registration name
     * @param manager manager to register
     * @throws IllegalArgumentException if the name is already taken
     */
    public void register(String name, ConfigManager manager) {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkNotNull(manager, "manager must not be null");
        ConfigManager previous = managers.putIfAbsent(name, manager);
        Preconditions.checkArgument(previous == null,
                "A configuration manager named '%s' is already registered", name);
    }

    public Optional<ConfigManager> find(String name) {
        return Optional.ofNullable(managers.get(name));
    }

    /**
     * Returns a registered manager.
     *
     * @param name registration name
     * @return manager
     * @throws IllegalArgumentException if nothing is registered under the name
     */
    public ConfigManager get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException(
                "No configuration manager named '" + name + "'"));
    }

    /**
     * Removes a registration.
     *
     * @param name registration name
     * @return removed manager, or empty
     */
    public Optional<ConfigManager> remove(String name) {
        return Optional.ofNullable(managers.remove(name));
    }

    public Set<String> names() {
        return ImmutableSet.copyOf(managers.keySet());
    }
}
