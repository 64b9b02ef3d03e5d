package io.github.yok.flexconf.schema;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexconf.exception.DuplicateOptionException;
import io.github.yok.flexconf.exception.UnknownOptionException;
import io.github.yok.flexconf.value.ConfigValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Ordered catalogue of {@link Blueprint}s grouped by section.
 *
 * <p>
 * Sections and options keep their registration order, which is also the order in which they are
 * written to the configuration file. Once a manager has been initialized with this schema it is
 * frozen and further registrations fail.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class Schema {

    // section -> (option -> blueprint), both in registration order
    private final Map<String, Map<String, Blueprint>> sections = new LinkedHashMap<>();

    private volatile boolean frozen;

    /**
     * Creates a schema from the given blueprints, in order.
     *
     * @param blueprints blueprints to register
     * @return new, unfrozen schema
     * @throws DuplicateOptionException if two blueprints share section and option
     */
    public static Schema of(Blueprint... blueprints) {
        Schema schema = new Schema();
        for (Blueprint blueprint : blueprints) {
            schema.addBlueprint(blueprint);
        }
        return schema;
    }

    /**
     * Registers a blueprint.
     *
     * @param blueprint blueprint to add
     * @return this schema
     * @throws DuplicateOptionException if the section already declares the option
     * @throws IllegalStateException if the schema is frozen
     */
    public synchronized Schema addBlueprint(Blueprint blueprint) {
        Preconditions.checkNotNull(blueprint, "blueprint must not be null");
        if (frozen) {
            throw new IllegalStateException(
                    "Schema is frozen; blueprints must be registered before initialization");
        }
        Map<String, Blueprint> options =
                sections.computeIfAbsent(blueprint.getSection(), k -> new LinkedHashMap<>());
        if (options.containsKey(blueprint.getOption())) {
            throw new DuplicateOptionException(blueprint.getSection(), blueprint.getOption());
        }
        options.put(blueprint.getOption(), blueprint);
        log.debug("Registered {}", blueprint);
        return this;
    }

    /**
     * Validates a value against the blueprint of the given option.
     *
     * @param section section name
     * @param option option name
     * @param value value to validate
     * @return the same value
     * @throws UnknownOptionException if the option is not declared
     */
    public ConfigValue validate(String section, String option, ConfigValue value) {
        return getBlueprint(section, option).validate(value);
    }

    /**
     * Returns the blueprint of an option.
     *
     * @param section section name
     * @param option option name
     * @return blueprint
     * @throws UnknownOptionException if the option is not declared
     */
    public Blueprint getBlueprint(String section, String option) {
        return findBlueprint(section, option)
                .orElseThrow(() -> new UnknownOptionException(section, option));
    }

    /**
     * Looks up the blueprint of an option.
     *
     * @param section section name
     * @param option option name
     * @return blueprint, or empty if not declared
     */
    public synchronized Optional<Blueprint> findBlueprint(String section, String option) {
        Map<String, Blueprint> options = sections.get(section);
        return options == null ? Optional.empty() : Optional.ofNullable(options.get(option));
    }

    public synchronized boolean hasSection(String section) {
        return sections.containsKey(section);
    }

    public boolean hasOption(String section, String option) {
        return findBlueprint(section, option).isPresent();
    }

    /**
     * Returns the section names in registration order.
     *
     * @return immutable list of sections
     */
    public synchronized List<String> getSections() {
        return ImmutableList.copyOf(sections.keySet());
    }

    /**
     * Returns the blueprints of one section in registration order.
     *
     * @param section section name
     * @return immutable list, empty if the section is not declared
     */
    public synchronized List<Blueprint> getBlueprints(String section) {
        Map<String, Blueprint> options = sections.get(section);
        return options == null ? ImmutableList.of() : ImmutableList.copyOf(options.values());
    }

    /**
     * Returns every blueprint, section by section, in registration order.
     *
     * @return immutable list of blueprints
     */
    public synchronized List<Blueprint> blueprints() {
        List<Blueprint> all = new ArrayList<>();
        for (Map<String, Blueprint> options : sections.values()) {
            all.addAll(options.values());
        }
        return ImmutableList.copyOf(all);
    }

    public synchronized int size() {
        return sections.values().stream().mapToInt(Map::size).sum();
    }

    public synchronized boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * Prevents any further registration.
     */
    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }
}
