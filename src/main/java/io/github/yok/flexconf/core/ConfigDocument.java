package io.github.yok.flexconf.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.flexconf.config.UndeclaredOptionPolicy;
import io.github.yok.flexconf.exception.ConfigDecodeException;
import io.github.yok.flexconf.exception.InvalidValueException;
import io.github.yok.flexconf.exception.UnknownOptionException;
import io.github.yok.flexconf.parser.ConfigTextParser;
import io.github.yok.flexconf.parser.ParsedOption;
import io.github.yok.flexconf.parser.ValueCodec;
import io.github.yok.flexconf.schema.Blueprint;
import io.github.yok.flexconf.schema.Schema;
import io.github.yok.flexconf.value.ConfigValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory content of a configuration file: exactly one value per blueprint of its schema.
 *
 * <p>
 * A document never holds an option the schema does not declare and never misses one that it
 * does. Values only change through {@link #set(String, String, ConfigValue)}, which validates
 * first and then replaces, so a rejected assignment leaves the document untouched.
 * </p>
 *
 * <p>
 * This class is not thread-safe; {@link ConfigManager} guards it with its lock.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ConfigDocument {

    @Getter
    private final Schema schema;

    // Entries in schema order
    private final Map<OptionKey, ConfigValue> values;

    // Options that were missing from the text and received their default
    @Getter
    private final List<OptionKey> healedOptions;

    // Options found in the text but not declared by the schema
    @Getter
    private final List<OptionKey> undeclaredOptions;

    private ConfigDocument(Schema schema, Map<OptionKey, ConfigValue> values,
            List<OptionKey> healedOptions, List<OptionKey> undeclaredOptions) {
        this.schema = schema;
        this.values = values;
        this.healedOptions = ImmutableList.copyOf(healedOptions);
        this.undeclaredOptions = ImmutableList.copyOf(undeclaredOptions);
    }

    /**
     * Creates a document holding the default value of every blueprint.
     *
     * @param schema schema to follow
     * @return new document
     */
    public static ConfigDocument fromDefaults(Schema schema) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        Map<OptionKey, ConfigValue> values = new LinkedHashMap<>();
        for (Blueprint bp : schema.blueprints()) {
            values.put(keyOf(bp), bp.getDefaultValue());
        }
        return new ConfigDocument(schema, values, ImmutableList.of(), ImmutableList.of());
    }

    /**
     * Parses the text of a configuration file.
     *
     * <p>
     * Every declared option is decoded with the kinds its blueprint accepts and validated against
     * the blueprint. Missing options receive their default value. When an option is assigned more
     * than once, the last assignment wins. Options the schema does not declare are handled
     * according to {@code policy}.
     * </p>
     *
     * @param schema schema to follow
     * @param rawText full file content
     * @param policy handling of undeclared options
     * @return new document
     * @throws ConfigDecodeException if the text or a literal is malformed, or a value breaks its
     *         blueprint; the exception carries section, option and line number
     * @throws UnknownOptionException if {@code policy} is {@link UndeclaredOptionPolicy#FAIL} and
     *         the text contains an undeclared option
     */
    public static ConfigDocument fromText(Schema schema, String rawText,
            UndeclaredOptionPolicy policy) {
        Preconditions.checkNotNull(schema, "schema must not be null");
        Preconditions.checkNotNull(policy, "policy must not be null");

        Map<OptionKey, ParsedOption> assigned = new LinkedHashMap<>();
        List<OptionKey> undeclared = new ArrayList<>();
        for (ParsedOption parsed : ConfigTextParser.parse(rawText)) {
            OptionKey key = new OptionKey(parsed.getSection(), parsed.getOption());
            if (!schema.hasOption(parsed.getSection(), parsed.getOption())) {
                handleUndeclared(key, parsed.getLineNumber(), policy);
                if (!undeclared.contains(key)) {
                    undeclared.add(key);
                }
                continue;
            }
            ParsedOption previous = assigned.put(key, parsed);
            if (previous != null) {
                log.debug("{} assigned again at line {} (line {} ignored)", key,
                        parsed.getLineNumber(), previous.getLineNumber());
            }
        }

        Map<OptionKey, ConfigValue> values = new LinkedHashMap<>();
        List<OptionKey> healed = new ArrayList<>();
        for (Blueprint bp : schema.blueprints()) {
            OptionKey key = keyOf(bp);
            ParsedOption parsed = assigned.get(key);
            if (parsed == null) {
                log.info("{} missing; using default {}", key,
                        ValueCodec.encode(bp.getDefaultValue()));
                values.put(key, bp.getDefaultValue());
                healed.add(key);
                continue;
            }
            values.put(key, decode(bp, parsed));
        }
        return new ConfigDocument(schema, values, healed, undeclared);
    }

    private static ConfigValue decode(Blueprint bp, ParsedOption parsed) {
        ConfigValue value;
        try {
            value = ValueCodec.decode(parsed.getLiteral(), bp.getAcceptedKinds());
        } catch (ConfigDecodeException e) {
            throw e.withContext(bp.getSection(), bp.getOption(), parsed.getLineNumber());
        }
        try {
            bp.validate(value);
        } catch (InvalidValueException e) {
            throw new ConfigDecodeException(e.getMessage(), bp.getSection(), bp.getOption(),
                    parsed.getLineNumber(), e);
        }
        log.debug("{} = {} (line {})", keyOf(bp), value, parsed.getLineNumber());
        return value;
    }

    private static void handleUndeclared(OptionKey key, int lineNumber,
            UndeclaredOptionPolicy policy) {
        switch (policy) {
            case FAIL:
                throw new UnknownOptionException(key.getSection(), key.getOption());
            case WARN:
                log.warn("{} at line {} is not declared and will be dropped", key, lineNumber);
                break;
            default:
                log.debug("{} at line {} is not declared; ignored", key, lineNumber);
                break;
        }
    }

    /**
     * Returns the value of an option.
     *
     * @param section section name
     * @param option option name
     * @return current value
     * @throws UnknownOptionException if the option is not declared
     */
    public ConfigValue get(String section, String option) {
        ConfigValue value = values.get(new OptionKey(section, option));
        if (value == null) {
            throw new UnknownOptionException(section, option);
        }
        return value;
    }

    /**
     * Validates and stores a value. The document is unchanged if validation fails.
     *
     * @param section section name
     * @param option option name
     * @param value new value
     * @throws UnknownOptionException if the option is not declared
     * @throws InvalidValueException if the value breaks the blueprint
     */
    public void set(String section, String option, ConfigValue value) {
        ConfigValue valid = schema.validate(section, option, value);
        values.put(new OptionKey(section, option), valid);
    }

    /**
     * Returns the option keys in schema order.
     *
     * @return immutable list of keys
     */
    public List<OptionKey> keys() {
        return ImmutableList.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns a snapshot of all entries in schema order.
     *
     * @return immutable map
     */
    public Map<OptionKey, ConfigValue> asMap() {
        return ImmutableMap.copyOf(values);
    }

    private static OptionKey keyOf(Blueprint bp) {
        return new OptionKey(bp.getSection(), bp.getOption());
    }
}
