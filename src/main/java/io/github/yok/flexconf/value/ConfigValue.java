package io.github.yok.flexconf.value;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable typed value stored in a configuration option.
 *
 * <p>
 * A value is a tagged union over the seven {@link ValueKind kinds}. Lists and dictionaries are
 * built from already constructed values, so nesting can go to any depth but a value can never
 * contain itself.
 * </p>
 *
 * <p>
 * Payload types per kind:
 * </p>
 * <ul>
 * <li>{@link ValueKind#TEXT} - {@link String}</li>
 * <li>{@link ValueKind#INTEGER} - {@link Long}</li>
 * <li>{@link ValueKind#DECIMAL} - {@link Double} (finite only)</li>
 * <li>{@link ValueKind#BOOLEAN} - {@link Boolean}</li>
 * <li>{@link ValueKind#LIST} - immutable {@link List} of {@link ConfigValue}</li>
 * <li>{@link ValueKind#DICT} - immutable insertion-ordered {@link Map} of text keys</li>
 * <li>{@link ValueKind#NULL} - no payload</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public final class ConfigValue {

    private static final ConfigValue NULL = new ConfigValue(ValueKind.NULL, null);
    private static final ConfigValue TRUE = new ConfigValue(ValueKind.BOOLEAN, Boolean.TRUE);
    private static final ConfigValue FALSE = new ConfigValue(ValueKind.BOOLEAN, Boolean.FALSE);

    @Getter
    private final ValueKind kind;

    private final Object payload;

    private ConfigValue(ValueKind kind, Object payload) {
        this.kind = kind;
        this.payload = payload;
    }

    /**
     * Creates a text value.
     *
     * @param value text, must not be {@code null}
     * @return text value
     */
    public static ConfigValue text(String value) {
        Preconditions.checkNotNull(value, "text value must not be null");
        return new ConfigValue(ValueKind.TEXT, value);
    }

    /**
     * Creates an integer value.
     *
     * @param value integer
     * @return integer value
     */
    public static ConfigValue integer(long value) {
        return new ConfigValue(ValueKind.INTEGER, value);
    }

    /**
     * Creates a decimal value.
     *
     * @param value finite double
     * @return decimal value
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static ConfigValue decimal(double value) {
        Preconditions.checkArgument(Double.isFinite(value),
                "decimal value must be finite: %s", value);
        return new ConfigValue(ValueKind.DECIMAL, value);
    }

    /**
     * Returns the boolean value.
     *
     * @param value boolean
     * @return shared boolean value
     */
    public static ConfigValue bool(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Returns the null value.
     *
     * @return shared null value
     */
    public static ConfigValue nullValue() {
        return NULL;
    }

    /**
     * Creates a list value.
     *
     * @param items items in order, none of them {@code null}
     * @return list value
     */
    public static ConfigValue list(List<ConfigValue> items) {
        Preconditions.checkNotNull(items, "list items must not be null");
        return new ConfigValue(ValueKind.LIST, ImmutableList.copyOf(items));
    }

    /**
     * Creates a list value.
     *
     * @param items items in order
     * @return list value
     */
    public static ConfigValue list(ConfigValue... items) {
        return list(Arrays.asList(items));
    }

    /**
     * Creates a dictionary value preserving the iteration order of {@code entries}.
     *
     * @param entries entries, keys and values must not be {@code null}
     * @return dictionary value
     */
    public static ConfigValue dict(Map<String, ConfigValue> entries) {
        Preconditions.checkNotNull(entries, "dictionary entries must not be null");
        return new ConfigValue(ValueKind.DICT, ImmutableMap.copyOf(entries));
    }

    /**
     * Converts a plain Java object into a value.
     *
     * <p>
     * Accepted inputs: {@code null}, {@link ConfigValue}, {@link CharSequence}, {@link Byte},
     * {@link Short}, {@link Integer}, {@link Long}, {@link Float}, {@link Double},
     * {@link Boolean}, {@link List} and {@link Map} with text keys (converted recursively).
     * </p>
     *
     * @param raw object to convert
     * @return converted value
     * @throws IllegalArgumentException if the object (or a nested element) is not supported
     */
    public static ConfigValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof ConfigValue) {
            return (ConfigValue) raw;
        }
        if (raw instanceof CharSequence) {
            return text(raw.toString());
        }
        if (raw instanceof Boolean) {
            return bool((Boolean) raw);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short
                || raw instanceof Byte) {
            return integer(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            return decimal(((Number) raw).doubleValue());
        }
        if (raw instanceof List) {
            List<ConfigValue> items = new ArrayList<>();
            for (Object item : (List<?>) raw) {
                items.add(of(item));
            }
            return list(items);
        }
        if (raw instanceof Map) {
            Map<String, ConfigValue> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                Preconditions.checkArgument(entry.getKey() instanceof String,
                        "dictionary keys must be text, got: %s", entry.getKey());
                entries.put((String) entry.getKey(), of(entry.getValue()));
            }
            return dict(entries);
        }
        throw new IllegalArgumentException(
                "Unsupported configuration value type: " + raw.getClass().getName());
    }

    /**
     * Determines whether this is the null value.
     *
     * @return {@code true} when the kind is {@link ValueKind#NULL}
     */
    public boolean isNull() {
        return kind == ValueKind.NULL;
    }

    /**
     * Returns the text payload.
     *
     * @return text
     * @throws IllegalStateException if this value is not text
     */
    public String asText() {
        return (String) payloadOf(ValueKind.TEXT);
    }

    /**
     * Returns the integer payload.
     *
     * @return integer
     * @throws IllegalStateException if this value is not an integer
     */
    public long asLong() {
        return (Long) payloadOf(ValueKind.INTEGER);
    }

    /**
     * Returns the decimal payload.
     *
     * @return decimal
     * @throws IllegalStateException if this value is not a decimal
     */
    public double asDouble() {
        return (Double) payloadOf(ValueKind.DECIMAL);
    }

    /**
     * Returns the boolean payload.
     *
     * @return boolean
     * @throws IllegalStateException if this value is not a boolean
     */
    public boolean asBoolean() {
        return (Boolean) payloadOf(ValueKind.BOOLEAN);
    }

    /**
     * Returns the list payload.
     *
     * @return immutable list of items
     * @throws IllegalStateException if this value is not a list
     */
    @SuppressWarnings("unchecked")
    public List<ConfigValue> asList() {
        return (List<ConfigValue>) payloadOf(ValueKind.LIST);
    }

    /**
     * Returns the dictionary payload.
     *
     * @return immutable insertion-ordered map
     * @throws IllegalStateException if this value is not a dictionary
     */
    @SuppressWarnings("unchecked")
    public Map<String, ConfigValue> asDict() {
        return (Map<String, ConfigValue>) payloadOf(ValueKind.DICT);
    }

    /**
     * Converts this value back into plain Java objects.
     *
     * <p>
     * Lists become {@link List}, dictionaries become insertion-ordered {@link Map}, and
     * {@link ValueKind#NULL} becomes {@code null}. The returned collections are unmodifiable.
     * </p>
     *
     * @return plain Java representation
     */
    public Object toJava() {
        switch (kind) {
            case LIST: {
                List<Object> items = new ArrayList<>();
                for (ConfigValue item : asList()) {
                    items.add(item.toJava());
                }
                return Collections.unmodifiableList(items);
            }
            case DICT: {
                Map<String, Object> entries = new LinkedHashMap<>();
                for (Map.Entry<String, ConfigValue> entry : asDict().entrySet()) {
                    entries.put(entry.getKey(), entry.getValue().toJava());
                }
                return Collections.unmodifiableMap(entries);
            }
            default:
                return payload;
        }
    }

    @Override
    public String toString() {
        return kind + "(" + payload + ")";
    }

    private Object payloadOf(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
        return payload;
    }
}
