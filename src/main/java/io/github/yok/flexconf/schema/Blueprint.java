package io.github.yok.flexconf.schema;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import io.github.yok.flexconf.exception.InvalidBlueprintException;
import io.github.yok.flexconf.exception.InvalidValueException;
import io.github.yok.flexconf.exception.InvalidValueFormatException;
import io.github.yok.flexconf.exception.TypeMismatchException;
import io.github.yok.flexconf.exception.ValueOutOfRangeException;
import io.github.yok.flexconf.value.ConfigValue;
import io.github.yok.flexconf.value.ValueKind;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Declaration of one configuration option: where it lives, which kinds it accepts, its default
 * value and its description.
 *
 * <p>
 * Besides the accepted kinds, a blueprint can restrict:
 * </p>
 * <ul>
 * <li>{@code itemKinds} - kinds allowed for list items and dictionary values, checked at every
 * nesting depth (all kinds by default)</li>
 * <li>{@code minValue}/{@code maxValue} - inclusive bounds for integer and decimal values</li>
 * <li>{@code patterns} - regular expressions, labelled for documentation; a text value (and every
 * nested text) must fully match at least one of them</li>
 * </ul>
 *
 * <p>
 * Blueprints are immutable and are validated when built: the default value must satisfy every
 * rule of its own blueprint.
 * </p>
 *
 * <pre>
 * Blueprint port = Blueprint.builder("net", "port")
 *         .kinds(ValueKind.INTEGER)
 *         .defaultValue(8080)
 *         .minValue(1).maxValue(65535)
 *         .description("Port the server listens on")
 *         .build();
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class Blueprint {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    // Section the option belongs to
    private final String section;

    // Option name inside the section
    private final String option;

    // Kinds accepted for the option value
    private final Set<ValueKind> acceptedKinds;

    // Kinds accepted for nested list items and dictionary values
    private final Set<ValueKind> itemKinds;

    // Human readable description written above the option
    private final String description;

    // Value used when the option is missing from the file
    private final ConfigValue defaultValue;

    // Inclusive lower bound for numeric values, or null
    private final BigDecimal minValue;

    // Inclusive upper bound for numeric values, or null
    private final BigDecimal maxValue;

    // Documentation label -> compiled pattern, in declaration order
    private final Map<String, Pattern> patterns;

    private Blueprint(Builder builder) {
        this.section = builder.section;
        this.option = builder.option;
        this.acceptedKinds = Sets.immutableEnumSet(builder.acceptedKinds);
        this.itemKinds = Sets.immutableEnumSet(builder.itemKinds);
        this.description = Strings.nullToEmpty(builder.description);
        this.defaultValue = builder.defaultValue;
        this.minValue = builder.minValue;
        this.maxValue = builder.maxValue;
        this.patterns = ImmutableMap.copyOf(builder.patterns);
    }

    /**
     * Starts a new blueprint declaration.
     *
     * @param section section name
     * @param option option name
     * @return builder
     */
    public static Builder builder(String section, String option) {
        return new Builder(section, option);
    }

    /**
     * Determines whether the option must hold a value, i.e. does not accept
     * {@link ValueKind#NULL}.
     *
     * @return {@code true} if null is not accepted
     */
    public boolean isRequired() {
        return !acceptedKinds.contains(ValueKind.NULL);
    }

    /**
     * Determines whether nested items are restricted to a subset of the kinds.
     *
     * @return {@code true} if {@code itemKinds} is not every kind
     */
    public boolean hasItemRestriction() {
        return itemKinds.size() < ValueKind.values().length;
    }

    /**
     * Validates a value against every rule of this blueprint.
     *
     * @param value value to validate
     * @return the same value, for chaining
     * @throws TypeMismatchException if the value or a nested item is of a rejected kind
     * @throws ValueOutOfRangeException if a numeric value is outside the bounds
     * @throws InvalidValueFormatException if a text value matches none of the patterns
     */
    public ConfigValue validate(ConfigValue value) {
        if (value == null) {
            throw new TypeMismatchException(section, option, "value must not be null; use "
                    + "ConfigValue.nullValue() for an empty option");
        }
        if (!acceptedKinds.contains(value.getKind())) {
            throw new TypeMismatchException(section, option, "expected " + kindNames(acceptedKinds)
                    + " but found " + value.getKind());
        }
        validateItems(value, "");
        validateRange(value);
        validateFormat(value, "");
        return value;
    }

    private void validateItems(ConfigValue value, String path) {
        if (value.getKind() == ValueKind.LIST) {
            List<ConfigValue> items = value.asList();
            for (int i = 0; i < items.size(); i++) {
                checkItem(items.get(i), path + "[" + i + "]");
            }
        } else if (value.getKind() == ValueKind.DICT) {
            for (Map.Entry<String, ConfigValue> entry : value.asDict().entrySet()) {
                checkItem(entry.getValue(), path + "[\"" + entry.getKey() + "\"]");
            }
        }
    }

    private void checkItem(ConfigValue item, String path) {
        if (!itemKinds.contains(item.getKind())) {
            throw new TypeMismatchException(section, option, "item " + path + " expected "
                    + kindNames(itemKinds) + " but found " + item.getKind());
        }
        validateItems(item, path);
    }

    private void validateRange(ConfigValue value) {
        BigDecimal number;
        String shown;
        if (value.getKind() == ValueKind.INTEGER) {
            number = BigDecimal.valueOf(value.asLong());
            shown = String.valueOf(value.asLong());
        } else if (value.getKind() == ValueKind.DECIMAL) {
            number = BigDecimal.valueOf(value.asDouble());
            shown = String.valueOf(value.asDouble());
        } else {
            return;
        }
        if (minValue != null && number.compareTo(minValue) < 0) {
            throw new ValueOutOfRangeException(section, option,
                    "minimum is " + minValue.toPlainString() + " but was " + shown);
        }
        if (maxValue != null && number.compareTo(maxValue) > 0) {
            throw new ValueOutOfRangeException(section, option,
                    "maximum is " + maxValue.toPlainString() + " but was " + shown);
        }
    }

    private void validateFormat(ConfigValue value, String path) {
        if (patterns.isEmpty()) {
            return;
        }
        switch (value.getKind()) {
            case TEXT:
                String text = value.asText();
                boolean matched =
                        patterns.values().stream().anyMatch(p -> p.matcher(text).matches());
                if (!matched) {
                    String where = path.isEmpty() ? "" : "item " + path + " ";
                    throw new InvalidValueFormatException(section, option,
                            where + "\"" + text + "\" matches none of the formats "
                                    + patterns.keySet());
                }
                break;
            case LIST:
                List<ConfigValue> items = value.asList();
                for (int i = 0; i < items.size(); i++) {
                    validateFormat(items.get(i), path + "[" + i + "]");
                }
                break;
            case DICT:
                for (Map.Entry<String, ConfigValue> entry : value.asDict().entrySet()) {
                    validateFormat(entry.getValue(), path + "[\"" + entry.getKey() + "\"]");
                }
                break;
            default:
                break;
        }
    }

    private static String kindNames(Set<ValueKind> kinds) {
        return kinds.stream().map(ValueKind::name).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        return "Blueprint[" + section + "." + option + " " + acceptedKinds + "]";
    }

    /**
     * Fluent builder for {@link Blueprint}.
     */
    public static final class Builder {

        private final String section;
        private final String option;
        private final Set<ValueKind> acceptedKinds = EnumSet.noneOf(ValueKind.class);
        private final Set<ValueKind> itemKinds = EnumSet.allOf(ValueKind.class);
        private final Map<String, Pattern> patterns = new LinkedHashMap<>();
        private String description = "";
        private ConfigValue defaultValue = ConfigValue.nullValue();
        private BigDecimal minValue;
        private BigDecimal maxValue;

        private Builder(String section, String option) {
            this.section = StringUtils.strip(section);
            this.option = StringUtils.strip(option);
        }

        /**
         * Adds accepted kinds. Include {@link ValueKind#NULL} to make the option optional.
         *
         * @param kinds kinds to accept
         * @return this builder
         */
        public Builder kinds(ValueKind... kinds) {
            acceptedKinds.addAll(Arrays.asList(kinds));
            return this;
        }

        /**
         * Adds accepted kinds.
         *
         * @param kinds kinds to accept
         * @return this builder
         */
        public Builder kinds(Set<ValueKind> kinds) {
            acceptedKinds.addAll(kinds);
            return this;
        }

        /**
         * Restricts the kinds allowed for list items and dictionary values.
         *
         * @param kinds allowed item kinds
         * @return this builder
         */
        public Builder itemKinds(ValueKind... kinds) {
            itemKinds.clear();
            itemKinds.addAll(Arrays.asList(kinds));
            return this;
        }

        /**
         * Sets the description written above the option.
         *
         * @param description description text, may span several lines
         * @return this builder
         */
        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * Sets the default value.
         *
         * @param value default value
         * @return this builder
         */
        public Builder defaultValue(ConfigValue value) {
            this.defaultValue = value == null ? ConfigValue.nullValue() : value;
            return this;
        }

        /**
         * Sets the default value from a plain Java object (see {@link ConfigValue#of(Object)}).
         *
         * @param value default value
         * @return this builder
         * @throws InvalidBlueprintException if the object cannot be converted
         */
        public Builder defaultValue(Object value) {
            try {
                return defaultValue(ConfigValue.of(value));
            } catch (IllegalArgumentException e) {
                throw new InvalidBlueprintException(
                        "Unsupported default for " + section + "." + option + ": "
                                + e.getMessage(),
                        e);
            }
        }

        /**
         * Sets the inclusive minimum for numeric values.
         *
         * @param min minimum
         * @return this builder
         */
        public Builder minValue(long min) {
            this.minValue = BigDecimal.valueOf(min);
            return this;
        }

        /**
         * Sets the inclusive minimum for numeric values.
         *
         * @param min minimum
         * @return this builder
         */
        public Builder minValue(double min) {
            this.minValue = BigDecimal.valueOf(min);
            return this;
        }

        /**
         * Sets the inclusive maximum for numeric values.
         *
         * @param max maximum
         * @return this builder
         */
        public Builder maxValue(long max) {
            this.maxValue = BigDecimal.valueOf(max);
            return this;
        }

        /**
         * Sets the inclusive maximum for numeric values.
         *
         * @param max maximum
         * @return this builder
         */
        public Builder maxValue(double max) {
            this.maxValue = BigDecimal.valueOf(max);
            return this;
        }

        /**
         * Adds an accepted text format.
         *
         * @param label human readable example or name written to the documentation
         * @param regex regular expression the whole text must match
         * @return this builder
         * @throws InvalidBlueprintException if the regex does not compile
         */
        public Builder pattern(String label, String regex) {
            try {
                return pattern(label, Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                throw new InvalidBlueprintException("Invalid pattern '" + label + "' for "
                        + section + "." + option + ": " + e.getDescription(), e);
            }
        }

        /**
         * Adds an accepted text format.
         *
         * @param label human readable example or name written to the documentation
         * @param pattern compiled pattern the whole text must match
         * @return this builder
         */
        public Builder pattern(String label, Pattern pattern) {
            patterns.put(label, pattern);
            return this;
        }

        /**
         * Validates the declaration and creates the blueprint.
         *
         * @return immutable blueprint
         * @throws InvalidBlueprintException if the declaration is inconsistent
         */
        public Blueprint build() {
            if (StringUtils.isBlank(section)) {
                throw new InvalidBlueprintException("Blueprint section must not be blank");
            }
            if (StringUtils.isBlank(option)) {
                throw new InvalidBlueprintException(
                        "Blueprint option of section '" + section + "' must not be blank");
            }
            if (LINE_BREAK.matcher(section).find() || LINE_BREAK.matcher(option).find()) {
                throw new InvalidBlueprintException("Blueprint " + section + "." + option
                        + " must not contain line breaks");
            }
            if (StringUtils.containsAny(section, '[', ']') || StringUtils.containsAny(option,
                    '=', '[', ']', '"', '#', ';', '{', '}', ',', ':')) {
                throw new InvalidBlueprintException("Blueprint " + section + "." + option
                        + " contains characters reserved by the file format");
            }
            if (acceptedKinds.isEmpty()) {
                throw new InvalidBlueprintException(
                        "Blueprint " + section + "." + option + " accepts no kinds");
            }
            if (itemKinds.isEmpty()) {
                throw new InvalidBlueprintException(
                        "Blueprint " + section + "." + option + " allows no item kinds");
            }
            if (minValue != null && maxValue != null && minValue.compareTo(maxValue) > 0) {
                throw new InvalidBlueprintException("Blueprint " + section + "." + option
                        + " has minimum " + minValue + " greater than maximum " + maxValue);
            }
            Blueprint blueprint = new Blueprint(this);
            try {
                blueprint.validate(defaultValue);
            } catch (InvalidValueException e) {
                throw new InvalidBlueprintException(
                        "Default value of " + section + "." + option + " is invalid: "
                                + e.getMessage(),
                        e);
            }
            return blueprint;
        }
    }
}
