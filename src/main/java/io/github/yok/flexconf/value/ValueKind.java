package io.github.yok.flexconf.value;

import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed enumeration of the value kinds a configuration option can hold.
 *
 * <p>
 * Each constant carries the human-readable label that is written to the {@code # Tipo:} comment
 * of generated configuration files.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ValueKind {

    // Quoted text.
    TEXT("Texto"),

    // 64-bit signed integer.
    INTEGER("Inteiro"),

    // Double-precision floating point number.
    DECIMAL("Decimal"),

    // Lowercase true / false.
    BOOLEAN("Booleano"),

    // Ordered sequence of values.
    LIST("Lista"),

    // Mapping of quoted text keys to values, insertion order preserved.
    DICT("Dicionário"),

    // Absence of a value.
    NULL("Nulo");

    // Label used in generated documentation comments.
    private final String label;

    /**
     * Determines whether this kind holds nested values.
     *
     * @return {@code true} for {@link #LIST} and {@link #DICT}
     */
    public boolean isContainer() {
        return this == LIST || this == DICT;
    }

    /**
     * Determines whether this kind is numeric.
     *
     * @return {@code true} for {@link #INTEGER} and {@link #DECIMAL}
     */
    public boolean isNumeric() {
        return this == INTEGER || this == DECIMAL;
    }

    /**
     * Returns a new mutable set containing every kind.
     *
     * @return all kinds
     */
    public static Set<ValueKind> all() {
        return EnumSet.allOf(ValueKind.class);
    }
}
