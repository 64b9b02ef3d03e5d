package io.github.yok.flexconf.util;

import io.github.yok.flexconf.schema.Blueprint;
import io.github.yok.flexconf.value.ValueKind;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the human readable type label written to the {@code # Tipo:} comment of an option.
 *
 * <p>
 * <strong>Examples:</strong>
 * </p>
 * <ul>
 * <li>{@code Inteiro}</li>
 * <li>{@code Texto, Nulo}</li>
 * <li>{@code Lista[Inteiro, Texto]} for a list restricted to integer and text items</li>
 * <li>{@code Dicionário[Texto, Inteiro]} for a dictionary restricted to integer values</li>
 * <li>{@code Dicionário[Texto, [Inteiro, Texto]]} when several value kinds are allowed</li>
 * </ul>
 *
 * <p>
 * Containers whose items are not restricted are written with the plain label.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TypeHintFormatter {

    private static final String SEPARATOR = ", ";

    private TypeHintFormatter() {
        // Utility class; do not instantiate.
    }

    /**
     * Formats the accepted kinds of a blueprint, in {@link ValueKind} order.
     *
     * @param blueprint blueprint to describe
     * @return type label
     */
    public static String format(Blueprint blueprint) {
        boolean restricted = blueprint.hasItemRestriction();
        return blueprint.getAcceptedKinds().stream()
                .map(kind -> restricted ? labelOf(kind, blueprint.getItemKinds())
                        : kind.getLabel())
                .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Formats one kind, expanding container item kinds.
     *
     * @param kind kind to describe
     * @param itemKinds kinds allowed for items
     * @return type label
     */
    public static String labelOf(ValueKind kind, Set<ValueKind> itemKinds) {
        switch (kind) {
            case LIST:
                return kind.getLabel() + "[" + join(itemKinds) + "]";
            case DICT:
                String values = itemKinds.size() == 1 ? join(itemKinds)
                        : "[" + join(itemKinds) + "]";
                return kind.getLabel() + "[" + ValueKind.TEXT.getLabel() + SEPARATOR + values
                        + "]";
            default:
                return kind.getLabel();
        }
    }

    private static String join(Set<ValueKind> kinds) {
        return kinds.stream().sorted().map(ValueKind::getLabel)
                .collect(Collectors.joining(SEPARATOR));
    }
}
