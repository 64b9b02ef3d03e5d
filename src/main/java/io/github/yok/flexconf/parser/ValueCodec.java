package io.github.yok.flexconf.parser;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.github.yok.flexconf.exception.ConfigDecodeException;
import io.github.yok.flexconf.value.ConfigValue;
import io.github.yok.flexconf.value.ValueKind;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Encodes and decodes single typed values to and from their textual literal form.
 *
 * <p>
 * <strong>Encoding rules:</strong>
 * </p>
 * <ul>
 * <li>Text is double-quoted; quotes, backslashes, control characters and the Unicode line and
 * paragraph separators are escaped.</li>
 * <li>Integers use plain decimal notation.</li>
 * <li>Decimals use plain notation with {@code .} and at least one fractional digit.</li>
 * <li>Booleans are lowercase {@code true}/{@code false}.</li>
 * <li>Null is empty text at top level and {@code null} inside lists and dictionaries.</li>
 * <li>Lists are {@code [a, b]}; dictionaries are {@code {"key": value}} with quoted keys.</li>
 * </ul>
 *
 * <p>
 * {@link #encode(ConfigValue)} always produces a single line. {@link #encodePretty(ConfigValue)}
 * writes one list item or dictionary entry per line and is used for files. Both forms decode back
 * to an equal value.
 * </p>
 *
 * <p>
 * Decoding is strict: booleans are case-sensitive, integers never contain a decimal point, and
 * anything after the literal is an error.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ValueCodec {

    private static final String INDENT = "    ";

    // Line breaks outside the ISO control range; written escaped so a string stays on one line
    private static final char LINE_SEPARATOR = 0x2028;
    private static final char PARAGRAPH_SEPARATOR = 0x2029;

    private ValueCodec() {
        // Utility class; do not instantiate.
    }

    /**
     * Encodes a value into its canonical single-line literal.
     *
     * @param value value to encode
     * @return literal text
     */
    public static String encode(ConfigValue value) {
        Preconditions.checkNotNull(value, "value must not be null");
        if (value.isNull()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendCompact(sb, value);
        return sb.toString();
    }

    /**
     * Encodes a value into a multi-line literal with one item per line.
     *
     * <p>
     * Non-empty lists and dictionaries are expanded and indented four spaces per depth; scalars
     * and empty containers are identical to {@link #encode(ConfigValue)}.
     * </p>
     *
     * @param value value to encode
     * @return literal text, possibly spanning several lines
     */
    public static String encodePretty(ConfigValue value) {
        Preconditions.checkNotNull(value, "value must not be null");
        if (value.isNull()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendPretty(sb, value, 0);
        return sb.toString();
    }

    /**
     * Decodes a literal of any kind.
     *
     * @param literal literal text; blank text decodes to null
     * @return decoded value
     * @throws ConfigDecodeException if the literal is malformed
     */
    public static ConfigValue decode(String literal) {
        return decode(literal, ValueKind.all());
    }

    /**
     * Decodes a literal and checks that its kind is one of {@code expectedKinds}.
     *
     * @param literal literal text; blank text decodes to null
     * @param expectedKinds accepted kinds
     * @return decoded value
     * @throws ConfigDecodeException if the literal is malformed or of an unexpected kind
     */
    public static ConfigValue decode(String literal, Set<ValueKind> expectedKinds) {
        Preconditions.checkNotNull(expectedKinds, "expectedKinds must not be null");
        ConfigValue value = new LiteralReader(Strings.nullToEmpty(literal)).readDocument();
        if (!expectedKinds.contains(value.getKind())) {
            throw new ConfigDecodeException("expected " + describe(expectedKinds) + " but found "
                    + value.getKind());
        }
        return value;
    }

    /**
     * Quotes and escapes text as a string literal.
     *
     * @param text raw text
     * @return quoted literal
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        appendQuoted(sb, text);
        return sb.toString();
    }

    /**
     * Formats a decimal in plain notation with at least one fractional digit.
     *
     * @param value finite double
     * @return plain decimal text such as {@code 3.0} or {@code 0.00001}
     */
    public static String formatDecimal(double value) {
        if (value == 0.0d && Double.doubleToRawLongBits(value) != 0L) {
            return "-0.0";
        }
        String plain = BigDecimal.valueOf(value).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static void appendCompact(StringBuilder sb, ConfigValue value) {
        switch (value.getKind()) {
            case LIST: {
                sb.append('[');
                Iterator<ConfigValue> it = value.asList().iterator();
                while (it.hasNext()) {
                    appendCompact(sb, it.next());
                    if (it.hasNext()) {
                        sb.append(", ");
                    }
                }
                sb.append(']');
                break;
            }
            case DICT: {
                sb.append('{');
                Iterator<Map.Entry<String, ConfigValue>> it = value.asDict().entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, ConfigValue> entry = it.next();
                    appendQuoted(sb, entry.getKey());
                    sb.append(": ");
                    appendCompact(sb, entry.getValue());
                    if (it.hasNext()) {
                        sb.append(", ");
                    }
                }
                sb.append('}');
                break;
            }
            default:
                appendScalar(sb, value);
        }
    }

    private static void appendPretty(StringBuilder sb, ConfigValue value, int depth) {
        switch (value.getKind()) {
            case LIST: {
                List<ConfigValue> items = value.asList();
                if (items.isEmpty()) {
                    sb.append("[]");
                    return;
                }
                sb.append("[\n");
                for (int i = 0; i < items.size(); i++) {
                    indent(sb, depth + 1);
                    appendPretty(sb, items.get(i), depth + 1);
                    sb.append(i < items.size() - 1 ? ",\n" : "\n");
                }
                indent(sb, depth);
                sb.append(']');
                break;
            }
            case DICT: {
                Map<String, ConfigValue> entries = value.asDict();
                if (entries.isEmpty()) {
                    sb.append("{}");
                    return;
                }
                sb.append("{\n");
                Iterator<Map.Entry<String, ConfigValue>> it = entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<String, ConfigValue> entry = it.next();
                    indent(sb, depth + 1);
                    appendQuoted(sb, entry.getKey());
                    sb.append(": ");
                    appendPretty(sb, entry.getValue(), depth + 1);
                    sb.append(it.hasNext() ? ",\n" : "\n");
                }
                indent(sb, depth);
                sb.append('}');
                break;
            }
            default:
                appendScalar(sb, value);
        }
    }

    private static void appendScalar(StringBuilder sb, ConfigValue value) {
        switch (value.getKind()) {
            case TEXT:
                appendQuoted(sb, value.asText());
                break;
            case INTEGER:
                sb.append(value.asLong());
                break;
            case DECIMAL:
                sb.append(formatDecimal(value.asDouble()));
                break;
            case BOOLEAN:
                sb.append(value.asBoolean() ? "true" : "false");
                break;
            case NULL:
                sb.append("null");
                break;
            default:
                throw new IllegalStateException("Not a scalar kind: " + value.getKind());
        }
    }

    private static void appendQuoted(StringBuilder sb, String text) {
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                default:
                    if (Character.isISOControl(c) || c == LINE_SEPARATOR
                            || c == PARAGRAPH_SEPARATOR) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        sb.append('"');
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }

    private static String describe(Set<ValueKind> kinds) {
        if (kinds.size() == 1) {
            return kinds.iterator().next().name();
        }
        return "one of " + kinds.stream().sorted().map(ValueKind::name)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
