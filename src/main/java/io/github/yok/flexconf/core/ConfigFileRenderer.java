package io.github.yok.flexconf.core;

import com.google.common.base.Preconditions;
import io.github.yok.flexconf.parser.ValueCodec;
import io.github.yok.flexconf.schema.Blueprint;
import io.github.yok.flexconf.schema.Schema;
import io.github.yok.flexconf.util.TypeHintFormatter;
import io.github.yok.flexconf.value.ConfigValue;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders a document as configuration file text, with a documentation comment above each
 * option.
 *
 * <p>
 * <strong>Layout:</strong>
 * </p>
 *
 * <pre>
 * # FlexConf - Version: 1.0.0
 *
 * # how to fill in the file
 *
 * [net]
 * # Port the server listens on
 * # Tipo: Inteiro
 * # Padrão: 8080
 * # Mínimo: 1
 * # Máximo: 65535
 * port = 8080
 *
 * </pre>
 *
 * <p>
 * Sections and options follow schema order. Values are written with
 * {@link ValueCodec#encodePretty(ConfigValue)}, so lists and dictionaries span several lines.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ConfigFileRenderer {

    private static final String LF = "\n";

    private ConfigFileRenderer() {
        // Utility class; do not instantiate.
    }

    /**
     * Renders the whole file.
     *
     * @param document values to write
     * @param header first comment block, omitted when blank
     * @param description second comment block, omitted when blank
     * @return file text ending with a line feed
     */
    public static String render(ConfigDocument document, String header, String description) {
        Preconditions.checkNotNull(document, "document must not be null");
        Schema schema = document.getSchema();
        StringBuilder sb = new StringBuilder();
        appendBlock(sb, header);
        appendBlock(sb, description);

        for (String section : schema.getSections()) {
            sb.append('[').append(section).append(']').append(LF);
            for (Blueprint bp : schema.getBlueprints(section)) {
                appendOption(sb, bp, document.get(section, bp.getOption()));
            }
        }
        return sb.toString();
    }

    private static void appendOption(StringBuilder sb, Blueprint bp, ConfigValue value) {
        if (StringUtils.isNotBlank(bp.getDescription())) {
            appendComment(sb, bp.getDescription());
        }
        appendComment(sb, "Tipo: " + TypeHintFormatter.format(bp));
        String defaultLiteral =
                bp.getDefaultValue().isNull() ? "null" : ValueCodec.encode(bp.getDefaultValue());
        appendComment(sb, "Padrão: " + defaultLiteral);
        if (bp.getMinValue() != null) {
            appendComment(sb, "Mínimo: " + bp.getMinValue().toPlainString());
        }
        if (bp.getMaxValue() != null) {
            appendComment(sb, "Máximo: " + bp.getMaxValue().toPlainString());
        }
        if (!bp.getPatterns().isEmpty()) {
            appendComment(sb, "Formatos: " + String.join(", ", bp.getPatterns().keySet()));
        }
        String literal = ValueCodec.encodePretty(value);
        sb.append(bp.getOption()).append(" =");
        if (!literal.isEmpty()) {
            sb.append(' ').append(literal);
        }
        sb.append(LF).append(LF);
    }

    private static void appendBlock(StringBuilder sb, String text) {
        if (StringUtils.isBlank(text)) {
            return;
        }
        appendComment(sb, text);
        sb.append(LF);
    }

    private static void appendComment(StringBuilder sb, String text) {
        for (String line : text.split("\\R", -1)) {
            String stripped = StringUtils.stripEnd(line, null);
            sb.append(stripped.isEmpty() ? "#" : "# " + stripped).append(LF);
        }
    }
}
