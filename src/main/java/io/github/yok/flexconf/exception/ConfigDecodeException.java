package io.github.yok.flexconf.exception;

import lombok.Getter;

/**
 * Thrown when a literal or a configuration file cannot be decoded.
 *
 * <p>
 * Raised by the literal codec with only a {@code reason}; the document parser re-throws it with
 * the section, option and line number where the literal was found.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConfigDecodeException extends ConfigException {

    private static final long serialVersionUID = 1L;

    // Short description of what is wrong with the literal
    private final String reason;

    // Section of the offending option, or null when unknown
    private final String section;

    // Offending option, or null when unknown
    private final String option;

    // 1-based line number in the file, or 0 when unknown
    private final int lineNumber;

    public ConfigDecodeException(String reason) {
        this(reason, null, null, 0, null);
    }

    public ConfigDecodeException(String reason, String section, String option, int lineNumber,
            Throwable cause) {
        super(buildMessage(reason, section, option, lineNumber), cause);
        this.reason = reason;
        this.section = section;
        this.option = option;
        this.lineNumber = lineNumber;
    }

    /**
     * Returns a copy of this exception enriched with location context.
     *
     * @param section section of the option
     * @param option option name
     * @param lineNumber 1-based line number where the literal starts
     * @return new exception with this one as its cause
     */
    public ConfigDecodeException withContext(String section, String option, int lineNumber) {
        return new ConfigDecodeException(reason, section, option, lineNumber, this);
    }

    private static String buildMessage(String reason, String section, String option,
            int lineNumber) {
        StringBuilder sb = new StringBuilder("Invalid configuration literal");
        if (option != null) {
            sb.append(" for option '").append(option).append("'");
        }
        if (section != null) {
            sb.append(" in section '").append(section).append("'");
        }
        if (lineNumber > 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        return sb.append(": ").append(reason).toString();
    }
}
