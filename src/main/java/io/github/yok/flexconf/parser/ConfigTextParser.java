package io.github.yok.flexconf.parser;

import io.github.yok.flexconf.exception.ConfigDecodeException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Splits the raw text of a configuration file into section/option/literal assignments.
 *
 * <p>
 * <strong>Line grammar:</strong>
 * </p>
 * <ul>
 * <li>{@code [section]} starts a section.</li>
 * <li>{@code option = literal} assigns a literal to an option of the current section.</li>
 * <li>Lines starting with {@code #} or {@code ;} are comments; blank lines are ignored.</li>
 * <li>A literal whose list, dictionary or string is still open at the end of the line continues on
 * the next lines until it is balanced. Comments inside such a literal are not allowed.</li>
 * </ul>
 *
 * <p>
 * Literals are not decoded here; decoding against the declared kinds happens in the document.
 * Inline comments after a value are not supported because lists and dictionaries may span lines.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ConfigTextParser {

    // Only CR, LF and CRLF end a line; other Unicode breaks are ordinary characters
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private static final Pattern SECTION_HEADER = Pattern.compile("^\\[([^\\[\\]]*)\\]$");

    // A line that starts a new assignment; option names never contain quotes or brackets
    private static final Pattern ASSIGNMENT_START = Pattern.compile("^[^\"\\[\\]{},:=]+=");

    private ConfigTextParser() {
        // Utility class; do not instantiate.
    }

    /**
     * Parses raw text into assignments, in file order.
     *
     * @param rawText full file content
     * @return assignments in the order they appear; duplicates are kept
     * @throws ConfigDecodeException if a line matches no rule or a literal is never closed
     */
    public static List<ParsedOption> parse(String rawText) {
        String text = StringUtils.removeStart(StringUtils.defaultString(rawText), "\uFEFF");
        String[] lines = LINE_BREAK.split(text, -1);
        List<ParsedOption> result = new ArrayList<>();
        String section = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            int lineNumber = i + 1;
            if (line.isEmpty() || isComment(line)) {
                continue;
            }

            Matcher header = SECTION_HEADER.matcher(line);
            if (header.matches()) {
                section = header.group(1).strip();
                if (section.isEmpty()) {
                    throw new ConfigDecodeException("empty section name", null, null,
                            lineNumber, null);
                }
                log.debug("Section [{}] at line {}", section, lineNumber);
                continue;
            }

            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new ConfigDecodeException(
                        "expected '[section]' or 'option = value' but found '" + line + "'",
                        section, null, lineNumber, null);
            }
            String option = line.substring(0, eq).strip();
            if (option.isEmpty()) {
                throw new ConfigDecodeException("missing option name before '='", section,
                        null, lineNumber, null);
            }
            if (section == null) {
                throw new ConfigDecodeException("option declared before any [section] header",
                        null, option, lineNumber, null);
            }

            StringBuilder literal = new StringBuilder(line.substring(eq + 1).strip());
            int last = i;
            while (LiteralReader.isOpen(literal.toString())) {
                int next = last + 1;
                if (next >= lines.length) {
                    throw new ConfigDecodeException("literal is never closed", section, option,
                            lineNumber, null);
                }
                String continuation = lines[next].strip();
                if (isComment(continuation)
                        || ASSIGNMENT_START.matcher(continuation).find()) {
                    throw new ConfigDecodeException(
                            "literal is not closed before line " + (next + 1), section, option,
                            lineNumber, null);
                }
                if (!continuation.isEmpty()) {
                    literal.append('\n').append(continuation);
                }
                last = next;
            }
            i = last;
            result.add(new ParsedOption(section, option, literal.toString(), lineNumber));
        }
        return result;
    }

    private static boolean isComment(String strippedLine) {
        return strippedLine.startsWith("#") || strippedLine.startsWith(";");
    }
}
