package io.github.yok.flexconf.parser;

import io.github.yok.flexconf.exception.ConfigDecodeException;
import io.github.yok.flexconf.value.ConfigValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent reader for a single literal.
 *
 * <p>
 * Grammar:
 * </p>
 *
 * <pre>
 * literal := string | integer | decimal | boolean | list | dict | null
 * string  := '"' (escape | char)* '"'
 * integer := ['-'] digit+
 * decimal := ['-'] digit+ '.' digit+ [exponent] | ['-'] digit+ exponent
 * boolean := 'true' | 'false'
 * null    := '' | 'null'             (the empty form only at top level)
 * list    := '[' (literal (',' literal)*)? ']'
 * dict    := '{' (string ':' literal (',' string ':' literal)*)? '}'
 * </pre>
 *
 * <p>
 * Whitespace, including line breaks, is allowed between tokens so that pretty-printed lists and
 * dictionaries spanning several lines are accepted.
 * </p>
 *
 * <p>
 * Lists and dictionaries nest at most {@value #MAX_DEPTH} levels deep.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
final class LiteralReader {

    static final int MAX_DEPTH = 512;

    private final String text;
    private int pos;
    private int depth;

    LiteralReader(String text) {
        this.text = text;
    }

    /**
     * Reads the whole text as one literal.
     *
     * @return decoded value
     * @throws ConfigDecodeException if the text is not exactly one well-formed literal
     */
    ConfigValue readDocument() {
        skipWhitespace();
        if (atEnd()) {
            return ConfigValue.nullValue();
        }
        ConfigValue value = readValue();
        skipWhitespace();
        if (!atEnd()) {
            throw error("unexpected trailing content '" + excerpt() + "'");
        }
        return value;
    }

    /**
     * Determines whether the literal still has an open list, dictionary or string at its end.
     *
     * <p>
     * Used by the file parser to decide whether an assignment continues on the next line. A string
     * cannot span lines, so an unterminated string reports {@code false} and is left for the
     * decoder to reject.
     * </p>
     *
     * @param literal literal text collected so far
     * @return {@code true} if more lines are needed to close the literal
     */
    static boolean isOpen(String literal) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < literal.length(); i++) {
            char c = literal.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                } else if (c == '\n' || c == '\r') {
                    return false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '[' || c == '{') {
                depth++;
            } else if (c == ']' || c == '}') {
                depth--;
            }
        }
        return !inString && depth > 0;
    }

    private ConfigValue readValue() {
        skipWhitespace();
        if (atEnd()) {
            throw error("unexpected end of literal");
        }
        char c = text.charAt(pos);
        if (c == '"') {
            return ConfigValue.text(readString());
        }
        if (c == '[') {
            return readList();
        }
        if (c == '{') {
            return readDict();
        }
        if (c == '-' || isDigit(c)) {
            return readNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return readKeyword();
        }
        throw error("unexpected character '" + c + "'");
    }

    private ConfigValue readList() {
        enter();
        try {
            return readListItems();
        } finally {
            depth--;
        }
    }

    private ConfigValue readListItems() {
        int start = pos;
        pos++;
        List<ConfigValue> items = new ArrayList<>();
        skipWhitespace();
        if (consume(']')) {
            return ConfigValue.list(items);
        }
        while (true) {
            items.add(readValue());
            skipWhitespace();
            if (consume(',')) {
                continue;
            }
            if (consume(']')) {
                return ConfigValue.list(items);
            }
            if (atEnd()) {
                throw error("unterminated list opened at offset " + start);
            }
            throw error("expected ',' or ']' in list but found '" + text.charAt(pos) + "'");
        }
    }

    private ConfigValue readDict() {
        enter();
        try {
            return readDictEntries();
        } finally {
            depth--;
        }
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("nesting deeper than " + MAX_DEPTH + " levels");
        }
    }

    private ConfigValue readDictEntries() {
        int start = pos;
        pos++;
        Map<String, ConfigValue> entries = new LinkedHashMap<>();
        skipWhitespace();
        if (consume('}')) {
            return ConfigValue.dict(entries);
        }
        while (true) {
            skipWhitespace();
            if (atEnd()) {
                throw error("unterminated dictionary opened at offset " + start);
            }
            if (text.charAt(pos) != '"') {
                throw error("dictionary keys must be quoted text, found '" + excerpt() + "'");
            }
            String key = readString();
            skipWhitespace();
            if (!consume(':')) {
                throw error("expected ':' after dictionary key \"" + key + "\"");
            }
            entries.put(key, readValue());
            skipWhitespace();
            if (consume(',')) {
                continue;
            }
            if (consume('}')) {
                return ConfigValue.dict(entries);
            }
            if (atEnd()) {
                throw error("unterminated dictionary opened at offset " + start);
            }
            throw error(
                    "expected ',' or '}' in dictionary but found '" + text.charAt(pos) + "'");
        }
    }

    private String readString() {
        int start = pos;
        pos++;
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                return sb.toString();
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (atEnd()) {
                break;
            }
            char esc = text.charAt(pos++);
            switch (esc) {
                case '"':
                case '\\':
                case '/':
                    sb.append(esc);
                    break;
                case 'n':
                    sb.append('\n');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'b':
                    sb.append('\b');
                    break;
                case 'f':
                    sb.append('\f');
                    break;
                case 'u':
                    sb.append(readUnicodeEscape());
                    break;
                default:
                    throw error("invalid escape sequence '\\" + esc + "'");
            }
        }
        throw error("unterminated string starting at offset " + start);
    }

    private char readUnicodeEscape() {
        if (pos + 4 > text.length()) {
            throw error("incomplete unicode escape");
        }
        String hex = text.substring(pos, pos + 4);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw error("invalid unicode escape '\\u" + hex + "'");
            }
        }
        pos += 4;
        return (char) Integer.parseInt(hex, 16);
    }

    private ConfigValue readNumber() {
        int start = pos;
        if (text.charAt(pos) == '-') {
            pos++;
        }
        if (readDigits() == 0) {
            throw error("number requires at least one digit");
        }
        boolean decimal = false;
        if (!atEnd() && text.charAt(pos) == '.') {
            pos++;
            decimal = true;
            if (readDigits() == 0) {
                throw error("decimal literal requires digits after '.'");
            }
        }
        if (!atEnd() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            pos++;
            decimal = true;
            if (!atEnd() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (readDigits() == 0) {
                throw error("decimal exponent requires digits");
            }
        }
        String token = text.substring(start, pos);
        if (decimal) {
            double value = Double.parseDouble(token);
            if (Double.isInfinite(value)) {
                throw error("decimal literal out of range: " + token);
            }
            return ConfigValue.decimal(value);
        }
        try {
            return ConfigValue.integer(Long.parseLong(token));
        } catch (NumberFormatException e) {
            throw error("integer literal out of 64-bit range: " + token);
        }
    }

    private ConfigValue readKeyword() {
        int start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(text.charAt(pos))
                || text.charAt(pos) == '_')) {
            pos++;
        }
        String word = text.substring(start, pos);
        switch (word) {
            case "true":
                return ConfigValue.bool(true);
            case "false":
                return ConfigValue.bool(false);
            case "null":
                return ConfigValue.nullValue();
            default:
                throw error("unknown keyword '" + word
                        + "' (booleans are lowercase 'true'/'false'; text must be quoted)");
        }
    }

    private int readDigits() {
        int start = pos;
        while (!atEnd() && isDigit(text.charAt(pos))) {
            pos++;
        }
        return pos - start;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private boolean consume(char expected) {
        if (!atEnd() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private String excerpt() {
        int end = Math.min(text.length(), pos + 20);
        return text.substring(pos, end);
    }

    private ConfigDecodeException error(String reason) {
        return new ConfigDecodeException(reason);
    }
}
