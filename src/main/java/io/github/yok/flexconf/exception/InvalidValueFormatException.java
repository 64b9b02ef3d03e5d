package io.github.yok.flexconf.exception;

/**
 * Thrown when a text value matches none of the patterns declared by its blueprint.
 *
 * @author Yasuharu.Okawauchi
 */
public class InvalidValueFormatException extends InvalidValueException {

    private static final long serialVersionUID = 1L;

    public InvalidValueFormatException(String section, String option, String detail) {
        super(section, option, detail);
    }
}
