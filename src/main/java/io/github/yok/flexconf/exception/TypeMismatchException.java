package io.github.yok.flexconf.exception;

/**
 * Thrown when a value (or one of its nested items) is of a kind the option does not accept.
 *
 * @author Yasuharu.Okawauchi
 */
public class TypeMismatchException extends InvalidValueException {

    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String section, String option, String detail) {
        super(section, option, detail);
    }
}
