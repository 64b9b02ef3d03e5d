package io.github.yok.flexconf.exception;

/**
 * Thrown when a numeric value falls outside the minimum/maximum declared by its blueprint.
 *
 * @author Yasuharu.Okawauchi
 */
public class ValueOutOfRangeException extends InvalidValueException {

    private static final long serialVersionUID = 1L;

    public ValueOutOfRangeException(String section, String option, String detail) {
        super(section, option, detail);
    }
}
