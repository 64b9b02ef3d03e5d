package io.github.yok.flexconf.exception;

import lombok.Getter;

/**
 * Base class for values rejected by a blueprint.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class InvalidValueException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String section;
    private final String option;

    protected InvalidValueException(String section, String option, String detail) {
        super("Invalid value for option '" + option + "' of section '" + section + "': "
                + detail);
        this.section = section;
        this.option = option;
    }
}
