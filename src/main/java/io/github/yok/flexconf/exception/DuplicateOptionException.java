package io.github.yok.flexconf.exception;

import lombok.Getter;

/**
 * Thrown when a schema already declares a blueprint for the same section and option.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class DuplicateOptionException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String section;
    private final String option;

    public DuplicateOptionException(String section, String option) {
        super("Option '" + option + "' of section '" + section + "' is already declared");
        this.section = section;
        this.option = option;
    }
}
