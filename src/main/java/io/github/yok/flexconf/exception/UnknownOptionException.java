package io.github.yok.flexconf.exception;

import lombok.Getter;

/**
 * Thrown when a section/option pair is not declared by the schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class UnknownOptionException extends ConfigException {

    private static final long serialVersionUID = 1L;

    private final String section;
    private final String option;

    public UnknownOptionException(String section, String option) {
        super("Option '" + option + "' of section '" + section + "' does not exist");
        this.section = section;
        this.option = option;
    }
}
