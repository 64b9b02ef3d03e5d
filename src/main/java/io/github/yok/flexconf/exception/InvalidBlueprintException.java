package io.github.yok.flexconf.exception;

/**
 * Thrown when a blueprint declaration is inconsistent, for example when its default value is not
 * one of its accepted kinds.
 *
 * @author Yasuharu.Okawauchi
 */
public class InvalidBlueprintException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public InvalidBlueprintException(String message) {
        super(message);
    }

    public InvalidBlueprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
