package io.github.yok.flexconf.exception;

/**
 * Base class of every error raised by FlexConf.
 *
 * <p>
 * All FlexConf errors are unchecked and propagate synchronously to the call site that triggered
 * them. Nothing is retried automatically.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
