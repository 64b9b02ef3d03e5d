package io.github.yok.flexconf.exception;

/**
 * Thrown when a configuration manager is used before {@code initialize} completed.
 *
 * @author Yasuharu.Okawauchi
 */
public class NotInitializedException extends ConfigException {

    private static final long serialVersionUID = 1L;

    public NotInitializedException() {
        super("Configuration manager is not initialized; call initialize(profile, directory)"
                + " first");
    }
}
