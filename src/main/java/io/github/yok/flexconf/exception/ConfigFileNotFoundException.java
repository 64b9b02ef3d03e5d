package io.github.yok.flexconf.exception;

import java.nio.file.Path;

/**
 * Thrown when a configuration file does not exist.
 *
 * <p>
 * This condition is recoverable: the manager generates a file from the schema defaults.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigFileNotFoundException extends ConfigFileException {

    private static final long serialVersionUID = 1L;

    public ConfigFileNotFoundException(Path path) {
        super(path, "Configuration file not found: " + path);
    }
}
