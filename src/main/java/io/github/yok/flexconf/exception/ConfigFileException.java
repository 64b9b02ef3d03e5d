package io.github.yok.flexconf.exception;

import java.nio.file.Path;
import lombok.Getter;

/**
 * Thrown when reading or writing a configuration file fails.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class ConfigFileException extends ConfigException {

    private static final long serialVersionUID = 1L;

    // File the failed operation targeted
    private final transient Path path;

    public ConfigFileException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public ConfigFileException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
