package io.github.yok.flexconf.config;

/**
 * Behavior when a configuration file contains an option that no blueprint declares.
 *
 * <ul>
 * <li>{@link #IGNORE}: drop the option silently</li>
 * <li>{@link #WARN}: drop the option and log a warning</li>
 * <li>{@link #FAIL}: reject the file with an
 * {@link io.github.yok.flexconf.exception.UnknownOptionException}</li>
 * </ul>
 *
 * <p>
 * Dropped options are not written back, so they disappear from the file on the next save.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum UndeclaredOptionPolicy {
    IGNORE, WARN, FAIL
}
