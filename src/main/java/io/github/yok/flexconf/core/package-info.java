/**
 * Configuration lifecycle.
 *
 * <p>
 * {@link io.github.yok.flexconf.core.ConfigManager} is the entry point: it loads or generates a
 * file, keeps its {@link io.github.yok.flexconf.core.ConfigDocument} in memory and writes every
 * change back through {@link io.github.yok.flexconf.util.FileStore}.
 * {@link io.github.yok.flexconf.core.ConfigFileRenderer} produces the documented file text.
 * </p>
 */
package io.github.yok.flexconf.core;
