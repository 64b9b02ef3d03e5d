/**
 * Root package of FlexConf.
 *
 * <p>
 * Provides a library to declare typed configuration options, read and write them from a
 * human-editable INI-like text file, and persist every change atomically.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.flexconf.value}: typed value model</li>
 * <li>{@code io.github.yok.flexconf.parser}: literal codec and file grammar</li>
 * <li>{@code io.github.yok.flexconf.schema}: option declarations and validation</li>
 * <li>{@code io.github.yok.flexconf.core}: document, manager facade and file rendering</li>
 * <li>{@code io.github.yok.flexconf.config}: manager settings</li>
 * <li>{@code io.github.yok.flexconf.util}: file storage and formatting helpers</li>
 * </ul>
 */
package io.github.yok.flexconf;
