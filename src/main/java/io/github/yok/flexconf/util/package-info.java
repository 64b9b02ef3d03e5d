/**
 * File and formatting helpers.
 *
 * <p>
 * {@link io.github.yok.flexconf.util.FileStore} owns every read and atomic write of a
 * configuration file; {@link io.github.yok.flexconf.util.TypeHintFormatter} renders type labels for
 * the generated documentation comments.
 * </p>
 */
package io.github.yok.flexconf.util;
