/**
 * Error taxonomy of FlexConf.
 *
 * <p>
 * Every exception extends {@link io.github.yok.flexconf.exception.ConfigException}, which is
 * unchecked. File errors, decode errors, schema construction errors and access-time validation
 * errors each have their own subtype.
 * </p>
 */
package io.github.yok.flexconf.exception;
