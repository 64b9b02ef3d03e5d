/**
 * Typed configuration values.
 *
 * <p>
 * {@link io.github.yok.flexconf.value.ConfigValue} is an immutable tagged value over the closed
 * set of {@link io.github.yok.flexconf.value.ValueKind kinds}.
 * </p>
 */
package io.github.yok.flexconf.value;
