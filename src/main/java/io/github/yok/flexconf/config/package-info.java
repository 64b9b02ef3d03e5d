/**
 * Settings of FlexConf itself.
 *
 * <p>
 * {@link io.github.yok.flexconf.config.FlexConfProperties} binds the {@code flexconf} prefix of a
 * Spring property source and can equally be created and filled in by hand.
 * </p>
 */
package io.github.yok.flexconf.config;
