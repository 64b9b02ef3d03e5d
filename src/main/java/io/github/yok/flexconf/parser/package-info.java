/**
 * Text codec package.
 *
 * <p>
 * Contains the literal codec ({@link io.github.yok.flexconf.parser.ValueCodec}) and the line
 * grammar of configuration files ({@link io.github.yok.flexconf.parser.ConfigTextParser}), which
 * turns raw text into a stream of section/option/literal assignments.
 * </p>
 */
package io.github.yok.flexconf.parser;
