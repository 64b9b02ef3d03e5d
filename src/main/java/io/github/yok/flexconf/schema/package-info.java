/**
 * Option declarations: {@link io.github.yok.flexconf.schema.Blueprint} and the ordered
 * {@link io.github.yok.flexconf.schema.Schema} that groups them by section.
 */
package io.github.yok.flexconf.schema;
