package io.github.yok.flexconf.core;

import lombok.Value;

/**
 * Section and option pair identifying one configuration entry.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class OptionKey {

    String section;

    String option;

    @Override
    public String toString() {
        return "[" + section + "] " + option;
    }
}
