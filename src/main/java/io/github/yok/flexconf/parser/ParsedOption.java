package io.github.yok.flexconf.parser;

import lombok.Value;

/**
 * One {@code option = literal} assignment found in a configuration file, before decoding.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class ParsedOption {

    // Section header the assignment appeared under
    String section;

    // Option name (left-hand side, trimmed)
    String option;

    // Raw literal text; multi-line literals are joined with '\n'
    String literal;

    // 1-based line number of the assignment
    int lineNumber;
}
