package com.minimail.protocol;

import lombok.Value;

/**
 * One parsed command line: the recognized verb (or the parser's unknown
 * verb), the keyword as sent and the remaining argument text ("" when absent).
 */
@Value
public class ParsedCommand<V extends Enum<V>> {

    V verb;
    String keyword;
    String argument;

    public boolean hasArgument() {
        return !argument.isEmpty();
    }
}
