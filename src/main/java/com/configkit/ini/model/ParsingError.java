package com.configkit.ini.model;

import lombok.Value;

/**
 * One malformed source line: 1-based line number, the raw line, and the reason.
 */
@Value
public class ParsingError {
    int lineNumber;
    String line;
    String reason;

    @Override
    public String toString() {
        return "Line " + lineNumber + ": " + reason + " [" + line + "]";
    }
}
