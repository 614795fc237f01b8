package com.configkit.ini.parser;

import com.configkit.ini.model.ParsingError;

/**
 * Notified once for every malformed line, before the parser decides to record it or abort.
 */
@FunctionalInterface
public interface ParsingErrorListener {

    void onParsingError(ParsingError error);
}
