package com.configkit.ini.parser;

import java.util.List;

import com.configkit.ini.model.ParsingError;

/**
 * Raised when a load is aborted: a malformed line while errors are not collected,
 * or a resource limit that cannot be recovered from.
 */
public class ParsingException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<ParsingError> errors;

    public ParsingException(ParsingError error) {
        super(error.toString());
        this.errors = List.of(error);
    }

    public ParsingException(String message, List<ParsingError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<ParsingError> getErrors() {
        return errors;
    }

    /**
     * Line number of the first error, or 0 when the failure is not tied to a line.
     */
    public int getLineNumber() {
        return errors.isEmpty() ? 0 : errors.get(0).getLineNumber();
    }

    public String getLine() {
        return errors.isEmpty() ? null : errors.get(0).getLine();
    }
}
