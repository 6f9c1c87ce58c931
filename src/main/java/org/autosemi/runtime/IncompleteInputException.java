package org.autosemi.runtime;

import java.io.Serial;

/**
 * Raised by a speculative parse that needs to look past the end of its window.
 * The input seen so far is a valid prefix; whether the rest parses is unknown.
 */
public class IncompleteInputException extends CompilerException {
    @Serial
    private static final long serialVersionUID = 1L;

    public IncompleteInputException(int tokenIndex, ErrorMessageUtil errorMessageUtil) {
        super(tokenIndex, "Unexpected end of probe window", errorMessageUtil);
    }
}
