package org.autosemi.runtime;

import java.io.Serial;

/**
 * CompilerException is the exception raised by the lexer and the parser.
 * It extends RuntimeException and provides detailed error messages
 * that include the file name, line number, and a snippet of code.
 * <p>
 * The index of the offending token is kept so that speculative parses can tell
 * where a probe failed relative to the boundary being examined.
 */
public class CompilerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1L;

    // Detailed error message that includes additional context about the error
    private final String errorMessage;

    private final int tokenIndex;

    /**
     * Constructs a new CompilerException using the error message utility.
     *
     * @param tokenIndex       the index of the token where the error occurred
     * @param message          the detail message describing the error
     * @param errorMessageUtil the utility for formatting error messages
     */
    public CompilerException(int tokenIndex, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.tokenIndex = tokenIndex;
        this.errorMessage = errorMessageUtil.errorMessage(tokenIndex, message);
    }

    /**
     * Constructs a new CompilerException with a message that already carries its location.
     * Used by the lexer, which reports errors before any token list exists.
     *
     * @param message the complete error message
     */
    public CompilerException(String message) {
        super(message);
        this.tokenIndex = -1;
        this.errorMessage = message.endsWith("\n") ? message : message + "\n";
    }

    /**
     * Returns the index of the offending token, or -1 if the error was not raised by the parser.
     */
    public int getTokenIndex() {
        return tokenIndex;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
