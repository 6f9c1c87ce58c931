package org.autosemi.runtime;

import org.autosemi.lexer.LexerToken;
import org.autosemi.parser.TokenUtils;

import java.util.List;

/**
 * Utility class for generating error messages with context from a list of tokens.
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final List<LexerToken> tokens;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and list of tokens.
     *
     * @param fileName the name of the file
     * @param tokens   the list of tokens
     */
    public ErrorMessageUtil(String fileName, List<LexerToken> tokens) {
        this.fileName = fileName;
        this.tokens = tokens;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message with context from the token list.
     *
     * @param index   the index of the token where the error occurred
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(int index, String message) {
        int line = getLineNumber(index);

        // Collect the tokens around the error; synthetic terminators show up here too
        String nearString = TokenUtils.toText(tokens, index - 4, index + 2);

        return message + " at " + fileName + " line " + line + ", near " + errorMessageQuote(nearString) + "\n";
    }

    /**
     * Retrieves the line number of the token at the given index.
     * Tokens without a source position (virtual tokens) report the line of the
     * closest preceding token that has one.
     *
     * @param index the index of the token
     * @return the 1-based line number
     */
    public int getLineNumber(int index) {
        if (tokens.isEmpty()) {
            return 1;
        }
        int i = Math.min(Math.max(index, 0), tokens.size() - 1);
        while (i > 0 && tokens.get(i).line <= 0) {
            i--;
        }
        return Math.max(tokens.get(i).line, 1);
    }
}
