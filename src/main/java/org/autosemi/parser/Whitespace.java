package org.autosemi.parser;

import org.autosemi.lexer.LexerToken;

import java.util.List;

/**
 * The Whitespace class provides utility methods for skipping layout tokens
 * in a list of lexer tokens. Whitespace, newlines, comments and continuation
 * markers are invisible to the grammar; only the semicolon insertion pass
 * reasons about them.
 */
public class Whitespace {

    /**
     * Skips over layout tokens in the provided list of tokens,
     * starting from the specified index. It returns the index of the next significant token,
     * or the end of the parser's window.
     *
     * @param parser     The parser object, or null to scan the whole list
     * @param tokenIndex The starting index in the list of tokens.
     * @param tokens     The list of LexerToken objects to process.
     * @return The index of the next significant token.
     */
    public static int skipWhitespace(Parser parser, int tokenIndex, List<LexerToken> tokens) {
        int limit = parser == null ? tokens.size() : parser.limit;
        while (tokenIndex < limit) {
            switch (tokens.get(tokenIndex).type) {
                case WHITESPACE:
                case NEWLINE:
                case COMMENT:
                case CONTINUATION:
                    tokenIndex++;
                    break;
                default:
                    return tokenIndex;
            }
        }
        return tokenIndex;
    }
}
