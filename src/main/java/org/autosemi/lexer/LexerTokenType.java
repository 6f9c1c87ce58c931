package org.autosemi.lexer;

/**
 * Categories of tokens produced by the {@link Lexer}.
 * <p>
 * IDENTIFIER, NUMBER, STRING and OPERATOR are the significant tokens; the remaining
 * categories carry layout information that the semicolon insertion pass reasons about
 * and that the parser skips.
 */
public enum LexerTokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    OPERATOR,
    WHITESPACE,
    NEWLINE,
    COMMENT,
    // `\` as the last symbol on a line
    CONTINUATION,
    EOF;

    /**
     * Returns true for tokens that take part in the grammar.
     *
     * @return true if the parser does not skip tokens of this type
     */
    public boolean isSignificant() {
        return this == IDENTIFIER || this == NUMBER || this == STRING || this == OPERATOR;
    }
}
