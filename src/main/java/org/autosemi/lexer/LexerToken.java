package org.autosemi.lexer;

/**
 * The LexerToken class represents a lexical token together with its source span.
 * A token is a basic unit of meaningful data, such as a keyword, identifier, operator,
 * or literal, that is produced by the lexer.
 *
 * <p>Tokens are immutable once produced. The span (offsets, line and column) is kept
 * intact through semicolon insertion so that parse errors still point at the original
 * source. Terminators synthesized by the insertion pass are marked {@code synthetic}
 * and borrow the position of the token they follow.</p>
 */
public class LexerToken {
    /**
     * The type of the token.
     */
    public final LexerTokenType type;

    /**
     * The raw text of the token, exactly as written in the source.
     */
    public final String text;

    /**
     * Offset of the first character of the token in the source.
     */
    public final int startOffset;

    /**
     * Offset just past the last character of the token.
     */
    public final int endOffset;

    /**
     * 1-based line of the first character.
     */
    public final int line;

    /**
     * 1-based column of the first character.
     */
    public final int column;

    /**
     * True if the token was not written by the programmer.
     */
    public final boolean synthetic;

    /**
     * Constructs a token read from the source.
     *
     * @param type        the type of the token
     * @param text        the raw text of the token
     * @param startOffset offset of the first character
     * @param line        1-based line number
     * @param column      1-based column number
     */
    public LexerToken(LexerTokenType type, String text, int startOffset, int line, int column) {
        this(type, text, startOffset, startOffset + text.length(), line, column, false);
    }

    private LexerToken(LexerTokenType type, String text, int startOffset, int endOffset, int line, int column, boolean synthetic) {
        this.type = type;
        this.text = text;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.line = line;
        this.column = column;
        this.synthetic = synthetic;
    }

    /**
     * Creates a statement terminator that is placed right after {@code anchor}.
     * The terminator has an empty span located at the end of the anchor.
     *
     * @param anchor the token the terminator follows
     * @return a synthetic {@code ;} token
     */
    public static LexerToken syntheticTerminator(LexerToken anchor) {
        return new LexerToken(LexerTokenType.OPERATOR, ";", anchor.endOffset, anchor.endOffset,
                anchor.line, anchor.column + anchor.text.length(), true);
    }

    /**
     * Creates a token that does not come from any source position.
     * Used by the parser for end of input and for virtual terminators inside probes.
     */
    public static LexerToken virtual(LexerTokenType type, String text) {
        return new LexerToken(type, text, -1, -1, 0, 0, true);
    }

    public boolean isSignificant() {
        return type.isSignificant();
    }

    /**
     * Tests for an operator token with the given text.
     */
    public boolean is(String operator) {
        return type == LexerTokenType.OPERATOR && text.equals(operator);
    }

    /**
     * Returns a string representation of the token.
     * The string representation includes the type, text and position of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\''
                + ", line=" + line + ", column=" + column
                + (synthetic ? ", synthetic" : "") + '}';
    }
}
