package org.autosemi.asi;

import java.util.Arrays;

/**
 * Per-token and per-line indentation facts computed by {@link LineIndentTracker}.
 */
public final class LineLayout {
    /**
     * Indentation of a token that is not the first significant token of its line,
     * and of a line without significant tokens.
     */
    public static final int NO_INDENT = -1;

    private final boolean[] lineStart;
    private final int[] indent;
    private final int[] lineIndent;

    LineLayout(boolean[] lineStart, int[] indent, int[] lineIndent) {
        this.lineStart = lineStart;
        this.indent = indent;
        this.lineIndent = lineIndent;
    }

    /**
     * Returns true if the token is the first significant token on its physical line.
     */
    public boolean isLineStart(int tokenIndex) {
        return lineStart[tokenIndex];
    }

    /**
     * Returns the number of leading whitespace characters of the token's line if the token
     * starts the line, {@link #NO_INDENT} otherwise. Tabs and spaces both count as one.
     */
    public int indentWidth(int tokenIndex) {
        return indent[tokenIndex];
    }

    /**
     * Returns the indentation of a 1-based physical line, or {@link #NO_INDENT} for blank,
     * comment-only and marker-only lines.
     */
    public int lineIndent(int line) {
        if (line <= 0 || line >= lineIndent.length) {
            return NO_INDENT;
        }
        return lineIndent[line];
    }

    @Override
    public String toString() {
        return "LineLayout{lineIndent=" + Arrays.toString(lineIndent) + '}';
    }
}
