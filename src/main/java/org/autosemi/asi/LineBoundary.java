package org.autosemi.asi;

/**
 * A candidate insertion point between the last significant token of one physical line
 * and the first significant token of the next non-blank line.
 */
public final class LineBoundary {
    /**
     * Index of the last significant token before the boundary.
     */
    public final int lastTokenIndex;
    /**
     * Index of the first significant token after the boundary.
     */
    public final int nextTokenIndex;
    public final int line;
    public final int nextLine;
    /**
     * Indentation of the line holding the last token.
     */
    public final int precedingIndent;
    /**
     * Indentation of the line holding the next token.
     */
    public final int followingIndent;
    public final boolean hasContinuationMarker;
    /**
     * The last token closes a brace block, or a parenthesis or bracket opened on an earlier line.
     */
    public final boolean isBlockClose;
    /**
     * The next token closes the enclosing brace block and no terminator precedes it.
     */
    public final boolean isImplicitReturnPosition;
    /**
     * Innermost unclosed delimiter at the boundary: '{', '(', '[', or 0 at top level.
     */
    public final char enclosingDelimiter;

    public LineBoundary(int lastTokenIndex, int nextTokenIndex, int line, int nextLine,
                        int precedingIndent, int followingIndent, boolean hasContinuationMarker,
                        boolean isBlockClose, boolean isImplicitReturnPosition, char enclosingDelimiter) {
        this.lastTokenIndex = lastTokenIndex;
        this.nextTokenIndex = nextTokenIndex;
        this.line = line;
        this.nextLine = nextLine;
        this.precedingIndent = precedingIndent;
        this.followingIndent = followingIndent;
        this.hasContinuationMarker = hasContinuationMarker;
        this.isBlockClose = isBlockClose;
        this.isImplicitReturnPosition = isImplicitReturnPosition;
        this.enclosingDelimiter = enclosingDelimiter;
    }

    public LineBoundary withContinuationMarker() {
        return new LineBoundary(lastTokenIndex, nextTokenIndex, line, nextLine, precedingIndent, followingIndent,
                true, isBlockClose, isImplicitReturnPosition, enclosingDelimiter);
    }

    public boolean insideGroup() {
        return enclosingDelimiter == '(' || enclosingDelimiter == '[';
    }

    @Override
    public String toString() {
        return "LineBoundary{" +
                "lines=" + line + "->" + nextLine +
                ", tokens=" + lastTokenIndex + "->" + nextTokenIndex +
                ", indent=" + precedingIndent + "->" + followingIndent +
                (hasContinuationMarker ? ", continuation" : "") +
                (isBlockClose ? ", blockClose" : "") +
                (isImplicitReturnPosition ? ", implicitReturn" : "") +
                (enclosingDelimiter != 0 ? ", in '" + enclosingDelimiter + "'" : "") +
                '}';
    }
}
