package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Marks the boundaries that an explicit continuation marker suppresses.
 * <p>
 * The lexer has already checked that every marker is the last symbol on its line, so any
 * marker found between the two tokens of a boundary belongs to that boundary.
 */
public class ContinuationFilter {

    public static List<LineBoundary> apply(List<LexerToken> tokens, List<LineBoundary> boundaries) {
        List<LineBoundary> filtered = new ArrayList<>(boundaries.size());
        for (LineBoundary boundary : boundaries) {
            filtered.add(hasMarker(tokens, boundary) ? boundary.withContinuationMarker() : boundary);
        }
        return filtered;
    }

    private static boolean hasMarker(List<LexerToken> tokens, LineBoundary boundary) {
        for (int i = boundary.lastTokenIndex + 1; i < boundary.nextTokenIndex; i++) {
            if (tokens.get(i).type == LexerTokenType.CONTINUATION) {
                return true;
            }
        }
        return false;
    }
}
