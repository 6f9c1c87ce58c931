package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Enumerates the candidate line boundaries of a token list.
 * <p>
 * There is one candidate per pair of consecutive significant tokens that sit on different
 * physical lines, so blank, comment-only and marker-only lines in between collapse into a
 * single boundary. Delimiters are matched on the way to know what encloses each boundary.
 */
public class LineBoundaryScanner {

    public static List<LineBoundary> scan(List<LexerToken> tokens, LineLayout layout) {
        List<LineBoundary> boundaries = new ArrayList<>();
        Deque<Integer> open = new ArrayDeque<>();
        int[] opener = new int[tokens.size()];
        Arrays.fill(opener, -1);

        int previous = -1;
        for (int i = 0; i < tokens.size(); i++) {
            LexerToken token = tokens.get(i);
            if (!token.isSignificant()) {
                continue;
            }
            if (previous >= 0 && token.line != tokens.get(previous).line) {
                boundaries.add(boundary(tokens, layout, previous, i, open, opener));
            }
            if (token.is("{") || token.is("(") || token.is("[")) {
                open.push(i);
            } else if (token.is("}") || token.is(")") || token.is("]")) {
                if (!open.isEmpty() && matches(tokens.get(open.peek()), token)) {
                    opener[i] = open.pop();
                }
            }
            previous = i;
        }
        return boundaries;
    }

    private static LineBoundary boundary(List<LexerToken> tokens, LineLayout layout, int last, int next,
                                         Deque<Integer> open, int[] opener) {
        LexerToken lastToken = tokens.get(last);
        LexerToken nextToken = tokens.get(next);
        char enclosing = open.isEmpty() ? 0 : tokens.get(open.peek()).text.charAt(0);

        boolean blockClose = lastToken.is("}")
                || ((lastToken.is(")") || lastToken.is("]"))
                && opener[last] >= 0 && tokens.get(opener[last]).line < lastToken.line);
        boolean implicitReturn = nextToken.is("}") && enclosing == '{'
                && !lastToken.is(";") && !lastToken.is("{");

        return new LineBoundary(last, next, lastToken.line, nextToken.line,
                layout.lineIndent(lastToken.line), layout.lineIndent(nextToken.line),
                false, blockClose, implicitReturn, enclosing);
    }

    private static boolean matches(LexerToken open, LexerToken close) {
        return (open.is("{") && close.is("}"))
                || (open.is("(") && close.is(")"))
                || (open.is("[") && close.is("]"));
    }
}
