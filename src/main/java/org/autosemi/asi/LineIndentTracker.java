package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;

import java.util.Arrays;
import java.util.List;

/**
 * Derives, for every token, whether it starts a physical line and how deeply that line is
 * indented. Pure bookkeeping: no decisions, and no input is ever rejected.
 */
public class LineIndentTracker {

    /**
     * Computes the layout of a token list.
     * A line whose leading whitespace mixes tabs and spaces gets a warning; its width is still
     * the raw count of leading whitespace characters.
     *
     * @param tokens      the token list, layout tokens included
     * @param diagnostics receives mixed indentation warnings
     * @return the layout
     */
    public static LineLayout track(List<LexerToken> tokens, List<AsiDiagnostic> diagnostics) {
        int size = tokens.size();
        boolean[] lineStart = new boolean[size];
        int[] indent = new int[size];
        Arrays.fill(indent, LineLayout.NO_INDENT);

        int maxLine = 0;
        for (LexerToken token : tokens) {
            maxLine = Math.max(maxLine, token.line);
        }
        int[] lineIndent = new int[maxLine + 2];
        Arrays.fill(lineIndent, LineLayout.NO_INDENT);

        boolean atLineStart = true;
        int width = 0;
        boolean tabs = false;
        boolean spaces = false;
        for (int i = 0; i < size; i++) {
            LexerToken token = tokens.get(i);
            switch (token.type) {
                case NEWLINE:
                    atLineStart = true;
                    width = 0;
                    tabs = false;
                    spaces = false;
                    break;
                case WHITESPACE:
                    if (atLineStart) {
                        width += token.text.length();
                        tabs |= token.text.indexOf('\t') >= 0;
                        spaces |= token.text.indexOf(' ') >= 0;
                    }
                    break;
                case EOF:
                    break;
                default:
                    if (atLineStart && token.isSignificant()) {
                        lineStart[i] = true;
                        indent[i] = width;
                        lineIndent[token.line] = width;
                        if (tabs && spaces) {
                            diagnostics.add(new AsiDiagnostic(AsiDiagnostic.Severity.WARNING,
                                    AsiDiagnostic.MIXED_INDENTATION, token.line, 1,
                                    "indentation mixes tabs and spaces; counted as " + width + " characters"));
                        }
                    }
                    atLineStart = false;
                    break;
            }
        }
        return new LineLayout(lineStart, indent, lineIndent);
    }
}
