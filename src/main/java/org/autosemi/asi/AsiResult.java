package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;

import java.util.List;

/**
 * Output of one run of the pass: the rewritten token list plus everything needed to
 * explain it.
 */
public final class AsiResult {
    /**
     * The token list the pass was given. Boundary indices refer to this list.
     */
    public final List<LexerToken> sourceTokens;
    /**
     * The token list with synthetic terminators, for the parser.
     */
    public final List<LexerToken> tokens;
    public final List<BoundaryDecision> decisions;
    public final List<AsiDiagnostic> diagnostics;
    public final boolean enabled;

    public AsiResult(List<LexerToken> sourceTokens, List<LexerToken> tokens, List<BoundaryDecision> decisions,
                     List<AsiDiagnostic> diagnostics, boolean enabled) {
        this.sourceTokens = sourceTokens;
        this.tokens = tokens;
        this.decisions = List.copyOf(decisions);
        this.diagnostics = List.copyOf(diagnostics);
        this.enabled = enabled;
    }

    /**
     * The result of a disabled pass: the tokens go through unchanged.
     */
    public static AsiResult passThrough(List<LexerToken> tokens) {
        return new AsiResult(tokens, tokens, List.of(), List.of(), false);
    }

    public int insertionCount() {
        int count = 0;
        for (BoundaryDecision decision : decisions) {
            if (decision.isInsert()) {
                count++;
            }
        }
        return count;
    }

    public boolean hasErrors() {
        for (AsiDiagnostic diagnostic : diagnostics) {
            if (diagnostic.severity == AsiDiagnostic.Severity.ERROR) {
                return true;
            }
        }
        return false;
    }
}
