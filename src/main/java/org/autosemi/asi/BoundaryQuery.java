package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;

import java.util.BitSet;
import java.util.List;

/**
 * What the decision engine asks the validity oracle about one boundary.
 * The oracle only reads the token list and the set of earlier insertions.
 */
public final class BoundaryQuery {
    public final List<LexerToken> tokens;
    public final LineBoundary boundary;
    /**
     * Index of the first token of the statement pending at the boundary.
     */
    public final int statementStart;
    /**
     * Index where probes begin: the statement start, or the first token of a later line of the
     * same statement whose earlier lines were already accepted as a continuation.
     */
    public final int probeStart;
    /**
     * Indices of tokens after which this pass already decided to insert a terminator.
     */
    public final BitSet terminatedAfter;

    public BoundaryQuery(List<LexerToken> tokens, LineBoundary boundary, int statementStart, BitSet terminatedAfter) {
        this(tokens, boundary, statementStart, statementStart, terminatedAfter);
    }

    public BoundaryQuery(List<LexerToken> tokens, LineBoundary boundary, int statementStart, int probeStart,
                         BitSet terminatedAfter) {
        this.tokens = tokens;
        this.boundary = boundary;
        this.statementStart = statementStart;
        this.probeStart = probeStart;
        this.terminatedAfter = terminatedAfter;
    }

    /**
     * Returns true if probes begin inside the statement rather than at its first token.
     */
    public boolean resumesInsideStatement() {
        return probeStart > statementStart;
    }
}
