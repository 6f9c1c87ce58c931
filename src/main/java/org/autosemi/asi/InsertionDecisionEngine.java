package org.autosemi.asi;

import org.autosemi.CompilerContext;
import org.autosemi.lexer.LexerToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Resolves every line boundary to INSERT or SUPPRESS.
 * <p>
 * Rules are applied in a fixed order; the first one that applies decides:
 * <ol>
 *   <li>a continuation marker suppresses;</li>
 *   <li>a line that already ends in {@code ;}, or a boundary with no pending statement, suppresses;</li>
 *   <li>an implicit return position suppresses;</li>
 *   <li>after a closing delimiter only the grammar decides, preferring insertion when both parse;</li>
 *   <li>otherwise the indentation of the next line, compared with the line before the boundary,
 *   picks the preferred outcome and the grammar may overrule it. Deeper prefers SUPPRESS, same
 *   or shallower prefers INSERT.</li>
 * </ol>
 * The engine never throws. Undetermined validity suppresses; when neither outcome parses it
 * suppresses and reports an error diagnostic.
 * <p>
 * The first {@link #FULL_PROBES} boundaries of a statement are probed from the statement's
 * first token. Later ones are probed from the first token of the line before the boundary,
 * so a long statement costs a constant amount of parsing per line.
 */
public class InsertionDecisionEngine {

    static final int FULL_PROBES = 8;

    private final ValidityOracle oracle;
    private final CompilerContext ctx;

    public InsertionDecisionEngine(ValidityOracle oracle, CompilerContext ctx) {
        this.oracle = oracle;
        this.ctx = ctx;
    }

    // An open delimiter, with the start of the statement pending inside it.
    private static final class Frame {
        final char delimiter;
        int statementStart = -1;
        // first token of the latest line of the pending statement that starts at this level
        int lineStart = -1;
        // boundaries of the pending statement resolved with the grammar
        int probed;

        Frame(char delimiter) {
            this.delimiter = delimiter;
        }

        void endStatement() {
            statementStart = -1;
            lineStart = -1;
            probed = 0;
        }

        int probeStart() {
            return probed >= FULL_PROBES && lineStart > statementStart ? lineStart : statementStart;
        }

        boolean holdsStatements() {
            return delimiter == 0 || delimiter == '{';
        }
    }

    public List<BoundaryDecision> decide(List<LexerToken> tokens, LineLayout layout, List<LineBoundary> boundaries,
                                         List<AsiDiagnostic> diagnostics) {
        Deque<Frame> frames = new ArrayDeque<>();
        frames.push(new Frame((char) 0));
        BitSet terminatedAfter = new BitSet(tokens.size());
        List<BoundaryDecision> decisions = new ArrayList<>(boundaries.size());

        int next = 0;
        for (LineBoundary boundary : boundaries) {
            for (; next <= boundary.lastTokenIndex; next++) {
                track(tokens.get(next), next, layout, frames);
            }
            Frame frame = statementFrame(frames);
            BoundaryDecision decision = decideBoundary(tokens, boundary, frame.statementStart, frame.probeStart(),
                    terminatedAfter, diagnostics);
            ctx.logDebug("ASI " + decision);
            decisions.add(decision);

            if (decision.isInsert()) {
                terminatedAfter.set(boundary.lastTokenIndex);
                frame.endStatement();
            } else if (decision.validity != null) {
                if (decision.validity.terminatorOptional) {
                    frame.endStatement();
                } else {
                    frame.probed++;
                }
            }
        }
        return decisions;
    }

    private static void track(LexerToken token, int index, LineLayout layout, Deque<Frame> frames) {
        if (!token.isSignificant()) {
            return;
        }
        Frame top = frames.peek();
        if (token.is(";")) {
            if (top.holdsStatements()) {
                top.endStatement();
            }
        } else if (token.is("}") || token.is(")") || token.is("]")) {
            if (top.delimiter != 0 && closes(top.delimiter, token)) {
                frames.pop();
            }
        } else {
            if (top.holdsStatements()) {
                if (top.statementStart < 0) {
                    top.statementStart = index;
                } else if (layout.isLineStart(index)) {
                    top.lineStart = index;
                }
            }
            if (token.is("{") || token.is("(") || token.is("[")) {
                frames.push(new Frame(token.text.charAt(0)));
            }
        }
    }

    private static boolean closes(char delimiter, LexerToken token) {
        return (delimiter == '{' && token.is("}"))
                || (delimiter == '(' && token.is(")"))
                || (delimiter == '[' && token.is("]"));
    }

    private static Frame statementFrame(Deque<Frame> frames) {
        for (Frame frame : frames) {
            if (frame.holdsStatements()) {
                return frame;
            }
        }
        return frames.getLast();
    }

    /**
     * Tells whether a boundary is settled by layout alone (SUPPRESS) or needs the grammar
     * (DEFER_TO_VALIDITY).
     */
    public static InsertionDecision classify(List<LexerToken> tokens, LineBoundary boundary, int statementStart) {
        return layoutDecision(tokens, boundary, statementStart) != null
                ? InsertionDecision.SUPPRESS
                : InsertionDecision.DEFER_TO_VALIDITY;
    }

    /**
     * Applies the rules that need no grammar: the continuation marker, an existing terminator,
     * a missing statement and the implicit return position.
     *
     * @return the reason for suppressing, or null if the boundary is {@link InsertionDecision#DEFER_TO_VALIDITY}
     */
    static DecisionReason layoutDecision(List<LexerToken> tokens, LineBoundary boundary, int statementStart) {
        if (boundary.hasContinuationMarker) {
            return DecisionReason.CONTINUATION_MARKER;
        }
        if (tokens.get(boundary.lastTokenIndex).is(";")) {
            return DecisionReason.ALREADY_TERMINATED;
        }
        if (statementStart < 0) {
            return DecisionReason.NO_PENDING_STATEMENT;
        }
        if (boundary.isImplicitReturnPosition) {
            return DecisionReason.IMPLICIT_RETURN;
        }
        return null;
    }

    private BoundaryDecision decideBoundary(List<LexerToken> tokens, LineBoundary boundary,
                                            int statementStart, int probeStart, BitSet terminatedAfter,
                                            List<AsiDiagnostic> diagnostics) {
        DecisionReason layoutReason = layoutDecision(tokens, boundary, statementStart);
        if (layoutReason != null) {
            return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, layoutReason, null);
        }

        BoundaryValidity validity = oracle.assess(
                new BoundaryQuery(tokens, boundary, statementStart, probeStart, terminatedAfter));
        if (!validity.determined) {
            return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.UNDETERMINED, validity);
        }

        if (boundary.isBlockClose) {
            if (validity.terminatorOptional) {
                return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.BLOCK_CLOSE, validity);
            }
            if (validity.insertValid) {
                return new BoundaryDecision(boundary, InsertionDecision.INSERT, DecisionReason.BLOCK_CLOSE, validity);
            }
            if (validity.suppressValid) {
                return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.BLOCK_CLOSE, validity);
            }
            return ambiguous(tokens, boundary, validity, diagnostics);
        }

        if (boundary.followingIndent > boundary.precedingIndent) {
            if (validity.suppressValid) {
                return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.DEEPER_INDENT, validity);
            }
            if (validity.insertValid) {
                return new BoundaryDecision(boundary, InsertionDecision.INSERT, DecisionReason.FORCED_SPLIT, validity);
            }
        } else {
            if (validity.insertValid) {
                return new BoundaryDecision(boundary, InsertionDecision.INSERT, DecisionReason.NEW_STATEMENT, validity);
            }
            if (validity.suppressValid) {
                return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.FORCED_MERGE, validity);
            }
        }
        return ambiguous(tokens, boundary, validity, diagnostics);
    }

    private BoundaryDecision ambiguous(List<LexerToken> tokens, LineBoundary boundary, BoundaryValidity validity,
                                       List<AsiDiagnostic> diagnostics) {
        LexerToken last = tokens.get(boundary.lastTokenIndex);
        LexerToken next = tokens.get(boundary.nextTokenIndex);
        diagnostics.add(new AsiDiagnostic(AsiDiagnostic.Severity.ERROR, AsiDiagnostic.AMBIGUOUS_BOUNDARY,
                boundary.line, last.column + last.text.length(),
                "ambiguous line boundary between lines " + boundary.line + " and " + boundary.nextLine
                        + ": neither ending the statement after '" + last.text
                        + "' nor continuing it with '" + next.text + "' parses"));
        return new BoundaryDecision(boundary, InsertionDecision.SUPPRESS, DecisionReason.AMBIGUOUS, validity);
    }
}
