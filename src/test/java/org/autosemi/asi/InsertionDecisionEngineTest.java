package org.autosemi.asi;

import org.autosemi.ArgumentParser;
import org.autosemi.CompilerContext;
import org.autosemi.lexer.Lexer;
import org.autosemi.lexer.LexerToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the rule order of the engine with an oracle that gives a fixed answer.
 */
public class InsertionDecisionEngineTest {

    private static final CompilerContext CTX = new CompilerContext("t.src", new ArgumentParser.CompilerOptions());

    private static final class FixedOracle implements ValidityOracle {
        final BoundaryValidity answer;
        final List<BoundaryQuery> queries = new ArrayList<>();

        FixedOracle(BoundaryValidity answer) {
            this.answer = answer;
        }

        @Override
        public BoundaryValidity assess(BoundaryQuery query) {
            queries.add(query);
            return answer;
        }
    }

    private final List<AsiDiagnostic> diagnostics = new ArrayList<>();

    private List<BoundaryDecision> decide(String code, ValidityOracle oracle) {
        List<LexerToken> tokens = new Lexer(code).tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, diagnostics);
        List<LineBoundary> boundaries = ContinuationFilter.apply(tokens, LineBoundaryScanner.scan(tokens, layout));
        return new InsertionDecisionEngine(oracle, CTX).decide(tokens, layout, boundaries, diagnostics);
    }

    private BoundaryDecision decideOne(String code, BoundaryValidity validity) {
        List<BoundaryDecision> decisions = decide(code, new FixedOracle(validity));
        assertEquals(1, decisions.size());
        return decisions.get(0);
    }

    @Test
    public void testIndentationPicksTheOutcomeWhenBothParse() {
        BoundaryDecision deeper = decideOne("a\n    b", BoundaryValidity.of(true, true));
        assertEquals(InsertionDecision.SUPPRESS, deeper.decision);
        assertEquals(DecisionReason.DEEPER_INDENT, deeper.reason);

        BoundaryDecision same = decideOne("a\nb", BoundaryValidity.of(true, true));
        assertEquals(InsertionDecision.INSERT, same.decision);
        assertEquals(DecisionReason.NEW_STATEMENT, same.reason);

        BoundaryDecision shallower = decideOne("    a\nb", BoundaryValidity.of(true, true));
        assertEquals(InsertionDecision.INSERT, shallower.decision);
    }

    @Test
    public void testIndentationComparesWithTheLineBeforeTheBoundary() {
        FixedOracle oracle = new FixedOracle(BoundaryValidity.of(true, true));
        List<BoundaryDecision> decisions = decide("let y = a\n        * b\n    - c", oracle);

        assertEquals(DecisionReason.DEEPER_INDENT, decisions.get(0).reason);
        // 8 -> 4 is shallower than the line before, though deeper than the statement's first line
        assertEquals(InsertionDecision.INSERT, decisions.get(1).decision);
        assertEquals(DecisionReason.NEW_STATEMENT, decisions.get(1).reason);

        decisions = decide("let x = 1\n    + 2\n    + 3", oracle);
        assertEquals(InsertionDecision.SUPPRESS, decisions.get(0).decision);
        assertEquals(InsertionDecision.INSERT, decisions.get(1).decision);
        assertEquals(DecisionReason.NEW_STATEMENT, decisions.get(1).reason);
    }

    @Test
    public void testLongStatementResumesAtItsLatestLine() {
        StringBuilder code = new StringBuilder("x0");
        for (int i = 1; i <= 12; i++) {
            code.append("\nx").append(i);
        }
        FixedOracle oracle = new FixedOracle(BoundaryValidity.of(false, true));
        List<LexerToken> tokens = new Lexer(code.toString()).tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, diagnostics);
        List<BoundaryDecision> decisions = new InsertionDecisionEngine(oracle, CTX)
                .decide(tokens, layout, LineBoundaryScanner.scan(tokens, layout), diagnostics);

        assertEquals(12, decisions.size());
        for (int i = 0; i < oracle.queries.size(); i++) {
            BoundaryQuery query = oracle.queries.get(i);
            assertEquals(DecisionReason.FORCED_MERGE, decisions.get(i).reason);
            assertEquals("x0", tokens.get(query.statementStart).text);
            if (i < InsertionDecisionEngine.FULL_PROBES) {
                assertEquals(query.statementStart, query.probeStart, "boundary " + i);
                assertFalse(query.resumesInsideStatement());
            } else {
                assertEquals(query.boundary.line, tokens.get(query.probeStart).line, "boundary " + i);
                assertEquals("x" + i, tokens.get(query.probeStart).text);
                assertTrue(query.resumesInsideStatement());
            }
        }
    }

    @Test
    public void testGrammarOverrulesIndentation() {
        BoundaryDecision split = decideOne("a\n    b", BoundaryValidity.of(true, false));
        assertEquals(InsertionDecision.INSERT, split.decision);
        assertEquals(DecisionReason.FORCED_SPLIT, split.reason);

        BoundaryDecision merge = decideOne("a\nb", BoundaryValidity.of(false, true));
        assertEquals(InsertionDecision.SUPPRESS, merge.decision);
        assertEquals(DecisionReason.FORCED_MERGE, merge.reason);
    }

    @Test
    public void testAmbiguousBoundarySuppressesWithError() {
        BoundaryDecision decision = decideOne("a\nb", BoundaryValidity.of(false, false));

        assertEquals(InsertionDecision.SUPPRESS, decision.decision);
        assertEquals(DecisionReason.AMBIGUOUS, decision.reason);
        assertEquals(1, diagnostics.size());
        assertEquals(AsiDiagnostic.Severity.ERROR, diagnostics.get(0).severity);
        assertEquals(AsiDiagnostic.AMBIGUOUS_BOUNDARY, diagnostics.get(0).code);
        assertEquals(1, diagnostics.get(0).line);
        assertEquals(2, diagnostics.get(0).column);
    }

    @Test
    public void testUndeterminedSuppresses() {
        BoundaryDecision decision = decideOne("a\nb", BoundaryValidity.UNDETERMINED);
        assertEquals(InsertionDecision.SUPPRESS, decision.decision);
        assertEquals(DecisionReason.UNDETERMINED, decision.reason);
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    public void testBlockClosePrefersInsertion() {
        List<BoundaryDecision> decisions = decide("x = {\n}\n    y", new FixedOracle(BoundaryValidity.of(true, true)));
        BoundaryDecision close = decisions.get(1);
        assertTrue(close.boundary.isBlockClose);
        assertEquals(InsertionDecision.INSERT, close.decision);
        assertEquals(DecisionReason.BLOCK_CLOSE, close.reason);

        decisions = decide("x = {\n}\ny", new FixedOracle(new BoundaryValidity(true, true, true, true)));
        assertEquals(InsertionDecision.SUPPRESS, decisions.get(1).decision);
        assertEquals(DecisionReason.BLOCK_CLOSE, decisions.get(1).reason);
    }

    @Test
    public void testLayoutRulesDoNotConsultTheOracle() {
        FixedOracle oracle = new FixedOracle(BoundaryValidity.of(true, true));
        List<BoundaryDecision> decisions = decide("a \\\n+ b;\n{\n    c\n}", oracle);

        assertEquals(DecisionReason.CONTINUATION_MARKER, decisions.get(0).reason);
        assertEquals(DecisionReason.ALREADY_TERMINATED, decisions.get(1).reason);
        assertEquals(DecisionReason.NO_PENDING_STATEMENT, decisions.get(2).reason);
        assertEquals(DecisionReason.IMPLICIT_RETURN, decisions.get(3).reason);
        for (BoundaryDecision decision : decisions) {
            assertEquals(InsertionDecision.SUPPRESS, decision.decision);
            assertNull(decision.validity);
        }
        assertTrue(oracle.queries.isEmpty());
    }

    @Test
    public void testStatementStartFollowsDecisions() {
        FixedOracle oracle = new FixedOracle(BoundaryValidity.of(true, true));
        List<LexerToken> tokens = new Lexer("a\n    b\nc\nd").tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, diagnostics);
        List<LineBoundary> boundaries = LineBoundaryScanner.scan(tokens, layout);
        List<BoundaryDecision> decisions = new InsertionDecisionEngine(oracle, CTX)
                .decide(tokens, layout, boundaries, diagnostics);

        // a b | c | d
        assertEquals(InsertionDecision.SUPPRESS, decisions.get(0).decision);
        assertEquals(InsertionDecision.INSERT, decisions.get(1).decision);
        assertEquals(InsertionDecision.INSERT, decisions.get(2).decision);

        assertEquals("a", tokens.get(oracle.queries.get(0).statementStart).text);
        assertEquals("a", tokens.get(oracle.queries.get(1).statementStart).text);
        assertEquals("c", tokens.get(oracle.queries.get(2).statementStart).text);
        assertTrue(oracle.queries.get(2).terminatedAfter.get(decisions.get(1).boundary.lastTokenIndex));
    }

    @Test
    public void testClassify() {
        List<LexerToken> tokens = new Lexer("a \\\n+ b\nc").tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, diagnostics);
        List<LineBoundary> boundaries = ContinuationFilter.apply(tokens, LineBoundaryScanner.scan(tokens, layout));

        assertEquals(InsertionDecision.SUPPRESS, InsertionDecisionEngine.classify(tokens, boundaries.get(0), 0));
        assertEquals(InsertionDecision.DEFER_TO_VALIDITY, InsertionDecisionEngine.classify(tokens, boundaries.get(1), 0));
        assertEquals(InsertionDecision.SUPPRESS, InsertionDecisionEngine.classify(tokens, boundaries.get(1), -1));
    }

    @Test
    public void testFinalDecisionCannotBeDeferred() {
        List<LexerToken> tokens = new Lexer("a\nb").tokenize();
        LineBoundary boundary = LineBoundaryScanner.scan(tokens, LineIndentTracker.track(tokens, diagnostics)).get(0);
        assertThrows(IllegalArgumentException.class,
                () -> new BoundaryDecision(boundary, InsertionDecision.DEFER_TO_VALIDITY, DecisionReason.UNDETERMINED, null));
    }
}
