package org.autosemi.asi;

import org.autosemi.ArgumentParser;
import org.autosemi.CompilerContext;
import org.autosemi.lexer.Lexer;
import org.autosemi.lexer.LexerToken;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserValidityOracleTest {

    private static final CompilerContext CTX = new CompilerContext("t.src", new ArgumentParser.CompilerOptions());

    private final ParserValidityOracle oracle = new ParserValidityOracle(CTX, 50000);

    private static BoundaryQuery query(String code, int boundary, int statementStart, BitSet terminatedAfter) {
        List<LexerToken> tokens = new Lexer(code).tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, new ArrayList<>());
        List<LineBoundary> boundaries = LineBoundaryScanner.scan(tokens, layout);
        return new BoundaryQuery(tokens, boundaries.get(boundary), statementStart, terminatedAfter);
    }

    private static BoundaryQuery query(String code) {
        return query(code, 0, 0, new BitSet());
    }

    @Test
    public void testBothOutcomesParse() {
        BoundaryValidity validity = oracle.assess(query("let x = 1\n    + 1\n"));
        assertTrue(validity.determined);
        assertTrue(validity.insertValid);
        assertTrue(validity.suppressValid);
        assertFalse(validity.terminatorOptional);
    }

    @Test
    public void testNextLineCannotStartAStatement() {
        BoundaryValidity validity = oracle.assess(query("foo()\n.bar()\n"));
        assertFalse(validity.insertValid);
        assertTrue(validity.suppressValid);
    }

    @Test
    public void testNextLineCannotContinueTheStatement() {
        BoundaryValidity validity = oracle.assess(query("let x = 1\nlet y = 2\n"));
        assertTrue(validity.insertValid);
        assertFalse(validity.suppressValid);
        assertTrue(oracle.wouldBeValidBoundary(query("let x = 1\nlet y = 2\n")));
    }

    @Test
    public void testStatementIncompleteWithoutNextLine() {
        BoundaryValidity validity = oracle.assess(query("throw\nerr\n"));
        assertTrue(validity.determined);
        assertFalse(validity.insertValid);
        assertTrue(validity.suppressValid);
        assertFalse(oracle.wouldBeValidBoundary(query("throw\nerr\n")));
    }

    @Test
    public void testNeitherOutcomeParses() {
        BoundaryValidity validity = oracle.assess(query("x = 1\nelse\n"));
        assertTrue(validity.determined);
        assertFalse(validity.insertValid);
        assertFalse(validity.suppressValid);
    }

    @Test
    public void testCompleteBlockLikeStatement() {
        BoundaryValidity validity = oracle.assess(query("if c {\n    a()\n}\nb()\n", 2, 0, new BitSet()));
        assertTrue(validity.determined);
        assertTrue(validity.insertValid);
        assertTrue(validity.suppressValid);
        assertTrue(validity.terminatorOptional);
    }

    @Test
    public void testInsideParenthesesOnlyContinuationIsAdmissible() {
        assertSame(BoundaryValidity.SUPPRESS_ONLY, oracle.assess(query("f(a,\nb)\n")));
    }

    private static BoundaryQuery resumedQuery(String code, int boundary) {
        List<LexerToken> tokens = new Lexer(code).tokenize();
        LineLayout layout = LineIndentTracker.track(tokens, new ArrayList<>());
        LineBoundary lineBoundary = LineBoundaryScanner.scan(tokens, layout).get(boundary);
        int lineStart = lineBoundary.lastTokenIndex;
        while (!layout.isLineStart(lineStart)) {
            lineStart--;
        }
        return new BoundaryQuery(tokens, lineBoundary, 0, lineStart, new BitSet());
    }

    @Test
    public void testResumedAfterAnOperator() {
        BoundaryQuery query = resumedQuery("let x = 1 +\n    2 +\n    3\n", 1);
        assertTrue(query.resumesInsideStatement());
        assertEquals("2", query.tokens.get(query.probeStart).text);

        BoundaryValidity validity = oracle.assess(query);
        assertTrue(validity.determined);
        assertFalse(validity.insertValid);
        assertTrue(validity.suppressValid);
    }

    @Test
    public void testResumedAfterAnOperand() {
        BoundaryValidity validity = oracle.assess(resumedQuery("foo()\n    .bar()\n    .baz()\nqux()\n", 2));
        assertTrue(validity.determined);
        assertTrue(validity.insertValid);
        assertFalse(validity.suppressValid);

        validity = oracle.assess(resumedQuery("foo()\n    .bar()\n    .baz()\n    .qux()\n", 1));
        assertFalse(validity.insertValid);
        assertTrue(validity.suppressValid);
    }

    @Test
    public void testResumedLineThatCannotContinue() {
        // the line holding `else` was merged into the statement, but cannot follow an expression
        assertFalse(oracle.assess(resumedQuery("x = {\n    1\n}\n    else\ny\n", 3)).determined);
    }

    @Test
    public void testSpeculativeWindowsAreCounted() {
        ParserValidityOracle counting = new ParserValidityOracle(CTX, 50000);
        assertEquals(0, counting.probedTokens());
        counting.assess(query("let x = 1\n    + 1\n"));
        assertTrue(counting.probedTokens() > 0);
    }

    @Test
    public void testProbeBudget() {
        ParserValidityOracle small = new ParserValidityOracle(CTX, 3);
        assertSame(BoundaryValidity.UNDETERMINED, small.assess(query("let x = 1\n    + 1\n")));
    }

    @Test
    public void testStatementBrokenBeforeTheBoundary() {
        assertFalse(oracle.assess(query("let = 1\nx\n")).determined);
    }

    @Test
    public void testEarlierInsertionsAreVisible() {
        // a | b | c, with the first boundary already terminated
        BoundaryValidity withoutEarlierInsertion = oracle.assess(query("a\nb\nc\n", 1, 0, new BitSet()));
        assertFalse(withoutEarlierInsertion.determined);

        BitSet terminatedAfter = new BitSet();
        terminatedAfter.set(0);
        BoundaryQuery query = query("a\nb\nc\n", 1, 0, terminatedAfter);
        BoundaryValidity validity = oracle.assess(query);
        assertTrue(validity.determined);
        assertTrue(validity.insertValid);
        assertFalse(validity.suppressValid);
        // the probe leaves the query untouched
        assertEquals(1, terminatedAfter.cardinality());
    }
}
