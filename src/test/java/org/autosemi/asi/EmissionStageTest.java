package org.autosemi.asi;

import org.autosemi.lexer.Lexer;
import org.autosemi.lexer.LexerToken;
import org.autosemi.parser.TokenUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmissionStageTest {

    @Test
    public void testTerminatorGoesAfterTheLastSignificantToken() {
        List<LexerToken> tokens = new Lexer("a  // one\nb\nc\n").tokenize();
        List<LineBoundary> boundaries = LineBoundaryScanner.scan(tokens, LineIndentTracker.track(tokens, new ArrayList<>()));
        List<BoundaryDecision> decisions = List.of(
                new BoundaryDecision(boundaries.get(0), InsertionDecision.INSERT, DecisionReason.NEW_STATEMENT, null),
                new BoundaryDecision(boundaries.get(1), InsertionDecision.SUPPRESS, DecisionReason.FORCED_MERGE, null));

        List<LexerToken> emitted = EmissionStage.emit(tokens, decisions);

        assertEquals(tokens.size() + 1, emitted.size());
        assertEquals("a;  // one\nb\nc\n", TokenUtils.toText(emitted, 0, emitted.size() - 1));
        LexerToken terminator = emitted.get(1);
        assertTrue(terminator.synthetic);
        assertEquals(1, terminator.line);
        assertEquals(2, terminator.column);
        // original tokens are shared, not copied
        assertSame(tokens.get(2), emitted.get(3));
    }

    @Test
    public void testNothingToInsert() {
        List<LexerToken> tokens = new Lexer("a\n  + b\n").tokenize();
        List<LexerToken> emitted = EmissionStage.emit(tokens, List.of());
        assertEquals(tokens, emitted);
    }
}
