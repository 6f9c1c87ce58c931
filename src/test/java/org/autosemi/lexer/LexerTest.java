package org.autosemi.lexer;

import org.autosemi.runtime.CompilerException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> significant(String code) {
        return new Lexer(code).tokenize().stream()
                .filter(LexerToken::isSignificant)
                .collect(Collectors.toList());
    }

    @Test
    public void testLayoutTokensAreKept() {
        List<LexerToken> tokens = new Lexer("let x = 1 // one\n").tokenize();

        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(0).type);
        assertEquals(LexerTokenType.WHITESPACE, tokens.get(1).type);
        assertEquals(LexerTokenType.COMMENT, tokens.get(8).type);
        assertEquals("// one", tokens.get(8).text);
        assertEquals(LexerTokenType.NEWLINE, tokens.get(9).type);
        // two EOF tokens close the list
        assertEquals(LexerTokenType.EOF, tokens.get(tokens.size() - 1).type);
        assertEquals(LexerTokenType.EOF, tokens.get(tokens.size() - 2).type);
        assertEquals(12, tokens.size());
    }

    @Test
    public void testPositions() {
        List<LexerToken> tokens = significant("a\n  bc = 2\n");

        LexerToken bc = tokens.get(1);
        assertEquals("bc", bc.text);
        assertEquals(2, bc.line);
        assertEquals(3, bc.column);
        assertEquals(4, bc.startOffset);
        assertEquals(6, bc.endOffset);
        assertFalse(bc.synthetic);

        LexerToken two = tokens.get(3);
        assertEquals(2, two.line);
        assertEquals(8, two.column);
    }

    @Test
    public void testOperators() {
        List<String> texts = significant("a += b..=c -> d :: e && f || g == h != i ..j").stream()
                .filter(t -> t.type == LexerTokenType.OPERATOR)
                .map(t -> t.text)
                .collect(Collectors.toList());
        assertEquals(List.of("+=", "..=", "->", "::", "&&", "||", "==", "!=", ".."), texts);
    }

    @Test
    public void testRangeIsNotAFraction() {
        List<LexerToken> tokens = significant("1..5 2.5");
        assertEquals("1", tokens.get(0).text);
        assertEquals("..", tokens.get(1).text);
        assertEquals("5", tokens.get(2).text);
        assertEquals(LexerTokenType.NUMBER, tokens.get(3).type);
        assertEquals("2.5", tokens.get(3).text);
    }

    @Test
    public void testUnicodeIdentifier() {
        List<LexerToken> tokens = significant("größe_1 = π");
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(0).type);
        assertEquals("größe_1", tokens.get(0).text);
        assertEquals("π", tokens.get(2).text);
    }

    @Test
    public void testStringWithEscapedQuote() {
        List<LexerToken> tokens = significant("say(\"a \\\" b\")");
        assertEquals(LexerTokenType.STRING, tokens.get(2).type);
        assertEquals("\"a \\\" b\"", tokens.get(2).text);
    }

    @Test
    public void testContinuationMarker() {
        List<LexerToken> tokens = new Lexer("a \\  \n+ b").tokenize();
        assertEquals(LexerTokenType.CONTINUATION, tokens.get(2).type);
        assertEquals(LexerTokenType.WHITESPACE, tokens.get(3).type);
        assertEquals(LexerTokenType.NEWLINE, tokens.get(4).type);
    }

    @Test
    public void testContinuationMarkerMustEndTheLine() {
        CompilerException e = assertThrows(CompilerException.class, () -> new Lexer("a \\ b", "t.src").tokenize());
        assertTrue(e.getMessage().startsWith("Continuation marker '\\' must be the last symbol on its line"));
        assertTrue(e.getMessage().contains("t.src line 1"));
    }

    @Test
    public void testUnterminatedString() {
        CompilerException e = assertThrows(CompilerException.class, () -> new Lexer("x = \"abc\ny").tokenize());
        assertTrue(e.getMessage().startsWith("Can't find string terminator"));
        assertEquals(-1, e.getTokenIndex());
    }

    @Test
    public void testCarriageReturnIsDropped() {
        List<LexerToken> tokens = new Lexer("a\r\nb").tokenize();
        assertEquals(LexerTokenType.NEWLINE, tokens.get(1).type);
        assertEquals("b", tokens.get(2).text);
        assertEquals(2, tokens.get(2).line);
    }

    @Test
    public void testSyntheticTerminator() {
        LexerToken anchor = significant("  value").get(0);
        LexerToken terminator = LexerToken.syntheticTerminator(anchor);

        assertTrue(terminator.is(";"));
        assertTrue(terminator.synthetic);
        assertEquals(anchor.endOffset, terminator.startOffset);
        assertEquals(anchor.endOffset, terminator.endOffset);
        assertEquals(anchor.line, terminator.line);
        assertEquals(8, terminator.column);
    }
}
