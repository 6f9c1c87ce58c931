package org.autosemi.parser;

import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;
import org.autosemi.runtime.CompilerException;

import java.util.List;

/**
 * The TokenUtils class provides utility methods for handling
 * lexer tokens during parsing. It includes methods for converting tokens to text,
 * peeking at the next token, and consuming tokens with specific types or text.
 */
public class TokenUtils {

    /**
     * Converts a range of tokens into a single string of text, excluding EOF tokens.
     *
     * @param tokens    The list of LexerToken objects to process.
     * @param codeStart The starting index in the list of tokens.
     * @param codeEnd   The ending index in the list of tokens.
     * @return A string representing the concatenated text of the specified token range.
     */
    public static String toText(List<LexerToken> tokens, int codeStart, int codeEnd) {
        StringBuilder sb = new StringBuilder();
        codeStart = Math.max(codeStart, 0);
        codeEnd = Math.min(codeEnd, tokens.size() - 1);
        for (int i = codeStart; i <= codeEnd; i++) {
            LexerToken tok = tokens.get(i);
            if (tok.type != LexerTokenType.EOF) {
                sb.append(tok.text);
            }
        }
        return sb.toString();
    }

    /**
     * Peeks at the next significant token without consuming it.
     * Layout tokens are consumed.
     * <p>
     * A pending virtual terminator is returned before anything else. At the end of the
     * parser's window this returns an EOF token, or throws IncompleteInputException
     * when the window was opened in incomplete mode.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The next significant LexerToken.
     */
    public static LexerToken peek(Parser parser) {
        parser.tokenIndex = Whitespace.skipWhitespace(parser, parser.tokenIndex, parser.tokens);
        if (parser.hasPendingTerminator()) {
            return Parser.VIRTUAL_TERMINATOR;
        }
        if (parser.tokenIndex >= parser.limit) {
            return parser.endOfWindow();
        }
        return parser.tokens.get(parser.tokenIndex);
    }

    /**
     * Consumes the next significant token.
     * EOF is never consumed, so that repeated calls keep returning it.
     *
     * @param parser The parser containing the token list and current token index.
     * @return The consumed LexerToken.
     */
    public static LexerToken consume(Parser parser) {
        LexerToken token = peek(parser);
        if (token == Parser.VIRTUAL_TERMINATOR) {
            parser.consumedTerminatorAfter = parser.lastConsumedIndex;
            return token;
        }
        if (token.type == LexerTokenType.EOF) {
            return token;
        }
        parser.lastConsumedIndex = parser.tokenIndex;
        parser.tokenIndex++;
        return token;
    }

    /**
     * Consumes the next significant token and checks its type.
     *
     * @param parser The parser containing the token list and current token index.
     * @param type   The expected LexerTokenType of the token to consume.
     * @return The consumed LexerToken.
     * @throws CompilerException if the token type does not match the expected type.
     */
    public static LexerToken consume(Parser parser, LexerTokenType type) {
        LexerToken token = peek(parser);
        if (token.type != type) {
            throw new CompilerException(
                    parser.tokenIndex, "syntax error: expected " + type.name().toLowerCase() + " but found " + describe(token),
                    parser.errorUtil);
        }
        return consume(parser);
    }

    /**
     * Consumes the next significant token and checks its type and text.
     *
     * @param parser The parser containing the token list and current token index.
     * @param type   The expected LexerTokenType of the token to consume.
     * @param text   The expected text of the token to consume.
     * @throws CompilerException if the token type or text does not match the expected values.
     */
    public static void consume(Parser parser, LexerTokenType type, String text) {
        LexerToken token = peek(parser);
        if (token.type != type || !token.text.equals(text)) {
            throw new CompilerException(
                    parser.tokenIndex,
                    "syntax error: expected '" + text + "' but found " + describe(token),
                    parser.errorUtil);
        }
        consume(parser);
    }

    static String describe(LexerToken token) {
        if (token.type == LexerTokenType.EOF) {
            return "end of input";
        }
        return "'" + token.text + "'";
    }
}
