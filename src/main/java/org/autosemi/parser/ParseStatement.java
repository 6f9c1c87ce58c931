package org.autosemi.parser;

import org.autosemi.astnode.*;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import static org.autosemi.parser.TokenUtils.peek;

/**
 * Dispatches on the first token of a statement.
 */
public class ParseStatement {

    /**
     * Parses a single statement. The terminator after the statement, if any, is left
     * for the caller.
     *
     * @param parser The parser instance
     * @return the statement node
     */
    public static Node parseStatement(Parser parser) {
        LexerToken token = peek(parser);
        parser.ctx.logDebug("parseStatement " + token);

        if (token.type == LexerTokenType.IDENTIFIER) {
            switch (token.text) {
                case "let":
                    return StatementParser.parseLetStatement(parser);
                case "fn":
                    // `fn name(...)` is a definition, `fn(...)` an expression
                    if (nextSignificant(parser).type == LexerTokenType.IDENTIFIER) {
                        return StatementParser.parseFunctionDefinition(parser);
                    }
                    break;
                case "if":
                    return StatementParser.parseIfStatement(parser);
                case "while":
                    return StatementParser.parseWhileStatement(parser);
                case "loop":
                    return StatementParser.parseLoopStatement(parser);
                case "for":
                    return StatementParser.parseForStatement(parser);
                case "return":
                case "break":
                    return StatementParser.parseJumpStatement(parser);
                case "continue":
                    return StatementParser.parseContinueStatement(parser);
                case "throw":
                    return StatementParser.parseThrowStatement(parser);
                default:
                    break;
            }
        } else if (token.is("{")) {
            return ParseBlock.parseBracedBlock(parser);
        }
        return parser.parseExpression(0);
    }

    /**
     * Block-like statements end with a closing brace and need no terminator
     * before the next statement.
     *
     * @param statement a statement returned by {@link #parseStatement}
     * @return true if the statement is block-like
     */
    public static boolean isBlockLike(Node statement) {
        if (statement instanceof FunctionNode) {
            return ((FunctionNode) statement).name != null;
        }
        return statement instanceof IfNode
                || statement instanceof LoopNode
                || statement instanceof ForNode
                || statement instanceof BlockNode;
    }

    // The token after the current one, skipping layout, without moving the parser.
    private static LexerToken nextSignificant(Parser parser) {
        int index = Whitespace.skipWhitespace(parser, parser.tokenIndex + 1, parser.tokens);
        if (index >= parser.limit) {
            return parser.endOfWindow();
        }
        return parser.tokens.get(index);
    }
}
