package org.autosemi.parser;

import org.autosemi.astnode.*;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.autosemi.parser.TokenUtils.consume;
import static org.autosemi.parser.TokenUtils.peek;

/**
 * The ParseInfix class handles the parsing of infix operations in expressions.
 * It processes binary operators and the postfix forms: calls, indexing,
 * field access, path segments and the `?` operator.
 */
public class ParseInfix {

    /**
     * Parses infix operators and their right-hand operands.
     *
     * @param parser     The parser instance used for parsing.
     * @param left       The left-hand operand of the infix operation.
     * @param precedence The current precedence level for parsing.
     * @return A node representing the parsed infix operation.
     */
    public static Node parseInfixOperation(Parser parser, Node left, int precedence) {
        LexerToken token = peek(parser);
        int index = parser.tokenIndex;
        consume(parser);

        Node right;
        switch (token.text) {
            case "(": {
                List<Node> arguments = new ArrayList<>();
                ParsePrimary.parseList(parser, arguments, ")");
                return new BinaryOperatorNode("(", left, new ListNode(arguments, index), index);
            }
            case "[":
                right = parser.parseExpression(0);
                TokenUtils.consume(parser, LexerTokenType.OPERATOR, "]");
                return new BinaryOperatorNode("[", left, right, index);
            case ".":
            case "::": {
                LexerToken member = peek(parser);
                int memberIndex = parser.tokenIndex;
                if (member.type == LexerTokenType.NUMBER && token.text.equals(".")) {
                    // tuple field
                    consume(parser);
                    return new BinaryOperatorNode(".", left, new NumberNode(member.text, memberIndex), index);
                }
                String name = StatementParser.parseName(parser);
                return new BinaryOperatorNode(token.text, left, new IdentifierNode(name, memberIndex), index);
            }
            case "?":
                return new OperatorNode("?", left, index);
            default:
                right = parser.parseExpression(precedence);
                return new BinaryOperatorNode(token.text, left, right, index);
        }
    }
}
