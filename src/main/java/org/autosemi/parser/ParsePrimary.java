package org.autosemi.parser;

import org.autosemi.astnode.*;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.autosemi.parser.TokenUtils.consume;
import static org.autosemi.parser.TokenUtils.peek;

/**
 * The ParsePrimary class is responsible for parsing primary expressions:
 * literals, names, parenthesized and array expressions, block expressions,
 * `if`, `loop` and anonymous functions, and prefix operators.
 * <p>
 * Errors are reported at the index of the token that cannot start an expression,
 * which the semicolon insertion probes rely on.
 */
public class ParsePrimary {

    /**
     * Parses a primary expression from the parser's token stream.
     *
     * @param parser The parser instance used for parsing
     * @return A Node representing the parsed primary expression
     */
    public static Node parsePrimary(Parser parser) {
        LexerToken token = peek(parser);
        int startIndex = parser.tokenIndex;

        switch (token.type) {
            case NUMBER:
                consume(parser);
                return new NumberNode(token.text.replace("_", ""), startIndex);
            case STRING:
                consume(parser);
                return new StringNode(unescape(token.text), startIndex);
            case IDENTIFIER:
                return parseIdentifier(parser, token, startIndex);
            case OPERATOR:
                return parseOperator(parser, token, startIndex);
            case EOF:
                parser.throwError(startIndex, "syntax error: unexpected end of input");
                return null;
            default:
                parser.throwError(startIndex, "syntax error");
                return null;
        }
    }

    private static Node parseIdentifier(Parser parser, LexerToken token, int startIndex) {
        switch (token.text) {
            case "if":
                return StatementParser.parseIfStatement(parser);
            case "loop":
                return StatementParser.parseLoopStatement(parser);
            case "fn":
                return StatementParser.parseAnonymousFunction(parser);
            default:
                if (ParserTables.RESERVED_WORDS.contains(token.text)) {
                    parser.throwError(startIndex, "syntax error: unexpected '" + token.text + "'");
                }
                consume(parser);
                return new IdentifierNode(token.text, startIndex);
        }
    }

    private static Node parseOperator(Parser parser, LexerToken token, int startIndex) {
        switch (token.text) {
            case "(": {
                consume(parser);
                List<Node> elements = new ArrayList<>();
                boolean trailingComma = parseList(parser, elements, ")");
                if (elements.size() == 1 && !trailingComma) {
                    // parenthesized expression
                    return elements.get(0);
                }
                return new ListNode(elements, startIndex);
            }
            case "[": {
                consume(parser);
                List<Node> elements = new ArrayList<>();
                parseList(parser, elements, "]");
                return new ArrayLiteralNode(elements, startIndex);
            }
            case "{":
                return ParseBlock.parseBracedBlock(parser);
            default:
                if (ParserTables.PREFIX_OP.contains(token.text)) {
                    consume(parser);
                    Node operand = parser.parseExpression(ParserTables.PREFIX_PRECEDENCE);
                    return new OperatorNode(token.text, operand, startIndex);
                }
                parser.throwError(startIndex, "syntax error: unexpected " + TokenUtils.describe(token));
                return null;
        }
    }

    /**
     * Parses a comma separated list of expressions up to and including {@code close}.
     * The opening delimiter has already been consumed.
     *
     * @return true if the list ends with a comma
     */
    static boolean parseList(Parser parser, List<Node> elements, String close) {
        boolean trailingComma = false;
        while (!peek(parser).is(close)) {
            elements.add(parser.parseExpression(0));
            trailingComma = false;
            if (!peek(parser).is(",")) {
                break;
            }
            consume(parser);
            trailingComma = true;
        }
        TokenUtils.consume(parser, LexerTokenType.OPERATOR, close);
        return trailingComma;
    }

    /**
     * Removes the quotes of a string literal and processes backslash escapes.
     */
    static String unescape(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                case '0':
                    sb.append('\0');
                    break;
                default:
                    sb.append(next);
            }
        }
        return sb.toString();
    }
}
