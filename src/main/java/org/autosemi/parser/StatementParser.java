package org.autosemi.parser;

import org.autosemi.astnode.*;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.autosemi.parser.TokenUtils.consume;
import static org.autosemi.parser.TokenUtils.peek;

/**
 * The StatementParser class is responsible for parsing keyword statements:
 * declarations, function definitions, conditionals, loops and jumps.
 */
public class StatementParser {

    /**
     * Parses `let [mut] name [: Type] [= expression]`.
     *
     * @param parser The Parser instance
     * @return A DeclarationNode
     */
    public static Node parseLetStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "let");

        boolean mutable = false;
        if (peek(parser).type == LexerTokenType.IDENTIFIER && peek(parser).text.equals("mut")) {
            consume(parser);
            mutable = true;
        }
        String name = parseName(parser);

        String type = null;
        if (peek(parser).is(":")) {
            consume(parser);
            type = parseType(parser);
        }

        Node initializer = null;
        if (peek(parser).is("=")) {
            consume(parser);
            initializer = parser.parseExpression(0);
        }
        return new DeclarationNode(name, mutable, type, initializer, index);
    }

    /**
     * Parses `fn name(params) [-> Type] { ... }`.
     *
     * @param parser The Parser instance
     * @return A FunctionNode with a name
     */
    public static Node parseFunctionDefinition(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "fn");
        String name = parseName(parser);
        return parseFunctionRest(parser, name, index);
    }

    /**
     * Parses `fn(params) [-> Type] { ... }` in expression position.
     *
     * @param parser The Parser instance
     * @return A FunctionNode without a name
     */
    public static Node parseAnonymousFunction(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "fn");
        return parseFunctionRest(parser, null, index);
    }

    private static FunctionNode parseFunctionRest(Parser parser, String name, int index) {
        consume(parser, LexerTokenType.OPERATOR, "(");
        List<String> parameters = new ArrayList<>();
        while (!peek(parser).is(")")) {
            String parameter = parseName(parser);
            if (peek(parser).is(":")) {
                consume(parser);
                parameter = parameter + ": " + parseType(parser);
            }
            parameters.add(parameter);
            if (!peek(parser).is(",")) {
                break;
            }
            consume(parser);
        }
        consume(parser, LexerTokenType.OPERATOR, ")");

        String returnType = null;
        if (peek(parser).is("->")) {
            consume(parser);
            returnType = parseType(parser);
        }
        BlockNode body = ParseBlock.parseBracedBlock(parser);
        return new FunctionNode(name, parameters, returnType, body, index);
    }

    /**
     * Parses `if condition { ... } [else { ... } | else if ...]`.
     * The same form is used as a statement and as an expression.
     *
     * @param parser The Parser instance
     * @return An IfNode
     */
    public static IfNode parseIfStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "if");
        Node condition = parser.parseExpression(0);
        BlockNode thenBranch = ParseBlock.parseBracedBlock(parser);

        Node elseBranch = null;
        LexerToken token = peek(parser);
        if (token.type == LexerTokenType.IDENTIFIER && token.text.equals("else")) {
            consume(parser);
            token = peek(parser);
            if (token.type == LexerTokenType.IDENTIFIER && token.text.equals("if")) {
                elseBranch = parseIfStatement(parser);
            } else {
                elseBranch = ParseBlock.parseBracedBlock(parser);
            }
        }
        return new IfNode(condition, thenBranch, elseBranch, index);
    }

    public static Node parseWhileStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "while");
        Node condition = parser.parseExpression(0);
        BlockNode body = ParseBlock.parseBracedBlock(parser);
        return new LoopNode(condition, body, index);
    }

    public static Node parseLoopStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "loop");
        BlockNode body = ParseBlock.parseBracedBlock(parser);
        return new LoopNode(null, body, index);
    }

    /**
     * Parses `for name in expression { ... }`.
     */
    public static Node parseForStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "for");
        String variable = parseName(parser);
        consume(parser, LexerTokenType.IDENTIFIER, "in");
        Node iterable = parser.parseExpression(0);
        BlockNode body = ParseBlock.parseBracedBlock(parser);
        return new ForNode(variable, iterable, body, index);
    }

    /**
     * Parses `return [expression]` and `break [expression]`.
     * The operand is optional: the statement ends at a terminator or a closing delimiter.
     */
    public static Node parseJumpStatement(Parser parser) {
        int index = parser.tokenIndex;
        LexerToken keyword = consume(parser, LexerTokenType.IDENTIFIER);
        Node operand = null;
        if (!Parser.isExpressionTerminator(peek(parser))) {
            operand = parser.parseExpression(0);
        }
        return new OperatorNode(keyword.text, operand, index);
    }

    public static Node parseContinueStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "continue");
        return new OperatorNode("continue", null, index);
    }

    /**
     * Parses `throw expression`. The operand is mandatory.
     */
    public static Node parseThrowStatement(Parser parser) {
        int index = parser.tokenIndex;
        consume(parser, LexerTokenType.IDENTIFIER, "throw");
        if (Parser.isExpressionTerminator(peek(parser))) {
            parser.throwError("syntax error: 'throw' requires an operand");
        }
        Node operand = parser.parseExpression(0);
        return new OperatorNode("throw", operand, index);
    }

    /**
     * Parses an identifier that is not a reserved word.
     *
     * @param parser The Parser instance
     * @return the name
     */
    public static String parseName(Parser parser) {
        LexerToken token = peek(parser);
        if (token.type != LexerTokenType.IDENTIFIER || ParserTables.RESERVED_WORDS.contains(token.text)) {
            parser.throwError("syntax error: expected a name but found " + TokenUtils.describe(token));
        }
        consume(parser);
        return token.text;
    }

    /**
     * Parses a type: a path with optional generic arguments, `[T]`, or a tuple `(A, B)`.
     * Returns the type as written, without layout.
     */
    public static String parseType(Parser parser) {
        LexerToken token = peek(parser);
        StringBuilder sb = new StringBuilder();
        if (token.is("[")) {
            consume(parser);
            sb.append('[').append(parseType(parser)).append(']');
            consume(parser, LexerTokenType.OPERATOR, "]");
            return sb.toString();
        }
        if (token.is("(")) {
            consume(parser);
            sb.append('(');
            while (!peek(parser).is(")")) {
                sb.append(parseType(parser));
                if (!peek(parser).is(",")) {
                    break;
                }
                consume(parser);
                sb.append(", ");
            }
            consume(parser, LexerTokenType.OPERATOR, ")");
            return sb.append(')').toString();
        }
        sb.append(parseName(parser));
        while (peek(parser).is("::")) {
            consume(parser);
            sb.append("::").append(parseName(parser));
        }
        if (peek(parser).is("<")) {
            consume(parser);
            sb.append('<');
            while (true) {
                sb.append(parseType(parser));
                if (!peek(parser).is(",")) {
                    break;
                }
                consume(parser);
                sb.append(", ");
            }
            consume(parser, LexerTokenType.OPERATOR, ">");
            sb.append('>');
        }
        return sb.toString();
    }
}
