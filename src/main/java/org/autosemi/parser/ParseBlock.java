package org.autosemi.parser;

import org.autosemi.astnode.BlockNode;
import org.autosemi.astnode.DeclarationNode;
import org.autosemi.astnode.FunctionNode;
import org.autosemi.astnode.Node;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;

import java.util.ArrayList;
import java.util.List;

import static org.autosemi.parser.TokenUtils.consume;
import static org.autosemi.parser.TokenUtils.peek;

/**
 * ParseBlock handles the parsing of statement sequences.
 * A block represents a sequence of statements enclosed in curly braces,
 * or the statements of a whole program.
 */
public class ParseBlock {
    /**
     * Parses statements until a closing brace or the end of input, without consuming either.
     * <p>
     * A terminator is required between statements, except after a block-like statement.
     * The last statement needs none; if it is an expression it becomes the value of the block.
     *
     * @param parser The parser instance containing the current parsing state
     * @return BlockNode representing the parsed block in the AST
     */
    public static BlockNode parseBlock(Parser parser) {
        int currentIndex = parser.tokenIndex;
        List<Node> statements = new ArrayList<>();
        BlockNode block = new BlockNode(statements, currentIndex);

        LexerToken token = peek(parser);
        while (token.type != LexerTokenType.EOF && !token.is("}")) {
            // Handle empty statements (lone semicolons)
            if (token.is(";")) {
                consume(parser);
                token = peek(parser);
                continue;
            }

            Node statement = ParseStatement.parseStatement(parser);
            statements.add(statement);

            token = peek(parser);
            if (token.is(";")) {
                consume(parser);
                token = peek(parser);
                continue;
            }
            if (token.type == LexerTokenType.EOF || token.is("}")) {
                block.hasTail = isValueStatement(statement);
                break;
            }
            if (!ParseStatement.isBlockLike(statement)) {
                parser.throwError("syntax error: expected ';' before " + TokenUtils.describe(token));
            }
        }
        return block;
    }

    /**
     * Parses `{ statements }`.
     *
     * @param parser The parser instance containing the current parsing state
     * @return BlockNode representing the parsed block in the AST
     */
    public static BlockNode parseBracedBlock(Parser parser) {
        TokenUtils.consume(parser, LexerTokenType.OPERATOR, "{");
        BlockNode block = parseBlock(parser);
        LexerToken token = peek(parser);
        if (!token.is("}")) {
            parser.throwError("Missing right curly bracket");
        }
        consume(parser);
        return block;
    }

    private static boolean isValueStatement(Node statement) {
        if (statement instanceof DeclarationNode) {
            return false;
        }
        return !(statement instanceof FunctionNode) || ((FunctionNode) statement).name == null;
    }
}
