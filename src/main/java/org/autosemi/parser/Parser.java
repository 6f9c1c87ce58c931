package org.autosemi.parser;

import org.autosemi.CompilerContext;
import org.autosemi.astnode.BlockNode;
import org.autosemi.astnode.Node;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;
import org.autosemi.runtime.CompilerException;
import org.autosemi.runtime.ErrorMessageUtil;
import org.autosemi.runtime.IncompleteInputException;

import java.util.BitSet;
import java.util.List;

import static org.autosemi.parser.TokenUtils.peek;

/**
 * The Parser class is responsible for parsing a list of tokens into an abstract syntax tree (AST).
 * It handles operator precedence, associativity, and statement termination.
 * <p>
 * Besides the ordinary full parse, a Parser can be opened over a window of the token list
 * (see {@link #probe}). Probes are used by the semicolon insertion pass to ask whether a
 * prefix of the program parses; they never modify the token list, so discarding one
 * needs no rollback.
 */
public class Parser {

    /**
     * Terminator returned by {@link TokenUtils#peek} after a token listed in {@link #terminatedAfter}.
     */
    public static final LexerToken VIRTUAL_TERMINATOR = LexerToken.virtual(LexerTokenType.OPERATOR, ";");
    private static final LexerToken END_OF_WINDOW = LexerToken.virtual(LexerTokenType.EOF, "");

    /**
     * What the parser sees when it reaches the end of its window.
     */
    public enum WindowEnd {
        /**
         * The window end behaves like the end of the program.
         */
        END_OF_INPUT,
        /**
         * Reading at the window end throws IncompleteInputException.
         */
        INCOMPLETE
    }

    // Compilation context: file name, options and debug logging.
    public final CompilerContext ctx;
    // List of tokens to be parsed.
    public final List<LexerToken> tokens;
    public final ErrorMessageUtil errorUtil;
    // Current index in the token list.
    public int tokenIndex = 0;
    // Index at which the window ends (exclusive).
    public final int limit;
    public final WindowEnd windowEnd;
    // Indices of tokens followed by a terminator that is not in the token list yet, or null.
    public final BitSet terminatedAfter;
    // Index of one more token followed by a virtual terminator, or -1.
    public int boundaryTerminatorAfter = -1;
    // Index of the last real token consumed.
    public int lastConsumedIndex = -1;
    // Index of the token whose virtual terminator was consumed last.
    public int consumedTerminatorAfter = -1;

    /**
     * Constructs a Parser over the whole token list.
     *
     * @param ctx    The compilation context.
     * @param tokens The list of tokens to parse.
     */
    public Parser(CompilerContext ctx, List<LexerToken> tokens) {
        this(ctx, tokens, 0, tokens.size(), WindowEnd.END_OF_INPUT, null);
    }

    private Parser(CompilerContext ctx, List<LexerToken> tokens, int start, int limit,
                   WindowEnd windowEnd, BitSet terminatedAfter) {
        this.ctx = ctx;
        this.tokens = tokens;
        this.errorUtil = new ErrorMessageUtil(ctx.fileName, tokens);
        this.tokenIndex = start;
        this.limit = Math.min(limit, tokens.size());
        this.windowEnd = windowEnd;
        this.terminatedAfter = terminatedAfter;
    }

    /**
     * Opens a speculative parser over {@code tokens[start, limit)}.
     *
     * @param ctx             The compilation context.
     * @param tokens          The full token list; it is only read.
     * @param start           Index of the first token of the window.
     * @param limit           Index at which the window ends (exclusive).
     * @param windowEnd       What happens at the end of the window.
     * @param terminatedAfter Token indices that are followed by a terminator, or null.
     * @return a new Parser positioned at {@code start}
     */
    public static Parser probe(CompilerContext ctx, List<LexerToken> tokens, int start, int limit,
                               WindowEnd windowEnd, BitSet terminatedAfter) {
        return new Parser(ctx, tokens, start, limit, windowEnd, terminatedAfter);
    }

    public static boolean isExpressionTerminator(LexerToken token) {
        return token.type == LexerTokenType.EOF
                || (token.type == LexerTokenType.OPERATOR && ParserTables.TERMINATORS.contains(token.text));
    }

    /**
     * Retrieves the precedence of the given operator.
     *
     * @param operator The operator to check.
     * @return The precedence level of the operator, 0 if it is not an infix operator.
     */
    public int getPrecedence(String operator) {
        return ParserTables.precedenceMap.getOrDefault(operator, 0);
    }

    boolean hasPendingTerminator() {
        if (lastConsumedIndex < 0 || consumedTerminatorAfter == lastConsumedIndex) {
            return false;
        }
        return lastConsumedIndex == boundaryTerminatorAfter
                || (terminatedAfter != null && terminatedAfter.get(lastConsumedIndex));
    }

    LexerToken endOfWindow() {
        if (windowEnd == WindowEnd.INCOMPLETE) {
            throw new IncompleteInputException(tokenIndex, errorUtil);
        }
        return END_OF_WINDOW;
    }

    /**
     * Parses the tokens into an abstract syntax tree (AST).
     *
     * @return The root node of the parsed AST.
     */
    public BlockNode parse() {
        BlockNode ast = ParseBlock.parseBlock(this);
        LexerToken token = peek(this);
        if (token.is("}")) {
            throwError("Unmatched right curly bracket");
        }
        if (token.type != LexerTokenType.EOF) {
            throwError("syntax error");
        }
        return ast;
    }

    /**
     * Parses an expression based on operator precedence.
     * <p>
     * Higher precedence means tighter: `*` has higher precedence than `+`
     * <p>
     * Explanation of the  <a href="https://en.wikipedia.org/wiki/Operator-precedence_parser">precedence climbing method</a>
     * can be found in Wikipedia.
     * </p>
     *
     * @param precedence The precedence level of the current expression.
     * @return The root node of the parsed expression.
     */
    public Node parseExpression(int precedence) {
        // First, parse the primary expression (like a number or a variable).
        Node left = ParsePrimary.parsePrimary(this);
        return continueExpression(left, precedence);
    }

    /**
     * Parses the infix and postfix operators that follow an already parsed left operand.
     *
     * @param left       The left operand.
     * @param precedence The precedence level of the current expression.
     * @return The root node of the parsed expression.
     */
    public Node continueExpression(Node left, int precedence) {
        // Continuously process tokens until we reach the end of the expression.
        while (true) {
            // Peek at the next token to determine what to do next.
            LexerToken token = peek(this);

            // Check if we have reached the end of the input (EOF) or a terminator (like `;`).
            if (isExpressionTerminator(token) || token.type != LexerTokenType.OPERATOR) {
                break;
            }

            // Get the precedence of the current token.
            int tokenPrecedence = getPrecedence(token.text);

            // If the token's precedence is less than the precedence of the current expression, stop parsing.
            if (tokenPrecedence <= precedence) {
                break;
            }

            // If the operator is right associative (like assignment), parse it with lower precedence.
            if (ParserTables.RIGHT_ASSOC_OP.contains(token.text)) {
                ctx.logDebug("parseExpression `" + token.text + "` precedence: " + tokenPrecedence + " right assoc");
                left = ParseInfix.parseInfixOperation(this, left, tokenPrecedence - 1);
            } else {
                ctx.logDebug("parseExpression `" + token.text + "` precedence: " + tokenPrecedence + " left assoc");
                left = ParseInfix.parseInfixOperation(this, left, tokenPrecedence);
            }
        }

        // Return the root node of the constructed expression tree.
        return left;
    }

    public void throwError(String message) {
        throw new CompilerException(this.tokenIndex, message, this.errorUtil);
    }

    public void throwError(int index, String message) {
        throw new CompilerException(index, message, this.errorUtil);
    }
}
