package org.autosemi.asi;

import org.autosemi.CompilerContext;
import org.autosemi.astnode.IdentifierNode;
import org.autosemi.astnode.Node;
import org.autosemi.lexer.LexerToken;
import org.autosemi.lexer.LexerTokenType;
import org.autosemi.parser.ParseStatement;
import org.autosemi.parser.Parser;
import org.autosemi.parser.ParserTables;
import org.autosemi.parser.TokenUtils;
import org.autosemi.runtime.CompilerException;
import org.autosemi.runtime.IncompleteInputException;

import java.util.List;

/**
 * Answers validity queries by running the real parser speculatively.
 * <p>
 * Each probe is a fresh {@link Parser} over a window of the token list that starts at the
 * pending statement and ends with the line after the boundary; it is thrown away afterwards,
 * whether it succeeded or not. Terminators decided earlier in the pass are shown to the probe
 * as virtual terminators.
 * <p>
 * When the query resumes inside the statement, the window starts at the first token of the line
 * before the boundary. That line is parsed as the rest of an expression: if the token before it
 * ends an operand, a placeholder stands for the part of the statement outside the window.
 */
public class ParserValidityOracle implements ValidityOracle {

    private enum Outcome {
        VALID,
        INVALID,
        // block-like statement that is already complete
        OPTIONAL,
        UNDETERMINED
    }

    private final CompilerContext ctx;
    private final int probeBudget;
    private long probedTokens;

    public ParserValidityOracle(CompilerContext ctx, int probeBudget) {
        this.ctx = ctx;
        this.probeBudget = probeBudget;
    }

    @Override
    public BoundaryValidity assess(BoundaryQuery query) {
        LineBoundary boundary = query.boundary;
        if (boundary.insideGroup()) {
            return BoundaryValidity.SUPPRESS_ONLY;
        }
        if (query.statementStart < 0 || query.statementStart > boundary.lastTokenIndex) {
            return BoundaryValidity.UNDETERMINED;
        }
        if (query.probeStart < query.statementStart || query.probeStart > boundary.lastTokenIndex) {
            return BoundaryValidity.UNDETERMINED;
        }
        int limit = endOfLine(query.tokens, boundary.nextTokenIndex);
        if (limit - query.probeStart > probeBudget) {
            ctx.logDebug("probe at line " + boundary.line + " spans " + (limit - query.probeStart)
                    + " tokens, over budget " + probeBudget);
            return BoundaryValidity.UNDETERMINED;
        }
        probedTokens += (boundary.lastTokenIndex + 1 - query.probeStart) + (limit - query.probeStart)
                + (limit - boundary.nextTokenIndex);

        Outcome insert = probeInsert(query);
        Outcome suppress = probeSuppress(query, limit);
        ctx.logDebug("probe at line " + boundary.line + ": insert " + insert + ", suppress " + suppress);
        if (insert == Outcome.UNDETERMINED || suppress == Outcome.UNDETERMINED) {
            return BoundaryValidity.UNDETERMINED;
        }
        boolean insertValid = insert == Outcome.VALID && canStartStatement(query, limit);
        return new BoundaryValidity(insertValid,
                suppress != Outcome.INVALID,
                suppress == Outcome.OPTIONAL,
                true);
    }

    /**
     * Returns the number of tokens the probes of this oracle were opened over so far.
     */
    public long probedTokens() {
        return probedTokens;
    }

    /**
     * Parses the pending statement with a terminator placed right after the boundary's last token.
     */
    private Outcome probeInsert(BoundaryQuery query) {
        LineBoundary boundary = query.boundary;
        Parser parser = Parser.probe(ctx, query.tokens, query.probeStart, boundary.lastTokenIndex + 1,
                Parser.WindowEnd.END_OF_INPUT, query.terminatedAfter);
        parser.boundaryTerminatorAfter = boundary.lastTokenIndex;
        try {
            if (query.resumesInsideStatement()) {
                parseRestOfExpression(parser, query);
                TokenUtils.consume(parser, LexerTokenType.OPERATOR, ";");
            } else {
                parser.parse();
            }
        } catch (CompilerException e) {
            if (e.getTokenIndex() <= boundary.lastTokenIndex) {
                // the statement is already broken before the boundary
                return Outcome.UNDETERMINED;
            }
            return Outcome.INVALID;
        }
        return parser.consumedTerminatorAfter == boundary.lastTokenIndex ? Outcome.VALID : Outcome.INVALID;
    }

    /**
     * Parses the pending statement across the boundary, up to the end of the next line.
     */
    private Outcome probeSuppress(BoundaryQuery query, int limit) {
        LineBoundary boundary = query.boundary;
        Parser parser = Parser.probe(ctx, query.tokens, query.probeStart, limit,
                Parser.WindowEnd.INCOMPLETE, query.terminatedAfter);
        try {
            if (query.resumesInsideStatement()) {
                parseRestOfExpression(parser, query);
                int end = parser.lastConsumedIndex;
                if (end > boundary.lastTokenIndex) {
                    return Outcome.VALID;
                }
                if (end < boundary.lastTokenIndex) {
                    return Outcome.UNDETERMINED;
                }
                LexerToken after = TokenUtils.peek(parser);
                return after.is(";") || after.is("}") ? Outcome.VALID : Outcome.INVALID;
            }
            while (true) {
                LexerToken token = TokenUtils.peek(parser);
                if (token.is(";")) {
                    TokenUtils.consume(parser);
                    continue;
                }
                if (parser.tokenIndex > boundary.lastTokenIndex || token.type == LexerTokenType.EOF || token.is("}")) {
                    return Outcome.UNDETERMINED;
                }
                Node statement = ParseStatement.parseStatement(parser);
                int end = parser.lastConsumedIndex;
                if (end > boundary.lastTokenIndex) {
                    return Outcome.VALID;
                }
                LexerToken after = TokenUtils.peek(parser);
                if (end == boundary.lastTokenIndex) {
                    if (after.is(";") || after.is("}")) {
                        return Outcome.VALID;
                    }
                    return ParseStatement.isBlockLike(statement) ? Outcome.OPTIONAL : Outcome.INVALID;
                }
                // several statements on the boundary's line
                if (after.is(";")) {
                    TokenUtils.consume(parser);
                } else if (!ParseStatement.isBlockLike(statement)) {
                    return Outcome.UNDETERMINED;
                }
            }
        } catch (IncompleteInputException e) {
            // the statement runs past the next line
            return Outcome.VALID;
        } catch (CompilerException e) {
            int index = e.getTokenIndex();
            if (index <= boundary.lastTokenIndex) {
                return Outcome.UNDETERMINED;
            }
            return index == boundary.nextTokenIndex ? Outcome.INVALID : Outcome.VALID;
        }
    }

    /**
     * Can the line after the boundary begin a new statement (or close the block)?
     */
    private boolean canStartStatement(BoundaryQuery query, int limit) {
        LineBoundary boundary = query.boundary;
        LexerToken next = query.tokens.get(boundary.nextTokenIndex);
        if (next.is("}") || next.is(";")) {
            return true;
        }
        Parser parser = Parser.probe(ctx, query.tokens, boundary.nextTokenIndex, limit,
                Parser.WindowEnd.INCOMPLETE, null);
        try {
            ParseStatement.parseStatement(parser);
            return true;
        } catch (IncompleteInputException e) {
            return true;
        } catch (CompilerException e) {
            return e.getTokenIndex() != boundary.nextTokenIndex;
        }
    }

    private static void parseRestOfExpression(Parser parser, BoundaryQuery query) {
        if (endsOperand(query.tokens, query.probeStart)) {
            parser.continueExpression(new IdentifierNode("_", query.probeStart), 0);
        } else {
            parser.parseExpression(0);
        }
    }

    // Does the significant token before tokenIndex complete an operand?
    private static boolean endsOperand(List<LexerToken> tokens, int tokenIndex) {
        int i = tokenIndex - 1;
        while (i >= 0 && !tokens.get(i).isSignificant()) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        LexerToken previous = tokens.get(i);
        switch (previous.type) {
            case NUMBER:
            case STRING:
                return true;
            case IDENTIFIER:
                return !ParserTables.RESERVED_WORDS.contains(previous.text);
            default:
                return previous.is(")") || previous.is("]") || previous.is("}") || previous.is("?");
        }
    }

    // Index of the newline (or EOF) that ends the line starting at tokenIndex.
    private static int endOfLine(List<LexerToken> tokens, int tokenIndex) {
        int i = tokenIndex;
        while (i < tokens.size()) {
            LexerTokenType type = tokens.get(i).type;
            if (type == LexerTokenType.NEWLINE || type == LexerTokenType.EOF) {
                break;
            }
            i++;
        }
        return i;
    }
}
