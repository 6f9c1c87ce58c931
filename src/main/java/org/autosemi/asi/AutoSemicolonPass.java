package org.autosemi.asi;

import org.autosemi.CompilerContext;
import org.autosemi.lexer.LexerToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Automatic semicolon insertion: runs the stages from token list to rewritten token list.
 * <p>
 * Usage:
 * <pre>
 *   AsiResult result = new AutoSemicolonPass(gate.config(), ctx).run(tokens);
 *   BlockNode ast = new Parser(ctx, result.tokens).parse();
 * </pre>
 * A pass holds no state between runs; the same instance may be reused.
 */
public class AutoSemicolonPass {
    private final AsiConfig config;
    private final ValidityOracle oracle;
    private final CompilerContext ctx;

    public AutoSemicolonPass(AsiConfig config, CompilerContext ctx) {
        this(config, new ParserValidityOracle(ctx, config.probeBudget), ctx);
    }

    public AutoSemicolonPass(AsiConfig config, ValidityOracle oracle, CompilerContext ctx) {
        this.config = config;
        this.oracle = oracle;
        this.ctx = ctx;
    }

    public AsiResult run(List<LexerToken> tokens) {
        if (!config.enabled) {
            ctx.logDebug("ASI disabled, tokens pass through");
            return AsiResult.passThrough(tokens);
        }
        List<AsiDiagnostic> diagnostics = new ArrayList<>();
        LineLayout layout = LineIndentTracker.track(tokens, diagnostics);
        List<LineBoundary> boundaries = ContinuationFilter.apply(tokens, LineBoundaryScanner.scan(tokens, layout));
        ctx.logDebug("ASI " + boundaries.size() + " line boundaries");

        List<BoundaryDecision> decisions = new InsertionDecisionEngine(oracle, ctx)
                .decide(tokens, layout, boundaries, diagnostics);
        List<LexerToken> rewritten = EmissionStage.emit(tokens, decisions);
        return new AsiResult(tokens, rewritten, decisions, diagnostics, true);
    }
}
