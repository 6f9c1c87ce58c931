package org.autosemi;

import org.autosemi.asi.AsiDiagnostic;
import org.autosemi.asi.AsiResult;
import org.autosemi.asi.AutoSemicolonPass;
import org.autosemi.asi.ConfigurationGate;
import org.autosemi.asi.DecisionReport;
import org.autosemi.asi.ProjectSettings;
import org.autosemi.astnode.BlockNode;
import org.autosemi.lexer.Lexer;
import org.autosemi.lexer.LexerToken;
import org.autosemi.parser.Parser;
import org.autosemi.parser.TokenUtils;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * The AsiLanguageProvider class runs a compilation unit through the front end:
 * settings, lexer, automatic semicolon insertion and parser.
 * <p>
 * Key functionalities include:
 * - Resolving whether semicolon insertion is enabled for the unit.
 * - Printing the rewritten tokens, the decisions, the rewritten source or the syntax tree.
 * - Reporting diagnostics of the pass on the error stream.
 */
public class AsiLanguageProvider {

    /**
     * Everything produced for one compilation unit.
     */
    public static final class CompiledUnit {
        public final ConfigurationGate gate;
        public final AsiResult asi;
        /**
         * The syntax tree, or null if the unit was not parsed.
         */
        public final BlockNode ast;

        CompiledUnit(ConfigurationGate gate, AsiResult asi, BlockNode ast) {
            this.gate = gate;
            this.asi = asi;
            this.ast = ast;
        }
    }

    /**
     * Tokenizes the code, runs the semicolon insertion pass and, unless only the
     * pass output was asked for, parses the result.
     *
     * @param compilerOptions Compiler flags, file name and source code
     * @return the compiled unit
     */
    public static CompiledUnit compile(ArgumentParser.CompilerOptions compilerOptions) {
        return compile(compilerOptions, null);
    }

    /**
     * Same as {@link #compile(ArgumentParser.CompilerOptions)}, printing the diagnostics of the
     * pass to {@code err} before the parser runs.
     *
     * @param compilerOptions Compiler flags, file name and source code
     * @param err             Stream for the diagnostics, or null
     * @return the compiled unit
     */
    public static CompiledUnit compile(ArgumentParser.CompilerOptions compilerOptions, PrintStream err) {
        String fileName = compilerOptions.fileName != null ? compilerOptions.fileName : "-";
        CompilerContext ctx = new CompilerContext(fileName, compilerOptions);
        ctx.logDebug("parse code: " + compilerOptions.code);

        ProjectSettings settings = loadSettings(compilerOptions, fileName);
        String unitPath = isSourceFile(fileName) ? settings.unitPath(Paths.get(fileName)) : null;
        ConfigurationGate gate = ConfigurationGate.resolve(settings, unitPath, compilerOptions.asiOverride);
        ctx.logDebug("settings: " + settings);
        ctx.logDebug(gate.toString());

        Lexer lexer = new Lexer(compilerOptions.code, fileName);
        List<LexerToken> tokens = lexer.tokenize();

        AsiResult asi = new AutoSemicolonPass(gate.config(), ctx).run(tokens);
        if (err != null) {
            for (AsiDiagnostic diagnostic : asi.diagnostics) {
                err.println(diagnostic.format(fileName));
            }
        }

        BlockNode ast = null;
        if (!compilerOptions.tokenizeOnly && !compilerOptions.explain
                && !compilerOptions.explainJson && !compilerOptions.emit) {
            Parser parser = new Parser(ctx, asi.tokens);
            ast = parser.parse();
            ctx.logDebug("-- AST:\n" + ast + "--\n");
        }
        return new CompiledUnit(gate, asi, ast);
    }

    /**
     * Compiles the unit and prints what the options ask for.
     *
     * @return the exit status: 1 if the pass reported an error, 0 otherwise
     * @throws org.autosemi.runtime.CompilerException if the unit does not parse; the diagnostics
     *                                                of the pass have been printed by then
     */
    public static int run(ArgumentParser.CompilerOptions compilerOptions, PrintStream out, PrintStream err) {
        CompiledUnit unit = compile(compilerOptions, err);
        String fileName = compilerOptions.fileName != null ? compilerOptions.fileName : "-";

        if (compilerOptions.tokenizeOnly) {
            for (LexerToken token : unit.asi.tokens) {
                out.println(token);
            }
        } else if (compilerOptions.explain) {
            out.print(DecisionReport.toText(fileName, unit.asi));
        } else if (compilerOptions.explainJson) {
            out.println(DecisionReport.toJson(fileName, unit.asi));
        } else if (compilerOptions.emit) {
            out.print(TokenUtils.toText(unit.asi.tokens, 0, unit.asi.tokens.size() - 1));
        } else if (compilerOptions.parseOnly) {
            out.print(unit.ast);
        } else {
            out.println(fileName + " syntax OK");
        }
        return unit.asi.hasErrors() ? 1 : 0;
    }

    private static ProjectSettings loadSettings(ArgumentParser.CompilerOptions compilerOptions, String fileName) {
        if (compilerOptions.configFile != null) {
            return ProjectSettings.load(Paths.get(compilerOptions.configFile));
        }
        if (isSourceFile(fileName)) {
            Path parent = Paths.get(fileName).toAbsolutePath().getParent();
            return parent == null ? ProjectSettings.EMPTY : ProjectSettings.discover(parent);
        }
        return ProjectSettings.discover(Paths.get("").toAbsolutePath());
    }

    private static boolean isSourceFile(String fileName) {
        return !fileName.equals("-") && !fileName.equals("-e") && Files.isRegularFile(Paths.get(fileName));
    }
}
