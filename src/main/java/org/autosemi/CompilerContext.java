package org.autosemi;

/**
 * Per compilation unit context shared by the lexer, the semicolon insertion pass and the parser.
 */
public class CompilerContext {
    // Name of the compilation unit, used in error messages
    public final String fileName;
    public final ArgumentParser.CompilerOptions compilerOptions;

    public CompilerContext(String fileName, ArgumentParser.CompilerOptions compilerOptions) {
        this.fileName = fileName;
        this.compilerOptions = compilerOptions;
    }

    /**
     * Logs a debug message if debugging is enabled.
     *
     * @param message The message to log.
     */
    public void logDebug(String message) {
        if (this.compilerOptions.debugEnabled) {
            System.out.println(message);
        }
    }

    @Override
    public String toString() {
        return "CompilerContext{\n" +
                "    fileName='" + fileName + "',\n" +
                "    compilerOptions=" + compilerOptions + "\n" +
                "}";
    }
}
