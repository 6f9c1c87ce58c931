package org.autosemi.asi;

/**
 * An advisory or error observation made by the pass. Diagnostics never stop the pass.
 */
public final class AsiDiagnostic {
    public static final String MIXED_INDENTATION = "mixed-indentation";
    public static final String AMBIGUOUS_BOUNDARY = "ambiguous-boundary";

    public enum Severity {
        WARNING,
        ERROR
    }

    public final Severity severity;
    public final String code;
    public final int line;
    public final int column;
    public final String message;

    public AsiDiagnostic(Severity severity, String code, int line, int column, String message) {
        this.severity = severity;
        this.code = code;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    /**
     * Formats the diagnostic the way compilers print them: {@code file:line:column: warning: message}.
     */
    public String format(String fileName) {
        return fileName + ":" + line + ":" + column + ": " + severity.name().toLowerCase() + ": " + message
                + " [" + code + "]";
    }

    @Override
    public String toString() {
        return format("-");
    }
}
