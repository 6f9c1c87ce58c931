package org.autosemi;

/**
 * Central configuration class for the semicolon insertion tool.
 * Contains constants that control its behavior.
 */
public final class Configuration {

    public static final String version = "1.0.0";

    // Project settings file, looked up from the source file's directory upwards
    public static final String SETTINGS_FILE_NAME = "autosemi.yaml";

    // Maximum number of tokens one speculative parse may span
    public static final int DEFAULT_PROBE_BUDGET = 50000;

    // Prevent instantiation
    private Configuration() {
    }
}
