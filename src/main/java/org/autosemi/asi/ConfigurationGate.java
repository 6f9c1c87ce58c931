package org.autosemi.asi;

import org.autosemi.Configuration;

/**
 * Decides once, before the pass runs, whether semicolon insertion is enabled for a
 * compilation unit.
 * <p>
 * Precedence, highest first: the command line override, the longest matching package entry
 * of the project settings, the project-wide setting, and finally the default (enabled).
 */
public final class ConfigurationGate {
    private final AsiConfig config;
    private final String source;

    private ConfigurationGate(AsiConfig config, String source) {
        this.config = config;
        this.source = source;
    }

    /**
     * @param settings    project settings, {@link ProjectSettings#EMPTY} if there are none
     * @param unitPath    path of the compilation unit as returned by {@link ProjectSettings#unitPath}, or null
     * @param cliOverride {@code --asi} / {@code --no-asi}, or null if neither was given
     */
    public static ConfigurationGate resolve(ProjectSettings settings, String unitPath, Boolean cliOverride) {
        int budget = settings.probeBudget() != null ? settings.probeBudget() : Configuration.DEFAULT_PROBE_BUDGET;

        if (cliOverride != null) {
            return new ConfigurationGate(new AsiConfig(cliOverride, budget), "command line");
        }
        String prefix = settings.matchPackage(unitPath);
        if (prefix != null) {
            return new ConfigurationGate(new AsiConfig(settings.packages().get(prefix), budget),
                    "package '" + prefix + "'");
        }
        if (settings.asiEnabled() != null) {
            return new ConfigurationGate(new AsiConfig(settings.asiEnabled(), budget), "project settings");
        }
        return new ConfigurationGate(new AsiConfig(true, budget), "default");
    }

    public boolean isEnabled() {
        return config.enabled;
    }

    public AsiConfig config() {
        return config;
    }

    /**
     * Where the enabled flag came from, for diagnostics.
     */
    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return "ConfigurationGate{" + config + " from " + source + '}';
    }
}
