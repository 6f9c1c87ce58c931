package org.autosemi.asi;

import org.autosemi.Configuration;

import java.util.Objects;

/**
 * Immutable settings of one run of the semicolon insertion pass, resolved once per
 * compilation unit by {@link ConfigurationGate}.
 */
public final class AsiConfig {
    public static final AsiConfig DEFAULT = new AsiConfig(true, Configuration.DEFAULT_PROBE_BUDGET);

    public final boolean enabled;
    /**
     * Maximum number of tokens a single speculative parse may span.
     */
    public final int probeBudget;

    public AsiConfig(boolean enabled, int probeBudget) {
        if (probeBudget <= 0) {
            throw new IllegalArgumentException("probe budget must be positive: " + probeBudget);
        }
        this.enabled = enabled;
        this.probeBudget = probeBudget;
    }

    public AsiConfig withEnabled(boolean enabled) {
        return enabled == this.enabled ? this : new AsiConfig(enabled, probeBudget);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AsiConfig)) {
            return false;
        }
        AsiConfig that = (AsiConfig) o;
        return enabled == that.enabled && probeBudget == that.probeBudget;
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, probeBudget);
    }

    @Override
    public String toString() {
        return "AsiConfig{enabled=" + enabled + ", probeBudget=" + probeBudget + '}';
    }
}
