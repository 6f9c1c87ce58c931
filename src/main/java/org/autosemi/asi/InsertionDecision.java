package org.autosemi.asi;

/**
 * Outcome for one line boundary. Final decisions are always INSERT or SUPPRESS;
 * DEFER_TO_VALIDITY only marks a boundary the layout rules alone cannot settle.
 */
public enum InsertionDecision {
    INSERT,
    SUPPRESS,
    DEFER_TO_VALIDITY
}
