package org.autosemi.asi;

/**
 * The rule that produced a boundary decision.
 */
public enum DecisionReason {
    CONTINUATION_MARKER("line ends with a continuation marker"),
    ALREADY_TERMINATED("line already ends with a terminator"),
    NO_PENDING_STATEMENT("no statement is pending"),
    IMPLICIT_RETURN("last expression of the block is its value"),
    BLOCK_CLOSE("closing delimiter, decided by the grammar"),
    DEEPER_INDENT("deeper indentation continues the statement"),
    FORCED_SPLIT("the statement cannot continue on the next line"),
    NEW_STATEMENT("same or shallower indentation starts a new statement"),
    FORCED_MERGE("the statement is incomplete without the next line"),
    UNDETERMINED("validity could not be determined"),
    AMBIGUOUS("neither terminating nor continuing parses");

    public final String description;

    DecisionReason(String description) {
        this.description = description;
    }
}
