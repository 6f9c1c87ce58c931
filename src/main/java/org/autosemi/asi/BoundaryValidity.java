package org.autosemi.asi;

/**
 * The oracle's verdict on the two ways of resolving a boundary.
 */
public final class BoundaryValidity {
    /**
     * Validity could not be established within the bounded lookahead.
     */
    public static final BoundaryValidity UNDETERMINED = new BoundaryValidity(false, false, false, false);
    /**
     * Inside an open parenthesis or bracket: only continuing is admissible.
     */
    public static final BoundaryValidity SUPPRESS_ONLY = new BoundaryValidity(false, true, false, true);

    /**
     * Terminating the statement here gives a complete statement, and the next line can follow it.
     */
    public final boolean insertValid;
    /**
     * The statement continues coherently into the next line, or needs no terminator.
     */
    public final boolean suppressValid;
    /**
     * The statement is block-like and already complete at the boundary.
     */
    public final boolean terminatorOptional;
    public final boolean determined;

    public BoundaryValidity(boolean insertValid, boolean suppressValid, boolean terminatorOptional, boolean determined) {
        this.insertValid = insertValid;
        this.suppressValid = suppressValid;
        this.terminatorOptional = terminatorOptional;
        this.determined = determined;
    }

    public static BoundaryValidity of(boolean insertValid, boolean suppressValid) {
        return new BoundaryValidity(insertValid, suppressValid, false, true);
    }

    @Override
    public String toString() {
        if (!determined) {
            return "undetermined";
        }
        return "insert=" + (insertValid ? "valid" : "invalid")
                + " suppress=" + (suppressValid ? "valid" : "invalid")
                + (terminatorOptional ? " terminator-optional" : "");
    }
}
