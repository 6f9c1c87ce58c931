package org.autosemi.asi;

/**
 * The single point where the pass consults the grammar.
 * Implementations must be free of side effects: a query may be repeated or discarded.
 */
public interface ValidityOracle {

    BoundaryValidity assess(BoundaryQuery query);

    /**
     * Does terminating the pending statement at this boundary produce a complete statement?
     */
    default boolean wouldBeValidBoundary(BoundaryQuery query) {
        BoundaryValidity validity = assess(query);
        return validity.determined && validity.insertValid;
    }
}
