package org.autosemi.asi;

/**
 * The final decision for one boundary, with the rule that produced it and the
 * validity the oracle reported (null when the oracle was not consulted).
 */
public final class BoundaryDecision {
    public final LineBoundary boundary;
    public final InsertionDecision decision;
    public final DecisionReason reason;
    public final BoundaryValidity validity;

    public BoundaryDecision(LineBoundary boundary, InsertionDecision decision, DecisionReason reason,
                            BoundaryValidity validity) {
        if (decision == InsertionDecision.DEFER_TO_VALIDITY) {
            throw new IllegalArgumentException("a final decision must be INSERT or SUPPRESS");
        }
        this.boundary = boundary;
        this.decision = decision;
        this.reason = reason;
        this.validity = validity;
    }

    public boolean isInsert() {
        return decision == InsertionDecision.INSERT;
    }

    @Override
    public String toString() {
        return "BoundaryDecision{" + decision + " " + reason + ", " + boundary
                + (validity != null ? ", " + validity : "") + '}';
    }
}
