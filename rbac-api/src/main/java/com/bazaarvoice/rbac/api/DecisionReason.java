package com.bazaarvoice.rbac.api;

/**
 * Why a {@link Decision} was reached.  Each reason belongs to exactly one {@link DecisionOutcome}.
 */
public enum DecisionReason {
    SUPER_ADMIN(DecisionOutcome.GRANTED),
    DIRECT_GRANT(DecisionOutcome.GRANTED),
    DEPENDENCY_IMPLIED(DecisionOutcome.GRANTED),

    NO_ASSIGNMENT_IN_SCOPE(DecisionOutcome.DENIED),
    ENTITY_BOUNDARY_VIOLATION(DecisionOutcome.DENIED),
    NOT_GRANTED(DecisionOutcome.DENIED),
    RESOURCE_NOT_FOUND(DecisionOutcome.DENIED),

    STORE_UNAVAILABLE(DecisionOutcome.ERROR),
    TIMEOUT(DecisionOutcome.ERROR);

    private final DecisionOutcome _outcome;

    DecisionReason(DecisionOutcome outcome) {
        _outcome = outcome;
    }

    public DecisionOutcome getOutcome() {
        return _outcome;
    }
}
