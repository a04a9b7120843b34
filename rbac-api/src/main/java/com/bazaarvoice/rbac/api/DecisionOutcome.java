package com.bazaarvoice.rbac.api;

/** Top-level classification of a {@link Decision}.  Only {@link #GRANTED} permits access. */
public enum DecisionOutcome {
    GRANTED,
    DENIED,
    ERROR
}
