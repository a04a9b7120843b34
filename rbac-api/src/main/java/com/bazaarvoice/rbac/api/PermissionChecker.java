package com.bazaarvoice.rbac.api;

import java.util.List;

/**
 * Public entry point for permission checks.
 * <p>
 * Implementations are thread safe and never throw for store or timeout failures; those are reported as
 * {@link DecisionOutcome#ERROR} decisions.  Only malformed input raises {@link InvalidCheckRequestException}.
 */
public interface PermissionChecker {

    Decision check(CheckRequest request);

    /**
     * Checks the request, giving up with a {@link DecisionReason#TIMEOUT} decision once {@code deadline} expires.
     */
    Decision check(CheckRequest request, CheckDeadline deadline);

    /**
     * Checks each request in order.  Work shared between requests, such as a user's effective permissions, is
     * computed at most once per batch.  The returned list is parallel to {@code requests}.
     */
    List<Decision> checkBatch(List<CheckRequest> requests);
}
