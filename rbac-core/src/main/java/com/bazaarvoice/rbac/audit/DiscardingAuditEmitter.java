package com.bazaarvoice.rbac.audit;

/**
 * {@link AuditEmitter} used when auditing is disabled.
 */
public class DiscardingAuditEmitter implements AuditEmitter {

    @Override
    public void emit(AuditEvent event) {
        // Discard
    }
}
