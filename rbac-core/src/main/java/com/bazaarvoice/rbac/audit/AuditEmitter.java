package com.bazaarvoice.rbac.audit;

/**
 * Accepts audit events.  Implementations must not block and must not throw; losing an event is preferable to
 * delaying or failing a permission check.
 */
public interface AuditEmitter {

    void emit(AuditEvent event);
}
