package com.bazaarvoice.rbac.audit;

import java.io.IOException;

/**
 * Destination for audit events.  Called from a single background thread, so implementations need not be thread
 * safe.  Storage and retention are the sink's concern.
 */
public interface AuditSink {

    void write(AuditEvent event) throws IOException;
}
