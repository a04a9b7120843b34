package com.bazaarvoice.rbac.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Writes each event as a single JSON line to the {@value #AUDIT_LOGGER} logger, which logging configuration can
 * route to its own appender.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String AUDIT_LOGGER = "com.bazaarvoice.rbac.audit";

    private final Logger _auditLog;
    private final ObjectMapper _objectMapper;

    public LoggingAuditSink() {
        this(LoggerFactory.getLogger(AUDIT_LOGGER), newObjectMapper());
    }

    LoggingAuditSink(Logger auditLog, ObjectMapper objectMapper) {
        _auditLog = checkNotNull(auditLog, "auditLog");
        _objectMapper = checkNotNull(objectMapper, "objectMapper");
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void write(AuditEvent event) throws IOException {
        if (_auditLog.isInfoEnabled()) {
            _auditLog.info(_objectMapper.writeValueAsString(event));
        }
    }
}
