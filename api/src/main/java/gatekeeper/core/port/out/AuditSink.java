package gatekeeper.core.port.out;

import gatekeeper.core.model.audit.AccessRecord;

/**
 * Destination for access records.
 */
public interface AuditSink {

    /**
     * Write one record. Implementations must not block the caller on slow I/O.
     */
    void write(AccessRecord record);
}
