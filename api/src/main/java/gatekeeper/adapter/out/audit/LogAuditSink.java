package gatekeeper.adapter.out.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import gatekeeper.core.model.audit.AccessRecord;
import gatekeeper.core.port.out.AuditSink;

/**
 * Writes access records to the {@code gatekeeper.audit} log category.
 *
 * <p>The category is routed in {@code application.properties} to a message-only
 * handler named by {@code gatekeeper.audit.handler}: {@code ACCESS} for the console
 * or {@code ACCESS_FILE} for the file at {@code gatekeeper.audit.file}. Either way
 * each record appears as a bare JSON line.
 */
@ApplicationScoped
public class LogAuditSink implements AuditSink {

    static final String CATEGORY = "gatekeeper.audit";

    private static final Logger LOG = Logger.getLogger(CATEGORY);

    private final AccessRecordFormatter formatter;

    @Inject
    public LogAuditSink(AccessRecordFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public void write(AccessRecord record) {
        LOG.info(formatter.format(record));
    }
}
