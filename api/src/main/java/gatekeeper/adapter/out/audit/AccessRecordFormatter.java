package gatekeeper.adapter.out.audit;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import gatekeeper.core.model.audit.AccessRecord;

/**
 * Renders access records as single-line JSON with snake_case fields.
 *
 * <p>Every field is always present; absent values are written as {@code null}.
 */
@ApplicationScoped
public class AccessRecordFormatter {

    private final ObjectMapper objectMapper;

    @Inject
    public AccessRecordFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String format(AccessRecord record) {
        var fields = new LinkedHashMap<String, Object>();
        fields.put("timestamp", record.timestamp().toString());
        fields.put("request_id", record.requestId());
        fields.put("method", record.method());
        fields.put("path", record.path());
        fields.put("status", record.status());
        fields.put("decision", record.decision().value());
        fields.put("rule_id", record.ruleId());
        fields.put("subject", record.subject());
        fields.put("username", record.username());
        fields.put("roles", new TreeSet<>(record.roles()));
        fields.put("reason", record.reason());
        fields.put("state", record.state().name().toLowerCase(Locale.ROOT));
        fields.put("backend", record.backend());
        fields.put("latency_ms", record.latencyMs());
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Access record cannot be serialized", e);
        }
    }
}
