package gatekeeper.core.model.audit;

import java.time.Instant;
import java.util.Set;

import gatekeeper.core.model.gateway.PipelineState;

/**
 * One audit record per request, emitted exactly once on every exit path.
 *
 * <p>Holds extracted claim fields and decision metadata only. Raw tokens and
 * signatures never reach this type.
 *
 * @param timestamp when the request was received
 * @param requestId request correlation id
 * @param method    HTTP method
 * @param path      request path as received
 * @param status    HTTP status returned to the caller
 * @param decision  allow, deny or unauthenticated
 * @param ruleId    the deciding rule, null when no rule matched or policy was not reached
 * @param subject   verified subject, null when no token was verified
 * @param username  verified username, null when no token was verified
 * @param roles     verified roles, empty when no token was verified
 * @param reason    failure reason, null on success
 * @param state     terminal pipeline state
 * @param backend   route id the request was forwarded to, null if not routed
 * @param latencyMs time from receipt to completion
 */
public record AccessRecord(
        Instant timestamp,
        String requestId,
        String method,
        String path,
        int status,
        AuditDecision decision,
        String ruleId,
        String subject,
        String username,
        Set<String> roles,
        String reason,
        PipelineState state,
        String backend,
        long latencyMs) {

    public AccessRecord {
        if (timestamp == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("Access records are only written for terminal states: " + state);
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }
}
