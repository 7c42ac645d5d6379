package gatekeeper.core.model.audit;

public enum AuditDecision {
    ALLOW("allow"),
    DENY("deny"),
    UNAUTHENTICATED("unauthenticated");

    private final String value;

    AuditDecision(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
