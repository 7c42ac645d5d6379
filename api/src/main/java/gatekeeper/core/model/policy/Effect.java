package gatekeeper.core.model.policy;

public enum Effect {
    ALLOW,
    DENY
}
