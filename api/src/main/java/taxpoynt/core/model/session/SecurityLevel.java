package taxpoynt.core.model.session;

public enum SecurityLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
