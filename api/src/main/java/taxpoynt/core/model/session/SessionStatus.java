package taxpoynt.core.model.session;

/**
 * Session lifecycle state. Only ACTIVE sessions transition.
 */
public enum SessionStatus {
    ACTIVE,
    EXPIRED,
    TERMINATED,
    SUSPENDED,
    LOCKED
}
