package taxpoynt.core.model.permission;

import java.time.Instant;
import java.util.List;

/**
 * A prioritized set of rules. Higher priority policies are evaluated first.
 *
 * @param id policy id
 * @param name display name
 * @param description description
 * @param rules ordered rules
 * @param priority evaluation priority, higher first
 * @param active inactive policies are skipped
 * @param createdAt creation time
 */
public record Policy(
        String id, String name, String description, List<PolicyRule> rules, int priority, boolean active, Instant createdAt) {

    public Policy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Policy ID cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (description == null) {
            description = "";
        }
        rules = rules != null ? List.copyOf(rules) : List.of();
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Policy withPriority(int priority) {
        return new Policy(id, name, description, rules, priority, active, createdAt);
    }

    public Policy withActive(boolean active) {
        return new Policy(id, name, description, rules, priority, active, createdAt);
    }
}
