package taxpoynt.core.model.permission;

import java.util.List;

/**
 * One rule of a policy.
 *
 * @param effect what the rule does when it applies
 * @param permissionPatterns permission-id patterns the rule covers
 * @param conditions conditions that must all hold for the rule to apply
 */
public record PolicyRule(PermissionEffect effect, List<String> permissionPatterns, List<PolicyCondition> conditions) {

    public PolicyRule {
        if (effect == null) {
            throw new IllegalArgumentException("Policy rule effect cannot be null");
        }
        if (permissionPatterns == null || permissionPatterns.isEmpty()) {
            throw new IllegalArgumentException("Policy rule must cover at least one permission pattern");
        }
        permissionPatterns = List.copyOf(permissionPatterns);
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
