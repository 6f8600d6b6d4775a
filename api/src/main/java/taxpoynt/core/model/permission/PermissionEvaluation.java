package taxpoynt.core.model.permission;

import java.util.List;

/**
 * Outcome of one authorization check.
 *
 * @param granted whether access is granted
 * @param permissionId permission evaluated
 * @param userId caller
 * @param reason reason code, e.g. {@code permission_granted} or {@code role_permission_denied}
 * @param matchedPolicies ids of policies whose patterns matched the permission
 * @param cacheHit whether the result was served from the evaluation cache
 */
public record PermissionEvaluation(
        boolean granted,
        String permissionId,
        String userId,
        String reason,
        List<String> matchedPolicies,
        boolean cacheHit) {

    public static final String GRANTED = "permission_granted";
    public static final String NOT_FOUND = "permission_not_found";
    public static final String ROLE_DENIED = "role_permission_denied";
    public static final String RESOURCE_DENIED = "resource_permission_denied";
    public static final String NO_MATCHING_PERMISSION = "no_matching_permission";
    public static final String POLICY_DENIED_PREFIX = "denied_by_policy_";
    public static final String CONDITION_FAILED_PREFIX = "condition_failed_";

    public PermissionEvaluation {
        matchedPolicies = matchedPolicies != null ? List.copyOf(matchedPolicies) : List.of();
    }

    public static PermissionEvaluation granted(String permissionId, String userId, List<String> matchedPolicies) {
        return new PermissionEvaluation(true, permissionId, userId, GRANTED, matchedPolicies, false);
    }

    public static PermissionEvaluation denied(String permissionId, String userId, String reason) {
        return new PermissionEvaluation(false, permissionId, userId, reason, List.of(), false);
    }

    public static PermissionEvaluation denied(
            String permissionId, String userId, String reason, List<String> matchedPolicies) {
        return new PermissionEvaluation(false, permissionId, userId, reason, matchedPolicies, false);
    }

    public PermissionEvaluation asCacheHit() {
        return new PermissionEvaluation(granted, permissionId, userId, reason, matchedPolicies, true);
    }
}
