package taxpoynt.core.model.permission;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import taxpoynt.core.model.error.ValidationException;

/**
 * Parses condition maps and policy rule maps, as carried by policy definitions
 * and operation payloads, into {@link PolicyCondition} variants and {@link PolicyRule}s.
 */
public final class PolicyConditions {

    private PolicyConditions() {}

    /**
     * Parse a condition map such as {@code {"role": ["admin"], "tenant_mismatch": true}}.
     *
     * @throws ValidationException if a condition kind is unknown or its value is malformed
     */
    public static List<PolicyCondition> parse(Map<String, ?> conditions) {
        if (conditions == null || conditions.isEmpty()) {
            return List.of();
        }
        final var parsed = new ArrayList<PolicyCondition>();
        for (var entry : conditions.entrySet()) {
            parseEntry(entry.getKey(), entry.getValue(), parsed);
        }
        return List.copyOf(parsed);
    }

    /**
     * Parse a rule map such as
     * {@code {"effect": "deny", "permissions": ["tenant:*"], "conditions": {"tenant_mismatch": true}}}.
     *
     * @throws ValidationException if the effect is missing or invalid, or no permissions are listed
     */
    public static PolicyRule parseRule(Map<String, ?> rule) {
        final var effect = PermissionEffect.fromWireName(rule.get("effect") == null ? null : rule.get("effect").toString())
                .orElseThrow(() -> new ValidationException("Policy rule must have valid effect (allow/deny)"));
        final var permissions = rule.get("permissions");
        if (permissions == null) {
            throw new ValidationException("Policy rule must specify permissions");
        }
        final var patterns = strings("permissions", permissions);
        if (patterns.isEmpty()) {
            throw new ValidationException("Policy rule must specify permissions");
        }
        final var conditions = rule.get("conditions");
        if (conditions != null && !(conditions instanceof Map<?, ?>)) {
            throw new ValidationException("Policy rule conditions must be an object");
        }
        return new PolicyRule(effect, patterns, parse(stringKeys((Map<?, ?>) conditions)));
    }

    private static Map<String, Object> stringKeys(Map<?, ?> source) {
        if (source == null) {
            return Map.of();
        }
        final var result = new HashMap<String, Object>();
        source.forEach((k, v) -> {
            if (k != null) {
                result.put(k.toString(), v);
            }
        });
        return result;
    }

    private static void parseEntry(String type, Object value, List<PolicyCondition> into) {
        switch (type) {
            case "role" -> into.add(new PolicyCondition.RoleCondition(Set.copyOf(strings(type, value))));
            case "tenant_mismatch" -> {
                if (isTrue(value)) {
                    into.add(new PolicyCondition.TenantMismatchCondition());
                }
            }
            case "resource_owner" -> {
                if (isTrue(value)) {
                    into.add(new PolicyCondition.ResourceOwnerCondition());
                }
            }
            case "ip_whitelist" -> into.add(new PolicyCondition.IpWhitelistCondition(strings(type, value)));
            case "time_restriction" -> into.add(timeRestriction(value));
            case "custom" -> into.add(custom(value));
            default -> throw new ValidationException("Unknown condition type: " + type);
        }
    }

    private static PolicyCondition timeRestriction(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            throw new ValidationException("time_restriction condition must be an object");
        }
        final var start = map.get("start_time");
        final var end = map.get("end_time");
        if (start == null || end == null) {
            throw new ValidationException("time_restriction condition requires start_time and end_time");
        }
        try {
            final var excluded = map.get("exclude_roles");
            return new PolicyCondition.TimeRestrictionCondition(
                    LocalTime.parse(start.toString()),
                    LocalTime.parse(end.toString()),
                    excluded == null ? Set.of() : Set.copyOf(strings("exclude_roles", excluded)));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid time in time_restriction condition: " + e.getParsedString(), e);
        }
    }

    private static PolicyCondition custom(Object value) {
        if (value instanceof String handler) {
            return new PolicyCondition.CustomCondition(handler, Map.of());
        }
        if (value instanceof Map<?, ?> map && map.get("handler") != null) {
            final var parameters = new HashMap<String, Object>();
            map.forEach((k, v) -> {
                if (k != null && v != null && !"handler".equals(k)) {
                    parameters.put(k.toString(), v);
                }
            });
            return new PolicyCondition.CustomCondition(map.get("handler").toString(), parameters);
        }
        throw new ValidationException("custom condition requires a handler name");
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value) || "true".equalsIgnoreCase(String.valueOf(value));
    }

    private static List<String> strings(String type, Object value) {
        if (value instanceof String single) {
            return List.of(single);
        }
        if (value instanceof Collection<?> many) {
            final var result = new LinkedHashSet<String>();
            for (Object item : many) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return List.copyOf(result);
        }
        throw new ValidationException(type + " condition must be a string or a list of strings");
    }
}
