package taxpoynt.core.service.permission;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import taxpoynt.core.model.permission.PermissionContext;
import taxpoynt.core.model.permission.PolicyCondition;
import taxpoynt.core.model.permission.ResourcePermission;
import taxpoynt.core.util.NetworkMatcher;

/**
 * Decides whether a {@link PolicyCondition} holds for a request.
 *
 * <p>Custom conditions dispatch to {@link ConditionHandler}s by name. A custom
 * condition naming no registered handler, or whose handler throws, does not hold.
 */
@ApplicationScoped
public class ConditionEvaluator {

    private static final Logger LOG = Logger.getLogger(ConditionEvaluator.class);

    /**
     * Context attribute naming the tenant of a resource that has no registered ACL.
     */
    public static final String RESOURCE_TENANT_ATTRIBUTE = "resource_tenant_id";

    private final Map<String, ConditionHandler> handlers = new ConcurrentHashMap<>();
    private final NetworkMatcher networkMatcher = new NetworkMatcher();

    @Inject
    public ConditionEvaluator(Instance<ConditionHandler> discovered) {
        discovered.forEach(this::register);
    }

    public ConditionEvaluator(List<ConditionHandler> handlers) {
        handlers.forEach(this::register);
    }

    public void register(ConditionHandler handler) {
        final var previous = handlers.put(handler.name(), handler);
        if (previous != null && previous != handler) {
            LOG.warnf("Condition handler %s replaced", handler.name());
        }
    }

    /**
     * True when every condition holds. An empty list always holds.
     *
     * @param resource the ACL of the target resource, if one is registered
     */
    public boolean allHold(
            List<PolicyCondition> conditions, PermissionContext context, Optional<ResourcePermission> resource) {
        return firstFailing(conditions, context, resource).isEmpty();
    }

    /**
     * The first condition that does not hold, if any.
     */
    public Optional<PolicyCondition> firstFailing(
            List<PolicyCondition> conditions, PermissionContext context, Optional<ResourcePermission> resource) {
        for (PolicyCondition condition : conditions) {
            if (!holds(condition, context, resource)) {
                return Optional.of(condition);
            }
        }
        return Optional.empty();
    }

    public boolean holds(PolicyCondition condition, PermissionContext context, Optional<ResourcePermission> resource) {
        if (condition instanceof PolicyCondition.RoleCondition role) {
            return role.roles().stream().anyMatch(context.roles()::contains);
        }
        if (condition instanceof PolicyCondition.TenantMismatchCondition) {
            return isTenantMismatch(context, resource);
        }
        if (condition instanceof PolicyCondition.TimeRestrictionCondition window) {
            if (window.excludedRoles().stream().anyMatch(context.roles()::contains)) {
                return false;
            }
            return window.contains(context.requestTime().atZone(ZoneOffset.UTC).toLocalTime());
        }
        if (condition instanceof PolicyCondition.IpWhitelistCondition whitelist) {
            return networkMatcher.matchesAny(context.ipAddress(), whitelist.allowed());
        }
        if (condition instanceof PolicyCondition.ResourceOwnerCondition) {
            return context.resourceId() == null
                    || resource.map(acl -> context.userId().equals(acl.ownerId())).orElse(true);
        }
        if (condition instanceof PolicyCondition.CustomCondition custom) {
            return holdsCustom(custom, context);
        }
        LOG.warnf("Unsupported condition type: %s", condition.type());
        return false;
    }

    private static boolean isTenantMismatch(PermissionContext context, Optional<ResourcePermission> resource) {
        final var resourceTenant = resource.map(ResourcePermission::tenantId)
                .or(() -> Optional.ofNullable(context.attributes().get(RESOURCE_TENANT_ATTRIBUTE))
                        .map(Object::toString));
        return resourceTenant.isPresent() && !resourceTenant.get().equals(context.tenantId());
    }

    private boolean holdsCustom(PolicyCondition.CustomCondition custom, PermissionContext context) {
        final var handler = handlers.get(custom.handler());
        if (handler == null) {
            LOG.warnf("No handler registered for custom condition %s", custom.handler());
            return false;
        }
        try {
            return handler.holds(context, custom.parameters());
        } catch (RuntimeException e) {
            LOG.warnf("Custom condition %s failed: %s", custom.handler(), e.getMessage());
            return false;
        }
    }
}
