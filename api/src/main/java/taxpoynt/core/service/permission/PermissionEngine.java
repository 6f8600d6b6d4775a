package taxpoynt.core.service.permission;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import taxpoynt.core.cache.CaffeineLocalCache;
import taxpoynt.core.cache.LocalCache;
import taxpoynt.core.config.PermissionConfig;
import taxpoynt.core.model.error.ValidationException;
import taxpoynt.core.model.permission.AccessLevel;
import taxpoynt.core.model.permission.Permission;
import taxpoynt.core.model.permission.PermissionContext;
import taxpoynt.core.model.permission.PermissionEffect;
import taxpoynt.core.model.permission.PermissionEvaluation;
import taxpoynt.core.model.permission.Policy;
import taxpoynt.core.model.permission.PolicyRule;
import taxpoynt.core.model.permission.ResourcePermission;
import taxpoynt.core.model.permission.ResourceType;
import taxpoynt.core.port.out.AuthMetrics;
import taxpoynt.core.port.out.PermissionCatalog;

/**
 * Role-, policy-, condition- and resource-based permission evaluation.
 *
 * <p>Evaluation order for {@link #evaluate}:
 * <ol>
 *   <li>evaluation cache</li>
 *   <li>permission exists</li>
 *   <li>one of the caller's roles grants the permission, directly or by pattern</li>
 *   <li>rules of active policies covering the permission, highest priority first;
 *       the first rule whose conditions hold either denies or passes the step</li>
 *   <li>the permission's own conditions</li>
 *   <li>the target resource's ACL</li>
 * </ol>
 *
 * <p>Every outcome past the cache is cached. Changing a role's grants drops
 * the entries of contexts carrying that role; changing a resource ACL drops
 * the entries targeting that resource.
 */
@ApplicationScoped
public class PermissionEngine {

    private static final Logger LOG = Logger.getLogger(PermissionEngine.class);

    private final PermissionCatalog catalog;
    private final PermissionPatternMatcher matcher;
    private final ConditionEvaluator conditions;
    private final AuthMetrics metrics;
    private final LocalCache<EvaluationKey, PermissionEvaluation> cache;

    /**
     * Cache key; roles are sorted so that role order does not matter.
     */
    record EvaluationKey(
            String userId,
            String permissionId,
            List<String> roles,
            String tenantId,
            String resourceId,
            String action) {

        static EvaluationKey of(PermissionContext context, String permissionId) {
            return new EvaluationKey(
                    context.userId(),
                    permissionId,
                    context.roles().stream().sorted().toList(),
                    context.tenantId(),
                    context.resourceId(),
                    context.action());
        }
    }

    @Inject
    public PermissionEngine(
            PermissionCatalog catalog,
            PermissionPatternMatcher matcher,
            ConditionEvaluator conditions,
            AuthMetrics metrics,
            PermissionConfig config) {
        this(
                catalog,
                matcher,
                conditions,
                metrics,
                new CaffeineLocalCache<>(config.cacheTtl(), config.cacheMaxSize()));
    }

    PermissionEngine(
            PermissionCatalog catalog,
            PermissionPatternMatcher matcher,
            ConditionEvaluator conditions,
            AuthMetrics metrics,
            LocalCache<EvaluationKey, PermissionEvaluation> cache) {
        this.catalog = catalog;
        this.matcher = matcher;
        this.conditions = conditions;
        this.metrics = metrics;
        this.cache = cache;
    }

    public Uni<PermissionEvaluation> evaluate(PermissionContext context, String permissionId) {
        final var key = EvaluationKey.of(context, permissionId);
        final var cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordPermissionEvaluation(cached.get().granted(), true);
            return Uni.createFrom().item(cached.get().asCacheHit());
        }

        return catalog.findPermission(permissionId)
                .flatMap(permission -> {
                    if (permission.isEmpty()) {
                        return Uni.createFrom()
                                .item(PermissionEvaluation.denied(
                                        permissionId, context.userId(), PermissionEvaluation.NOT_FOUND));
                    }
                    return evaluateKnown(context, permission.get());
                })
                .invoke(result -> {
                    if (!PermissionEvaluation.NOT_FOUND.equals(result.reason())) {
                        cache.put(key, result);
                    }
                    metrics.recordPermissionEvaluation(result.granted(), false);
                    LOG.debugf(
                            "Permission %s for %s: %s (%s)",
                            permissionId,
                            context.userId(),
                            result.granted() ? "granted" : "denied",
                            result.reason());
                });
    }

    private Uni<PermissionEvaluation> evaluateKnown(PermissionContext context, Permission permission) {
        final var permissionId = permission.id();
        final var userId = context.userId();

        return roleGrants(context.roles()).flatMap(grants -> {
            if (!matcher.matchesAny(grants, permissionId)) {
                return Uni.createFrom()
                        .item(PermissionEvaluation.denied(permissionId, userId, PermissionEvaluation.ROLE_DENIED));
            }
            return Uni.combine()
                    .all()
                    .unis(catalog.findAllPolicies(), resourceOf(context))
                    .asTuple()
                    .map(tuple -> {
                        final var resource = tuple.getItem2();
                        final var matched = new ArrayList<String>();
                        final var denyingPolicy = evaluatePolicies(tuple.getItem1(), context, permissionId, resource,
                                matched);
                        if (denyingPolicy.isPresent()) {
                            return PermissionEvaluation.denied(
                                    permissionId,
                                    userId,
                                    PermissionEvaluation.POLICY_DENIED_PREFIX + denyingPolicy.get(),
                                    matched);
                        }

                        final var failed = conditions.firstFailing(permission.conditions(), context, resource);
                        if (failed.isPresent()) {
                            return PermissionEvaluation.denied(
                                    permissionId,
                                    userId,
                                    PermissionEvaluation.CONDITION_FAILED_PREFIX + failed.get().type(),
                                    matched);
                        }

                        if (context.resourceId() != null
                                && context.resourceType() != null
                                && !resourceAllows(resource, userId, context.action())) {
                            return PermissionEvaluation.denied(
                                    permissionId, userId, PermissionEvaluation.RESOURCE_DENIED, matched);
                        }

                        return PermissionEvaluation.granted(permissionId, userId, matched);
                    });
        });
    }

    /**
     * Walk the rules of active policies covering {@code permissionId}, highest
     * policy priority first and deny before allow at equal priority. A deny rule
     * whose conditions all hold denies; allow rules never stop the walk, so a
     * lower priority deny still revokes what a higher priority allow granted.
     *
     * @param matched receives the id of every policy covering the permission, in evaluation order
     * @return the id of the policy whose deny rule applied, if any
     */
    private Optional<String> evaluatePolicies(
            List<Policy> policies,
            PermissionContext context,
            String permissionId,
            Optional<ResourcePermission> resource,
            List<String> matched) {
        final var candidates = new ArrayList<PolicyCandidate>();
        policies.stream()
                .filter(Policy::active)
                .sorted(Comparator.comparingInt(Policy::priority).reversed().thenComparing(Policy::id))
                .forEach(policy -> {
                    var covered = false;
                    for (PolicyRule rule : policy.rules()) {
                        if (matcher.matchesAny(rule.permissionPatterns(), permissionId)) {
                            candidates.add(new PolicyCandidate(policy, rule));
                            covered = true;
                        }
                    }
                    if (covered) {
                        matched.add(policy.id());
                    }
                });
        candidates.sort(Comparator.comparing((PolicyCandidate c) -> c.policy().priority(), Comparator.reverseOrder())
                .thenComparingInt(c -> c.rule().effect() == PermissionEffect.DENY ? 0 : 1));

        for (PolicyCandidate candidate : candidates) {
            if (candidate.rule().effect() == PermissionEffect.DENY
                    && conditions.allHold(candidate.rule().conditions(), context, resource)) {
                return Optional.of(candidate.policy().id());
            }
        }
        return Optional.empty();
    }

    private record PolicyCandidate(Policy policy, PolicyRule rule) {}

    private static boolean resourceAllows(Optional<ResourcePermission> resource, String userId, String action) {
        if (resource.isEmpty()) {
            return true;
        }
        final var acl = resource.get();
        if (userId.equals(acl.ownerId()) || acl.isPublic()) {
            return true;
        }
        final var level = acl.accessFor(userId);
        if (level.isPresent()) {
            return level.get().allows(action);
        }
        return acl.sharedWith().contains(userId);
    }

    /**
     * Evaluate every catalog permission relevant to the context's action and
     * resource type; granted if any of them is.
     */
    public Uni<PermissionEvaluation> checkActionPermission(PermissionContext context) {
        return catalog.findAllPermissions()
                .map(all -> all.stream()
                        .filter(p -> isRelevant(p, context.action(), context.resourceType()))
                        .map(Permission::id)
                        .sorted()
                        .toList())
                .flatMap(relevant -> Multi.createFrom()
                        .iterable(relevant)
                        .onItem()
                        .transformToUniAndConcatenate(id -> evaluate(context, id))
                        .collect()
                        .asList())
                .map(results -> results.stream()
                        .filter(PermissionEvaluation::granted)
                        .findFirst()
                        .orElseGet(() -> PermissionEvaluation.denied(
                                context.action(), context.userId(), PermissionEvaluation.NO_MATCHING_PERMISSION)));
    }

    private boolean isRelevant(Permission permission, String action, ResourceType resourceType) {
        if (permission.action() != null && action != null && matcher.matches(permission.action(), action)) {
            return true;
        }
        if (resourceType != null && permission.resourceType() == resourceType) {
            return true;
        }
        return "*".equals(permission.action()) || permission.id().endsWith(":*");
    }

    /**
     * Union of the permissions granted to {@code roles}, optionally limited to one
     * resource type, plus every permission implied through the hierarchy.
     */
    public Uni<Set<String>> getUserPermissions(Set<String> roles, ResourceType resourceType) {
        return roleGrants(roles)
                .flatMap(grants -> {
                    if (resourceType == null) {
                        return Uni.createFrom().item(grants);
                    }
                    return catalog.findAllPermissions().map(all -> {
                        final var filtered = new HashSet<String>();
                        for (String grant : grants) {
                            final var known = all.stream()
                                    .filter(p -> p.id().equals(grant))
                                    .findFirst();
                            if (known.isEmpty()
                                    || known.get().resourceType() == null
                                    || known.get().resourceType() == resourceType) {
                                filtered.add(grant);
                            }
                        }
                        return (Set<String>) filtered;
                    });
                })
                .flatMap(this::withImplied);
    }

    private Uni<Set<String>> withImplied(Set<String> base) {
        return Multi.createFrom()
                .iterable(base)
                .onItem()
                .transformToUniAndConcatenate(catalog::findImplied)
                .collect()
                .asList()
                .map(implied -> {
                    final var result = new HashSet<>(base);
                    implied.forEach(result::addAll);
                    return (Set<String>) result;
                });
    }

    private Uni<Set<String>> roleGrants(Set<String> roles) {
        return Multi.createFrom()
                .iterable(roles)
                .onItem()
                .transformToUniAndConcatenate(catalog::findRolePermissions)
                .collect()
                .asList()
                .map(grantSets -> {
                    final var grants = new HashSet<String>();
                    grantSets.forEach(grants::addAll);
                    return grants;
                });
    }

    private Uni<Optional<ResourcePermission>> resourceOf(PermissionContext context) {
        if (context.resourceId() == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        return catalog.findResource(context.resourceId());
    }

    // Catalog mutations

    public Uni<Permission> createPermission(Permission permission) {
        return catalog.savePermission(permission)
                .invoke(() -> LOG.infof("Permission created: %s", permission.id()))
                .replaceWith(permission);
    }

    /**
     * Store a policy. Rules are validated when they are built, so a policy
     * always has an allow/deny effect and at least one pattern per rule.
     *
     * @throws ValidationException if the policy has no rules
     */
    public Uni<Policy> createPolicy(Policy policy) {
        if (policy.rules().isEmpty()) {
            return Uni.createFrom().failure(new ValidationException("Policy must have at least one rule"));
        }
        return catalog.savePolicy(policy)
                .invoke(() -> {
                    cache.invalidateAll();
                    LOG.infof("Policy created: %s (priority %d)", policy.id(), policy.priority());
                })
                .replaceWith(policy);
    }

    public Uni<Boolean> deletePolicy(String policyId) {
        return catalog.deletePolicy(policyId).invoke(removed -> {
            if (removed) {
                cache.invalidateAll();
                LOG.infof("Policy deleted: %s", policyId);
            }
        });
    }

    public Uni<Boolean> assignPermissionToRole(String roleId, String permissionIdOrPattern) {
        return catalog.grantToRole(roleId, permissionIdOrPattern).invoke(added -> {
            clearRoleCache(roleId);
            if (added) {
                LOG.infof("Permission %s assigned to role %s", permissionIdOrPattern, roleId);
            }
        });
    }

    public Uni<Boolean> revokePermissionFromRole(String roleId, String permissionIdOrPattern) {
        return catalog.revokeFromRole(roleId, permissionIdOrPattern).invoke(removed -> {
            clearRoleCache(roleId);
            if (removed) {
                LOG.infof("Permission %s revoked from role %s", permissionIdOrPattern, roleId);
            }
        });
    }

    /**
     * Record that {@code parentId} implies {@code childId}.
     */
    public Uni<Void> addPermissionHierarchy(String parentId, String childId) {
        return catalog.addImplication(parentId, childId)
                .invoke(() -> LOG.debugf("Permission %s now implies %s", parentId, childId));
    }

    public Uni<ResourcePermission> setResourcePermission(ResourcePermission resource) {
        return catalog.saveResource(resource)
                .invoke(() -> clearResourceCache(resource.resourceId()))
                .replaceWith(resource);
    }

    /**
     * Grant {@code userId} an explicit access level on a registered resource.
     *
     * @return the updated ACL, or empty if the resource is not registered
     */
    public Uni<Optional<ResourcePermission>> grantResourceAccess(String resourceId, String userId, AccessLevel level) {
        return catalog.findResource(resourceId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<ResourcePermission>empty());
            }
            final var updated = found.get().withAccess(userId, level);
            return setResourcePermission(updated)
                    .invoke(() -> LOG.infof("Granted %s on %s to %s", level, resourceId, userId))
                    .map(Optional::of);
        });
    }

    public Uni<Optional<ResourcePermission>> revokeResourceAccess(String resourceId, String userId) {
        return catalog.findResource(resourceId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<ResourcePermission>empty());
            }
            final var updated = found.get().withoutAccess(userId);
            return setResourcePermission(updated)
                    .invoke(() -> LOG.infof("Revoked access on %s from %s", resourceId, userId))
                    .map(Optional::of);
        });
    }

    /**
     * Drop cached evaluations of contexts carrying {@code roleId}.
     */
    public int clearRoleCache(String roleId) {
        return cache.invalidateIf((key, value) -> key.roles().contains(roleId));
    }

    /**
     * Drop cached evaluations of {@code userId}.
     */
    public int clearUserCache(String userId) {
        return cache.invalidateIf((key, value) -> userId.equals(key.userId()));
    }

    /**
     * Drop cached evaluations targeting {@code resourceId}.
     */
    public int clearResourceCache(String resourceId) {
        return cache.invalidateIf((key, value) -> resourceId.equals(key.resourceId()));
    }

    public void clearCache() {
        cache.invalidateAll();
        LOG.info("Permission evaluation cache cleared");
    }

    /**
     * Drop expired entries from the evaluation cache.
     */
    public void sweepCache() {
        cache.cleanUp();
        LOG.debugf("Permission cache size after cleanup: %d", cache.estimatedSize());
    }
}
