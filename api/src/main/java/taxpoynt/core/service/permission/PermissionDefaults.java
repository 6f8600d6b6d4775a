package taxpoynt.core.service.permission;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import taxpoynt.core.model.permission.Permission;
import taxpoynt.core.model.permission.PermissionEffect;
import taxpoynt.core.model.permission.PermissionType;
import taxpoynt.core.model.permission.Policy;
import taxpoynt.core.model.permission.PolicyCondition;
import taxpoynt.core.model.permission.PolicyRule;
import taxpoynt.core.model.permission.ResourceType;

/**
 * Built-in permission catalog: the platform's system-integrator, access-point,
 * platform and tenant permissions and the policies guarding them.
 */
public final class PermissionDefaults {

    public static final String SI_ACCESS_POLICY = "si_access_policy";
    public static final String APP_ACCESS_POLICY = "app_access_policy";
    public static final String TENANT_ISOLATION_POLICY = "tenant_isolation_policy";
    public static final String TIME_BASED_POLICY = "time_based_policy";

    private PermissionDefaults() {}

    public static List<Permission> permissions(Instant now) {
        return List.of(
                permission("si:invoice:create", "Create Invoice (SI)", "Create invoices through SI services",
                        ResourceType.INVOICE, "create", now),
                permission("si:certificate:manage", "Manage Certificates (SI)", "Manage digital certificates",
                        ResourceType.CERTIFICATE, "manage", now),
                permission("si:erp:integrate", "ERP Integration", "Integrate with ERP systems", null, "integrate", now),
                permission("app:transmission:manage", "Manage Transmission (APP)", "Manage secure transmission", null,
                        "transmit", now),
                permission("app:validation:perform", "Perform Validation (APP)", "Perform data validation", null,
                        "validate", now),
                permission("app:crypto:manage", "Manage Cryptography (APP)", "Manage cryptographic operations", null,
                        "crypto_manage", now),
                permission("platform:users:manage", "Manage Users", "Manage platform users", ResourceType.USER,
                        "manage", now),
                permission("platform:tenants:manage", "Manage Tenants", "Manage platform tenants",
                        ResourceType.TENANT, "manage", now),
                permission("platform:config:manage", "Manage Configuration", "Manage platform configuration",
                        ResourceType.CONFIGURATION, "manage", now),
                permission("platform:secrets:manage", "Manage Secrets", "Manage platform secrets",
                        ResourceType.SECRET, "manage", now),
                permission("tenant:invoices:view", "View Invoices", "View tenant invoices", ResourceType.INVOICE,
                        "view", now),
                permission("tenant:profile:manage", "Manage Profile", "Manage user profile", ResourceType.USER,
                        "profile_manage", now));
    }

    public static List<Policy> policies(Instant now) {
        return List.of(
                new Policy(
                        SI_ACCESS_POLICY,
                        "SI Access Policy",
                        "Policy for SI service access",
                        List.of(new PolicyRule(
                                PermissionEffect.ALLOW,
                                List.of("si:*"),
                                List.of(new PolicyCondition.RoleCondition(
                                        Set.of("system_integrator", "hybrid", "platform_admin"))))),
                        100,
                        true,
                        now),
                new Policy(
                        APP_ACCESS_POLICY,
                        "APP Access Policy",
                        "Policy for APP service access",
                        List.of(new PolicyRule(
                                PermissionEffect.ALLOW,
                                List.of("app:*"),
                                List.of(new PolicyCondition.RoleCondition(
                                        Set.of("access_point_provider", "hybrid", "platform_admin"))))),
                        100,
                        true,
                        now),
                new Policy(
                        TENANT_ISOLATION_POLICY,
                        "Tenant Isolation Policy",
                        "Ensure tenant data isolation",
                        List.of(new PolicyRule(
                                PermissionEffect.DENY,
                                List.of("tenant:*"),
                                List.of(new PolicyCondition.TenantMismatchCondition()))),
                        200,
                        true,
                        now),
                new Policy(
                        TIME_BASED_POLICY,
                        "Time-based Access Policy",
                        "Restrict platform management outside business hours",
                        List.of(new PolicyRule(
                                PermissionEffect.DENY,
                                List.of("platform:*"),
                                List.of(new PolicyCondition.TimeRestrictionCondition(
                                        LocalTime.of(22, 0), LocalTime.of(6, 0), Set.of("platform_admin"))))),
                        150,
                        true,
                        now));
    }

    private static Permission permission(
            String id, String name, String description, ResourceType resourceType, String action, Instant now) {
        return new Permission(
                id, name, description, PermissionType.ACTION, resourceType, action, PermissionEffect.ALLOW, null, null,
                now);
    }
}
