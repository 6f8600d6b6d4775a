package taxpoynt.core.service.role;

import java.util.List;
import java.util.Set;

import taxpoynt.core.model.role.Role;
import taxpoynt.core.model.role.RoleScope;

/**
 * Built-in roles.
 */
public final class RoleDefaults {

    public static final String SYSTEM_INTEGRATOR = "system_integrator";
    public static final String ACCESS_POINT_PROVIDER = "access_point_provider";
    public static final String HYBRID = "hybrid";
    public static final String PLATFORM_ADMIN = "platform_admin";
    public static final String TENANT_ADMIN = "tenant_admin";
    public static final String USER = "user";

    private RoleDefaults() {}

    public static List<Role> roles() {
        return List.of(
                Role.system(SYSTEM_INTEGRATOR, "System Integrator", RoleScope.GLOBAL, Set.of("si:*")),
                Role.system(ACCESS_POINT_PROVIDER, "Access Point Provider", RoleScope.GLOBAL, Set.of("app:*")),
                Role.system(HYBRID, "Hybrid Integrator", RoleScope.GLOBAL, Set.of("si:*", "app:*")),
                Role.system(PLATFORM_ADMIN, "Platform Administrator", RoleScope.GLOBAL, Set.of("*")),
                Role.system(TENANT_ADMIN, "Tenant Administrator", RoleScope.TENANT, Set.of("tenant:*")),
                Role.system(USER, "User", RoleScope.TENANT, Set.of("tenant:invoices:view")));
    }
}
