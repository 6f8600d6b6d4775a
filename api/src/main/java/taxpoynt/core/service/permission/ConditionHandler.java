package taxpoynt.core.service.permission;

import java.util.Map;

import taxpoynt.core.model.permission.PermissionContext;

/**
 * Evaluates a named custom condition.
 *
 * <p>Implementations are discovered as CDI beans and dispatched by {@link #name()}.
 */
public interface ConditionHandler {

    String name();

    /**
     * @return true if the condition holds for {@code context}
     */
    boolean holds(PermissionContext context, Map<String, Object> parameters);
}
