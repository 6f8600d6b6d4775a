package taxpoynt.core.model.auth;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Uniform result of a dispatched operation: {@code {success, data?, error?}}.
 *
 * @param success whether the operation succeeded
 * @param data result payload (empty on failure)
 * @param error error message (null on success)
 */
public record OperationResult(boolean success, Map<String, Object> data, String error) {

    public OperationResult {
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static OperationResult success(Map<String, Object> data) {
        return new OperationResult(true, data, null);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, Map.of(), error);
    }

    /**
     * Wire representation; {@code data} and {@code error} are omitted when absent.
     */
    public Map<String, Object> toMap() {
        final var map = new LinkedHashMap<String, Object>();
        map.put("success", success);
        if (success) {
            map.put("data", data);
        }
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }
}
