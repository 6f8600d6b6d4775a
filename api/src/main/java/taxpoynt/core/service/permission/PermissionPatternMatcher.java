package taxpoynt.core.service.permission;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Matches permission ids against shell-style patterns.
 *
 * <p>{@code *} matches any run of characters including the {@code :}
 * separator, so {@code si:*} covers {@code si:invoice:create}. {@code ?}
 * matches exactly one character. Every other character is literal.
 * Compiled patterns are cached.
 */
@ApplicationScoped
public class PermissionPatternMatcher {

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public boolean matches(String pattern, String permissionId) {
        if (pattern == null || permissionId == null) {
            return false;
        }
        if (!isPattern(pattern)) {
            return pattern.equals(permissionId);
        }
        return compiled.computeIfAbsent(pattern, PermissionPatternMatcher::compile)
                .matcher(permissionId)
                .matches();
    }

    /**
     * True if any of {@code patterns} matches {@code permissionId}.
     */
    public boolean matchesAny(Collection<String> patterns, String permissionId) {
        for (String pattern : patterns) {
            if (matches(pattern, permissionId)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isPattern(String value) {
        return value.indexOf('*') >= 0 || value.indexOf('?') >= 0;
    }

    private static Pattern compile(String glob) {
        final var regex = new StringBuilder(glob.length() + 8);
        final var literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
