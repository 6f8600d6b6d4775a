package taxpoynt.core.service.session;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import taxpoynt.core.config.SessionConfig;
import taxpoynt.core.util.NetworkMatcher;

/**
 * Suspicious IPs and blocked user-agent markers consulted at session creation.
 *
 * <p>Seeded from configuration; entries can be added at runtime.
 */
@ApplicationScoped
public class SecurityWatchlist {

    private static final Logger LOG = Logger.getLogger(SecurityWatchlist.class);

    private final Set<String> suspiciousIps = ConcurrentHashMap.newKeySet();
    private final Set<String> blockedUserAgents = ConcurrentHashMap.newKeySet();
    private final NetworkMatcher networkMatcher = new NetworkMatcher();

    @Inject
    public SecurityWatchlist(SessionConfig config) {
        this(config.suspiciousIps().orElse(List.of()), config.blockedUserAgents().orElse(List.of()));
    }

    public SecurityWatchlist(List<String> suspiciousIps, List<String> blockedUserAgents) {
        suspiciousIps.forEach(this::addSuspiciousIp);
        blockedUserAgents.forEach(this::blockUserAgent);
    }

    /**
     * Add an IP or CIDR range to the suspicious list.
     */
    public void addSuspiciousIp(String ipOrRange) {
        if (ipOrRange != null && !ipOrRange.isBlank()) {
            suspiciousIps.add(ipOrRange.trim());
            LOG.infof("Suspicious IP registered: %s", ipOrRange);
        }
    }

    public void blockUserAgent(String marker) {
        if (marker != null && !marker.isBlank()) {
            blockedUserAgents.add(marker.trim().toLowerCase(Locale.ROOT));
        }
    }

    public boolean isSuspicious(String ip) {
        return networkMatcher.matchesAny(ip, suspiciousIps);
    }

    /**
     * True if {@code ip} is suspicious or falls in one of {@code extraRanges}.
     */
    public boolean isBlockedIp(String ip, List<String> extraRanges) {
        return isSuspicious(ip) || networkMatcher.matchesAny(ip, extraRanges);
    }

    /**
     * True if the user agent contains a blocked marker from this list or from
     * {@code extraMarkers}, case-insensitively.
     */
    public boolean isBlockedUserAgent(String userAgent, List<String> extraMarkers) {
        if (userAgent == null || userAgent.isBlank()) {
            return false;
        }
        final var normalized = userAgent.toLowerCase(Locale.ROOT);
        for (String marker : blockedUserAgents) {
            if (normalized.contains(marker)) {
                return true;
            }
        }
        for (String marker : extraMarkers) {
            if (!marker.isBlank() && normalized.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
