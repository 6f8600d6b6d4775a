package taxpoynt.core.service.session;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import taxpoynt.core.config.SessionConfig;
import taxpoynt.core.model.session.Device;
import taxpoynt.core.model.session.DeviceType;
import taxpoynt.core.util.NetworkMatcher;

/**
 * Additive session risk model.
 *
 * <p>Each signal contributes a configured weight; the sum is clamped to
 * [0, 1]. With risk assessment disabled every score is 0.
 */
@ApplicationScoped
public class RiskEngine {

    private final SessionConfig.RiskConfig weights;
    private final boolean enabled;
    private final NetworkMatcher networkMatcher = new NetworkMatcher();

    /**
     * Inputs to a risk score.
     *
     * @param ipAddress client IP (nullable)
     * @param suspiciousIp whether the IP is on the suspicious list
     * @param device the client device, or null when none was presented
     * @param userAgent client user agent (nullable)
     * @param timestamp when the request was made
     */
    public record Signals(String ipAddress, boolean suspiciousIp, Device device, String userAgent, Instant timestamp) {}

    @Inject
    public RiskEngine(SessionConfig config) {
        this(config.risk(), config.enableRiskAssessment());
    }

    public RiskEngine(SessionConfig.RiskConfig weights, boolean enabled) {
        this.weights = weights;
        this.enabled = enabled;
    }

    public double score(Signals signals) {
        if (!enabled) {
            return 0.0;
        }
        var score = 0.0;

        if (signals.ipAddress() != null && !signals.ipAddress().isBlank()) {
            if (signals.suspiciousIp()) {
                score += weights.suspiciousIpWeight();
            } else if (!networkMatcher.matchesAny(signals.ipAddress(), weights.trustedNetworks())) {
                score += weights.untrustedNetworkWeight();
            }
        }

        final var device = signals.device();
        if (device != null) {
            if (!device.trusted()) {
                score += weights.untrustedDeviceWeight();
            }
            if (device.type() == DeviceType.UNKNOWN) {
                score += weights.unknownDeviceWeight();
            }
        }

        if (isBotLike(signals.userAgent())) {
            score += weights.botUserAgentWeight();
        }

        if (signals.timestamp() != null && isOffHours(signals.timestamp())) {
            score += weights.offHoursWeight();
        }

        return clamp(score);
    }

    /**
     * Amount added to a session's score when its client IP changes.
     */
    public double ipChangeIncrement(boolean newIpSuspicious) {
        if (!enabled) {
            return 0.0;
        }
        return weights.ipChangeIncrement() + (newIpSuspicious ? weights.suspiciousIpChangeIncrement() : 0.0);
    }

    public boolean isHighRisk(double score) {
        return score > weights.highRiskThreshold();
    }

    /**
     * Score after a successful second-factor verification.
     */
    public double afterMfa(double score) {
        return clamp(score - weights.mfaDecrement());
    }

    public static double clamp(double score) {
        if (Double.isNaN(score) || score < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, score);
    }

    private boolean isBotLike(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return false;
        }
        final var normalized = userAgent.toLowerCase(Locale.ROOT);
        return weights.botUserAgentMarkers().stream()
                .anyMatch(marker -> normalized.contains(marker.toLowerCase(Locale.ROOT)));
    }

    private boolean isOffHours(Instant timestamp) {
        final var hour = timestamp.atZone(ZoneOffset.UTC).getHour();
        return hour < weights.offHoursStart() || hour > weights.offHoursEnd();
    }
}
