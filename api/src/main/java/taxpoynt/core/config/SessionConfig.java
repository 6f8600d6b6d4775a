package taxpoynt.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for session management and risk scoring.
 *
 * <p>Configuration prefix: {@code taxpoynt.session}
 */
@ConfigMapping(prefix = "taxpoynt.session")
public interface SessionConfig {

    /**
     * Idle timeout of the {@code standard} policy.
     */
    @WithDefault("PT30M")
    Duration defaultIdleTimeout();

    /**
     * Absolute timeout of the {@code standard} policy.
     */
    @WithDefault("PT8H")
    Duration defaultSessionTimeout();

    /**
     * Concurrent session cap of the {@code standard} policy.
     */
    @WithDefault("5")
    int maxConcurrentSessions();

    /**
     * When disabled every session starts with a risk score of 0.
     */
    @WithDefault("true")
    boolean enableRiskAssessment();

    /**
     * Policy applied when a request names none.
     */
    @WithDefault("standard")
    String defaultPolicy();

    /**
     * IPs rejected at session creation and scored as suspicious.
     */
    Optional<List<String>> suspiciousIps();

    /**
     * Case-insensitive user-agent substrings rejected at session creation.
     */
    Optional<List<String>> blockedUserAgents();

    /**
     * Maximum activity entries kept per session before trimming.
     */
    @WithDefault("1000")
    int maxActivitiesPerSession();

    /**
     * How long activity entries are kept.
     */
    @WithDefault("P30D")
    Duration activityRetention();

    /**
     * Risk scoring weights and thresholds.
     */
    RiskConfig risk();

    interface RiskConfig {

        /**
         * CIDR ranges treated as trusted networks.
         */
        @WithDefault("10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,127.0.0.0/8")
        List<String> trustedNetworks();

        @WithDefault("0.5")
        double suspiciousIpWeight();

        @WithDefault("0.2")
        double untrustedNetworkWeight();

        @WithDefault("0.3")
        double untrustedDeviceWeight();

        @WithDefault("0.2")
        double unknownDeviceWeight();

        @WithDefault("0.4")
        double botUserAgentWeight();

        @WithDefault("0.1")
        double offHoursWeight();

        /**
         * Hour (UTC) before which requests are off-hours.
         */
        @WithDefault("6")
        int offHoursStart();

        /**
         * Hour (UTC) after which requests are off-hours.
         */
        @WithDefault("22")
        int offHoursEnd();

        @WithDefault("bot,crawler,spider,scraper")
        List<String> botUserAgentMarkers();

        /**
         * Added to the risk score when a session's IP changes.
         */
        @WithDefault("0.3")
        double ipChangeIncrement();

        /**
         * Added on top of the IP change increment when the new IP is suspicious.
         */
        @WithDefault("0.5")
        double suspiciousIpChangeIncrement();

        /**
         * Score above which a session is flagged {@code high_risk}.
         */
        @WithDefault("0.8")
        double highRiskThreshold();

        /**
         * Subtracted from the risk score on successful MFA.
         */
        @WithDefault("0.3")
        double mfaDecrement();
    }
}
