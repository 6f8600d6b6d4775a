package taxpoynt.core.util;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches IP address literals against exact addresses and CIDR ranges.
 *
 * <p>Only IP literals are parsed; host names never trigger a DNS lookup and
 * never match.
 */
public final class NetworkMatcher {

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6_LITERAL = Pattern.compile("^[0-9a-fA-F:.]*:[0-9a-fA-F:.]*$");

    private final Map<String, Optional<ParsedCidr>> cidrCache = new ConcurrentHashMap<>();
    private final Map<String, Optional<byte[]>> addressCache = new ConcurrentHashMap<>();

    private record ParsedCidr(byte[] networkBytes, int prefixLength) {}

    /**
     * True if {@code ip} equals one of {@code patterns} or falls inside one of its CIDR ranges.
     */
    public boolean matchesAny(String ip, Collection<String> patterns) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        for (String pattern : patterns) {
            if (pattern.contains("/") ? inCidr(ip, pattern) : pattern.equals(ip)) {
                return true;
            }
        }
        return false;
    }

    private boolean inCidr(String ip, String cidr) {
        final var parsed = cidrCache.computeIfAbsent(cidr, NetworkMatcher::parseCidr);
        final var source = addressCache.computeIfAbsent(ip, NetworkMatcher::parseAddress);
        if (parsed.isEmpty() || source.isEmpty()) {
            return false;
        }

        final var networkBytes = parsed.get().networkBytes();
        final var sourceBytes = source.get();
        final var prefixLength = parsed.get().prefixLength();
        if (networkBytes.length != sourceBytes.length || prefixLength > networkBytes.length * 8) {
            return false;
        }

        final var fullBytes = prefixLength / 8;
        final var remainingBits = prefixLength % 8;
        for (var i = 0; i < fullBytes; i++) {
            if (networkBytes[i] != sourceBytes[i]) {
                return false;
            }
        }
        if (remainingBits > 0) {
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (networkBytes[fullBytes] & mask) == (sourceBytes[fullBytes] & mask);
        }
        return true;
    }

    private static Optional<ParsedCidr> parseCidr(String cidr) {
        final var parts = cidr.split("/");
        if (parts.length != 2) {
            return Optional.empty();
        }
        try {
            final var network = parseAddress(parts[0]);
            final var prefixLength = Integer.parseInt(parts[1]);
            if (network.isEmpty() || prefixLength < 0) {
                return Optional.empty();
            }
            return Optional.of(new ParsedCidr(network.get(), prefixLength));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<byte[]> parseAddress(String address) {
        if (!IPV4_LITERAL.matcher(address).matches() && !IPV6_LITERAL.matcher(address).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(InetAddress.getByName(address).getAddress());
        } catch (UnknownHostException e) {
            return Optional.empty();
        }
    }
}
