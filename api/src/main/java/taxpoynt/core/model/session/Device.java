package taxpoynt.core.model.session;

import java.time.Instant;

/**
 * A registered client fingerprint for a user.
 *
 * <p>Sessions reference devices by id only; a device outlives the sessions opened from it.
 *
 * @param deviceId device identifier
 * @param userId owning user
 * @param type device type
 * @param name display name (nullable)
 * @param operatingSystem reported OS (nullable)
 * @param browser reported browser (nullable)
 * @param trusted whether the user has marked the device as trusted
 * @param firstSeen first time the device was seen
 * @param lastSeen most recent time the device was seen
 */
public record Device(
        String deviceId,
        String userId,
        DeviceType type,
        String name,
        String operatingSystem,
        String browser,
        boolean trusted,
        Instant firstSeen,
        Instant lastSeen) {

    public Device {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be null or blank");
        }
        if (type == null) {
            type = DeviceType.UNKNOWN;
        }
        if (firstSeen == null) {
            firstSeen = Instant.now();
        }
        if (lastSeen == null) {
            lastSeen = firstSeen;
        }
    }

    public static Device unregistered(String deviceId, String userId, DeviceType type, Instant now) {
        return new Device(deviceId, userId, type, null, null, null, false, now, now);
    }

    public Device seenAt(Instant at) {
        return new Device(deviceId, userId, type, name, operatingSystem, browser, trusted, firstSeen, at);
    }

    public Device withTrusted(boolean trusted) {
        return new Device(deviceId, userId, type, name, operatingSystem, browser, trusted, firstSeen, lastSeen);
    }
}
