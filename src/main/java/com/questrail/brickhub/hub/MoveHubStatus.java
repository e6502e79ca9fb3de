package com.questrail.brickhub.hub;

/**
 * Snapshot of the diagnostic properties read when a {@link MoveHub} starts.
 *
 * @param name advertised name
 * @param macAddress primary MAC address as contiguous hex
 * @param batteryPercent battery level in percent
 * @param lowVoltage whether the low-voltage alert is raised
 */
public record MoveHubStatus(
        String name,
        String macAddress,
        int batteryPercent,
        boolean lowVoltage
) {
}
