package com.questrail.brickhub.observability;

/**
 * Main interface for receiving hub observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the notification delivery context and must not block.</p>
 */
public interface HubObservabilitySink
{
    /**
     * Called after a peripheral has been inserted into the peripheral set.
     * @param event the attached peripheral
     */
    void onPeripheralAttached(PeripheralEvent event);

    /**
     * Called after a peripheral has been removed from the peripheral set.
     * @param event the detached peripheral
     */
    void onPeripheralDetached(PeripheralEvent event);

    /**
     * Called when the hub reports a failed command.
     * @param event the device-reported error
     */
    void onDeviceError(DeviceErrorEvent event);

    /**
     * Called when the driver detects a protocol defect it cannot recover from.
     * @param event the error event
     */
    void onError(HubErrorEvent event);
}
