package com.questrail.brickhub.observability;

/**
 * No-op implementation of HubObservabilitySink.
 */
public final class NullObservabilitySink implements HubObservabilitySink
{
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPeripheralAttached(PeripheralEvent event) {}

    @Override
    public void onPeripheralDetached(PeripheralEvent event) {}

    @Override
    public void onDeviceError(DeviceErrorEvent event) {}

    @Override
    public void onError(HubErrorEvent event) {}
}
