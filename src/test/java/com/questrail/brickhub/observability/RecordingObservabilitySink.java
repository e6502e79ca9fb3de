package com.questrail.brickhub.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements HubObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onPeripheralAttached(PeripheralEvent event) {
        events.add(new Attached(event));
    }

    @Override
    public synchronized void onPeripheralDetached(PeripheralEvent event) {
        events.add(new Detached(event));
    }

    @Override
    public synchronized void onDeviceError(DeviceErrorEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(HubErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<PeripheralEvent> getAttached() {
        return events.stream()
            .filter(e -> e instanceof Attached)
            .map(e -> ((Attached) e).event())
            .collect(Collectors.toList());
    }

    public synchronized List<PeripheralEvent> getDetached() {
        return events.stream()
            .filter(e -> e instanceof Detached)
            .map(e -> ((Detached) e).event())
            .collect(Collectors.toList());
    }

    public synchronized List<DeviceErrorEvent> getDeviceErrors() {
        return events.stream()
            .filter(e -> e instanceof DeviceErrorEvent)
            .map(e -> (DeviceErrorEvent) e)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }

    private record Attached(PeripheralEvent event) {}

    private record Detached(PeripheralEvent event) {}
}
