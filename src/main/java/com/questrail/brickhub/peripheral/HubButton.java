package com.questrail.brickhub.peripheral;

import com.questrail.brickhub.hub.Hub;
import com.questrail.brickhub.protocol.model.HubProperties;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The hub's own push button.
 *
 * <p>
 * The button has no port. Its state arrives as {@link HubProperties#BUTTON}
 * property updates, which the hub only sends while updates are enabled; they
 * are enabled with the first subscriber and disabled with the last.
 * </p>
 */
public final class HubButton
{
    private final Hub hub;
    private final List<Consumer<Boolean>> subscribers = new CopyOnWriteArrayList<>();

    private volatile boolean pressed;

    public HubButton(Hub hub) {
        this.hub = Objects.requireNonNull(hub, "hub");
        hub.addMessageHandler(HubProperties.class, this::handlePropertyUpdate);
    }

    public boolean isPressed() {
        return pressed;
    }

    /**
     * Registers a callback receiving {@code true} on press and {@code false} on release.
     */
    public synchronized void subscribe(Consumer<Boolean> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        boolean first = subscribers.isEmpty();
        subscribers.add(subscriber);
        if (first) {
            hub.send(new HubProperties(HubProperties.BUTTON, HubProperties.ENABLE_UPDATES, new byte[0]));
        }
    }

    public synchronized void unsubscribe(Consumer<Boolean> subscriber) {
        if (subscribers.remove(subscriber) && subscribers.isEmpty()) {
            hub.send(new HubProperties(HubProperties.BUTTON, HubProperties.DISABLE_UPDATES, new byte[0]));
        }
    }

    private void handlePropertyUpdate(HubProperties message) {
        if (message.property() != HubProperties.BUTTON
                || message.operation() != HubProperties.UPSTREAM_UPDATE) {
            return;
        }
        byte[] parameters = message.parameters();
        if (parameters.length == 0) {
            return;
        }
        pressed = parameters[0] != 0;
        for (Consumer<Boolean> subscriber : subscribers) {
            subscriber.accept(pressed);
        }
    }
}
