package de.t14d3.clientdb.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Delivers cache events synchronously to listeners in registration order.
 *
 * A failing listener is logged and does not keep the others from being called.
 */
public final class NotificationBus {
    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    private final List<ObjListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ObjListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ObjListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    public void publish(ObjEvent event) {
        for (ObjListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.error("Listener {} failed on {} {}:{}", listener, event.type().wireName(),
                        event.collection(), event.id(), e);
            }
        }
    }
}
