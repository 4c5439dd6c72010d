package com.cellblock.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes runtime notifications to whoever owns the connection they came from.
 * <p>
 * A {@link com.cellblock.runtime.RuntimeConnection} publishes under its runtime identity and its
 * owner subscribes to that identity; monitors such as the CLI watch subscribe to every runtime.
 * Delivery happens on the publishing thread, which is usually a connection's reader, so
 * subscribers must return quickly.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<CellblockEvent>>> byRuntime =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<CellblockEvent>> watchers = new CopyOnWriteArrayList<>();

    public void publish(CellblockEvent event) {
        List<Consumer<CellblockEvent>> owners = byRuntime.get(event.runtimeId());
        log.debug("{} from runtime {} ({} owner subscribers, {} watchers)", event.eventType(), event.runtimeId(),
                owners == null ? 0 : owners.size(), watchers.size());
        if (owners != null) {
            owners.forEach(subscriber -> deliver(subscriber, event));
        }
        watchers.forEach(subscriber -> deliver(subscriber, event));
    }

    /**
     * Receives the notifications of one runtime identity. The registration is dropped
     * together with the last subscriber of that identity.
     */
    public Subscription subscribe(String runtimeId, Consumer<CellblockEvent> consumer) {
        byRuntime.computeIfAbsent(runtimeId, id -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> byRuntime.computeIfPresent(runtimeId, (id, subscribers) -> {
            subscribers.remove(consumer);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    /**
     * Receives the notifications of every runtime.
     */
    public Subscription subscribeAll(Consumer<CellblockEvent> consumer) {
        watchers.add(consumer);
        return () -> watchers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliver(Consumer<CellblockEvent> subscriber, CellblockEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} of runtime {}", event.eventType(), event.runtimeId(), e);
        }
    }
}
