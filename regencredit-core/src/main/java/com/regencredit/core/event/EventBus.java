package com.regencredit.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous event bus connecting the protocol components.
 * Handlers run on the publishing thread, in subscription order, before
 * {@link #publish(ProtocolEvent)} returns. A failing handler fails the publishing call.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends ProtocolEvent>, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final CopyOnWriteArrayList<Subscription> wildcardSubscriptions;
    private final Map<String, Subscription> subscriptionById;

    public EventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.wildcardSubscriptions = new CopyOnWriteArrayList<>();
        this.subscriptionById = new ConcurrentHashMap<>();
    }

    /**
     * Delivers an event to the handlers of its type, then to the wildcard handlers.
     */
    public void publish(ProtocolEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        log.debug("Publishing {}", event);

        List<Subscription> subs = subscriptions.get(event.getClass());
        if (subs != null) {
            for (Subscription sub : subs) {
                sub.handler().accept(event);
            }
        }
        for (Subscription sub : wildcardSubscriptions) {
            sub.handler().accept(event);
        }
    }

    /**
     * Subscribes to events of one type.
     *
     * @return subscription id
     */
    public <E extends ProtocolEvent> String subscribe(Class<E> eventType, Consumer<? super E> handler) {
        Objects.requireNonNull(eventType, "Event type cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");

        Subscription subscription = new Subscription(UUID.randomUUID().toString(), eventType,
                event -> handler.accept(eventType.cast(event)));
        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscription.id(), subscription);
        return subscription.id();
    }

    /**
     * Subscribes to every event.
     */
    public String subscribeAll(Consumer<ProtocolEvent> handler) {
        Objects.requireNonNull(handler, "Handler cannot be null");
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), null, handler);
        wildcardSubscriptions.add(subscription);
        subscriptionById.put(subscription.id(), subscription);
        return subscription.id();
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription == null) {
            return;
        }
        if (subscription.eventType() == null) {
            wildcardSubscriptions.remove(subscription);
            return;
        }
        List<Subscription> subs = subscriptions.get(subscription.eventType());
        if (subs != null) {
            subs.remove(subscription);
        }
    }

    public int getSubscriberCount(Class<? extends ProtocolEvent> eventType) {
        List<Subscription> subs = subscriptions.get(eventType);
        return subs != null ? subs.size() : 0;
    }

    private record Subscription(
            String id,
            Class<? extends ProtocolEvent> eventType,
            Consumer<ProtocolEvent> handler
    ) {}
}
