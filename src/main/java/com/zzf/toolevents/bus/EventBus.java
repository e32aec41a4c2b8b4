package com.zzf.toolevents.bus;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-process publish/subscribe keyed by event type. Subscribers registered
 * under {@link #WILDCARD} see every delivery.
 */
@Slf4j
public class EventBus {
    public static final String WILDCARD = "*";

    private final Map<String, List<Subscription>> subscriptions = new ConcurrentHashMap<>();

    @Data
    @AllArgsConstructor
    public static class Delivery {
        private String type;
        private Object payload;
    }

    public interface Subscription extends Consumer<Delivery> {}

    /**
     * Delivers to the type's subscribers, then to wildcard subscribers. Every
     * subscriber is called even if an earlier one throws; the first failure
     * (with later ones suppressed) fails the returned future.
     */
    public CompletableFuture<Void> publish(String type, Object payload) {
        Delivery delivery = new Delivery(type, payload);
        Throwable firstError = null;

        for (String key : Arrays.asList(type, WILDCARD)) {
            List<Subscription> subs = subscriptions.getOrDefault(key, Collections.emptyList());
            for (Subscription sub : snapshot(subs)) {
                try {
                    sub.accept(delivery);
                } catch (Throwable t) {
                    log.warn("bus.subscriber.fail type={} err={}", type, t.toString());
                    if (firstError == null) {
                        firstError = t;
                    } else {
                        firstError.addSuppressed(t);
                    }
                }
            }
        }

        if (firstError != null) {
            return CompletableFuture.failedFuture(firstError);
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * @return a handle that removes the subscription
     */
    public Runnable subscribe(String type, Subscription callback) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is blank");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback is null");
        }
        subscriptions.computeIfAbsent(type, k -> Collections.synchronizedList(new ArrayList<>())).add(callback);
        return () -> unsubscribe(type, callback);
    }

    public Runnable subscribeAll(Subscription callback) {
        return subscribe(WILDCARD, callback);
    }

    /**
     * Keeps the subscription until {@code callback} returns true for a delivery.
     */
    public void once(String type, Predicate<Delivery> callback) {
        final Runnable[] unsubscribe = {null};
        unsubscribe[0] = subscribe(type, delivery -> {
            if (callback.test(delivery)) {
                if (unsubscribe[0] != null) unsubscribe[0].run();
            }
        });
    }

    private void unsubscribe(String type, Subscription callback) {
        List<Subscription> subs = subscriptions.get(type);
        if (subs != null) {
            subs.remove(callback);
        }
    }

    private static List<Subscription> snapshot(List<Subscription> subs) {
        synchronized (subs) {
            return new ArrayList<>(subs);
        }
    }
}
