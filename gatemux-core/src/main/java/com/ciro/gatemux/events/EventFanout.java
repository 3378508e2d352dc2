package com.ciro.gatemux.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pub/sub por tópico, en memoria y síncrono.
 *
 * <p>Cada publicación llega a los suscriptores registrados en ese momento. Sin suscriptores
 * el evento se descarta. Un suscriptor que lanza no afecta a los demás.
 */
public class EventFanout {

    private static final Logger log = LoggerFactory.getLogger(EventFanout.class);

    private final Map<String, CopyOnWriteArrayList<Subscriber>> topics = new ConcurrentHashMap<>();

    public Subscription subscribe(String topic, Subscriber subscriber) {
        topics.compute(topic, (_k, list) -> {
            if (list == null) list = new CopyOnWriteArrayList<>();
            list.addIfAbsent(subscriber);
            return list;
        });
        return new Handle(topic, subscriber);
    }

    public boolean unsubscribe(String topic, Subscriber subscriber) {
        AtomicBoolean removed = new AtomicBoolean(false);
        topics.computeIfPresent(topic, (_k, list) -> {
            removed.set(list.remove(subscriber));
            return list.isEmpty() ? null : list;
        });
        return removed.get();
    }

    public int publish(GatewayEvent event) {
        return publish(event.topic(), event);
    }

    /** @return cuántos suscriptores recibieron el evento sin error */
    public int publish(String topic, GatewayEvent event) {
        List<Subscriber> subs = topics.get(topic);
        if (subs == null || subs.isEmpty()) {
            log.trace("No subscribers for {}, dropping {}", topic, event.name());
            return 0;
        }

        int delivered = 0;
        for (Subscriber s : subs) {
            try {
                s.deliver(event);
                delivered++;
            } catch (RuntimeException e) {
                log.warn("Subscriber on {} failed handling {}", topic, event.name(), e);
            }
        }
        return delivered;
    }

    public int subscriberCount(String topic) {
        List<Subscriber> subs = topics.get(topic);
        return subs == null ? 0 : subs.size();
    }

    private final class Handle implements Subscription {
        private final String topic;
        private final Subscriber subscriber;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Handle(String topic, Subscriber subscriber) {
            this.topic = topic;
            this.subscriber = subscriber;
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (active.compareAndSet(true, false)) {
                unsubscribe(topic, subscriber);
            }
        }
    }
}
