package com.example.estimations.service;

import com.example.estimations.model.GameEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Topic-per-game publish/subscribe. Events of one game are delivered to its current
 * subscribers in publish order, off the publishing thread. There is no replay: a
 * subscriber that joins late or reconnects has to fetch a fresh snapshot.
 */
public class GameEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(GameEventBroadcaster.class);

    private final Executor deliveryPool;
    private final Map<String, Topic> topics = new ConcurrentHashMap<>();

    public GameEventBroadcaster(Executor deliveryPool) {
        this.deliveryPool = Objects.requireNonNull(deliveryPool, "deliveryPool");
    }

    /** Handle returned by {@link #subscribe}; closing it unsubscribes. */
    public interface Subscription extends AutoCloseable {
        String gameId();

        @Override
        void close();
    }

    public static String topic(String gameId) {
        return "game:" + gameId;
    }

    public Subscription subscribe(String gameId, Consumer<GameEvent> listener) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(listener, "listener");
        topics.compute(gameId, (id, t) -> {
            Topic target = (t != null) ? t : new Topic(new SerialExecutor(deliveryPool, topic(id)));
            target.listeners.add(listener);
            return target;
        });
        log.debug("Subscribed to {} ({} listener(s))", topic(gameId), subscriberCount(gameId));
        return new Subscription() {
            @Override public String gameId() { return gameId; }
            @Override public void close() { unsubscribe(gameId, listener); }
        };
    }

    public void unsubscribe(String gameId, Consumer<GameEvent> listener) {
        if (gameId == null || listener == null) return;
        topics.computeIfPresent(gameId, (id, t) -> {
            t.listeners.remove(listener);
            return t.listeners.isEmpty() ? null : t;
        });
    }

    /** Queues the event for every listener subscribed right now. */
    public void publish(GameEvent event) {
        Topic t = topics.get(event.gameId());
        if (t == null) return;
        List<Consumer<GameEvent>> targets = List.copyOf(t.listeners);
        if (targets.isEmpty()) return;

        t.delivery.execute(() -> {
            for (Consumer<GameEvent> l : targets) {
                try {
                    l.accept(event);
                } catch (RuntimeException e) {
                    log.warn("Listener on {} failed for {}: {}", topic(event.gameId()), event.type(), e.toString());
                }
            }
        });
    }

    /** Drops all subscribers of a game that no longer exists. */
    public void closeTopic(String gameId) {
        Topic t = topics.remove(gameId);
        if (t != null) {
            log.debug("Closed {} ({} listener(s) dropped)", topic(gameId), t.listeners.size());
        }
    }

    public int subscriberCount(String gameId) {
        Topic t = topics.get(gameId);
        return (t == null) ? 0 : t.listeners.size();
    }

    private static final class Topic {
        final List<Consumer<GameEvent>> listeners = new CopyOnWriteArrayList<>();
        final SerialExecutor delivery;

        Topic(SerialExecutor delivery) {
            this.delivery = delivery;
        }
    }
}
