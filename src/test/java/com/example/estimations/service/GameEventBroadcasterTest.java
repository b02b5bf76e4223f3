package com.example.estimations.service;

import com.example.estimations.model.GameEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class GameEventBroadcasterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private GameEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        // deliver on the publishing thread
        broadcaster = new GameEventBroadcaster(Runnable::run);
    }

    @Test
    void deliversToSubscribersOfTheSameGameOnly() {
        List<GameEvent> a = new ArrayList<>();
        List<GameEvent> b = new ArrayList<>();
        broadcaster.subscribe("g1", a::add);
        broadcaster.subscribe("g2", b::add);

        broadcaster.publish(GameEvent.voteCast("g1", "p1", T0));

        assertEquals(1, a.size());
        assertEquals(GameEvent.Type.VOTE_CAST, a.get(0).type());
        assertTrue(b.isEmpty());
    }

    @Test
    void closingSubscription_stopsDelivery() {
        List<GameEvent> seen = new ArrayList<>();
        GameEventBroadcaster.Subscription sub = broadcaster.subscribe("g1", seen::add);
        assertEquals("g1", sub.gameId());
        assertEquals(1, broadcaster.subscriberCount("g1"));

        sub.close();
        broadcaster.publish(GameEvent.voteCast("g1", "p1", T0));

        assertTrue(seen.isEmpty());
        assertEquals(0, broadcaster.subscriberCount("g1"));
    }

    @Test
    void failingListener_doesNotBlockOthers() {
        List<GameEvent> seen = new ArrayList<>();
        broadcaster.subscribe("g1", e -> { throw new IllegalStateException("socket gone"); });
        broadcaster.subscribe("g1", seen::add);

        broadcaster.publish(GameEvent.participantLeft("g1", "p1", T0));

        assertEquals(1, seen.size());
    }

    @Test
    void closeTopic_dropsAllSubscribers() {
        List<GameEvent> seen = new ArrayList<>();
        broadcaster.subscribe("g1", seen::add);
        broadcaster.closeTopic("g1");

        broadcaster.publish(GameEvent.voteCast("g1", "p1", T0));

        assertTrue(seen.isEmpty());
        assertEquals(0, broadcaster.subscriberCount("g1"));
    }

    @Test
    void publishWithoutSubscribers_isNoOp() {
        assertDoesNotThrow(() -> broadcaster.publish(GameEvent.voteCast("nobody", "p1", T0)));
    }

    @Test
    void eventsOfOneGame_arriveInPublishOrder_onRealPool() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            GameEventBroadcaster b = new GameEventBroadcaster(pool);
            List<String> seen = new ArrayList<>();
            Object lock = new Object();
            Consumer<GameEvent> listener = e -> {
                synchronized (lock) {
                    seen.add(e.participantId());
                }
            };
            b.subscribe("g1", listener);

            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String pid = "p" + i;
                expected.add(pid);
                b.publish(GameEvent.voteCast("g1", pid, T0));
            }

            long deadline = System.currentTimeMillis() + 5_000;
            while (System.currentTimeMillis() < deadline) {
                synchronized (lock) {
                    if (seen.size() == expected.size()) break;
                }
                Thread.sleep(10);
            }
            synchronized (lock) {
                assertEquals(expected, seen);
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void topicName() {
        assertEquals("game:abc123", GameEventBroadcaster.topic("abc123"));
    }
}
