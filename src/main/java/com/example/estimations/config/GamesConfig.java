package com.example.estimations.config;

import com.example.estimations.service.GameDirectory;
import com.example.estimations.service.GameEventBroadcaster;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Wires the in-memory game engine: worker pools, broadcaster and directory. */
@Configuration
@EnableConfigurationProperties(GamesProperties.class)
public class GamesConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs game mailboxes. Many games share these threads; none holds one while idle. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gameWorkers(GamesProperties props) {
        return Executors.newFixedThreadPool(props.workerThreads(), daemonThreads("game-worker"));
    }

    /** Delivers events to subscribers so slow sockets never stall a game. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService gameEventDelivery() {
        return Executors.newCachedThreadPool(daemonThreads("game-events"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService gameReaper() {
        return Executors.newSingleThreadScheduledExecutor(daemonThreads("game-reaper"));
    }

    @Bean
    public GameEventBroadcaster gameEventBroadcaster(@Qualifier("gameEventDelivery") ExecutorService delivery) {
        return new GameEventBroadcaster(delivery);
    }

    @Bean(destroyMethod = "shutdown")
    public GameDirectory gameDirectory(@Qualifier("gameWorkers") ExecutorService workers,
                                       @Qualifier("gameReaper") ScheduledExecutorService reaper,
                                       GameEventBroadcaster broadcaster,
                                       Clock clock,
                                       GamesProperties props) {
        return new GameDirectory(workers, reaper, broadcaster, clock, props);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
