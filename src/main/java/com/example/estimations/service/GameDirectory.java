package com.example.estimations.service;

import com.example.estimations.config.GamesProperties;
import com.example.estimations.model.DeckType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Registry of live game servers: creates them under fresh ids, resolves ids, and removes
 * them when they terminate. Crashed games are replaced by a fresh server under the same id.
 */
public class GameDirectory {

    private static final Logger log = LoggerFactory.getLogger(GameDirectory.class);

    static final int MAX_ID_ATTEMPTS = 16;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, GameServer> servers = new ConcurrentHashMap<>();

    private final Executor workers;
    private final ScheduledExecutorService scheduler;
    private final GameEventBroadcaster broadcaster;
    private final Clock clock;
    private final GamesProperties props;
    private final Supplier<String> idGenerator;

    public GameDirectory(Executor workers, ScheduledExecutorService scheduler,
                         GameEventBroadcaster broadcaster, Clock clock, GamesProperties props) {
        this(workers, scheduler, broadcaster, clock, props, GameDirectory::randomGameId);
    }

    GameDirectory(Executor workers, ScheduledExecutorService scheduler,
                  GameEventBroadcaster broadcaster, Clock clock, GamesProperties props,
                  Supplier<String> idGenerator) {
        this.workers = Objects.requireNonNull(workers, "workers");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.props = Objects.requireNonNull(props, "props");
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    }

    /** Six lower-case characters from the URL-safe Base64 alphabet (4 random bytes). */
    public static String randomGameId() {
        byte[] bytes = new byte[4];
        RANDOM.nextBytes(bytes);
        String s = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return s.substring(0, 6).toLowerCase(Locale.ROOT);
    }

    // ========================================================================
    //  CREATE / LOOKUP / STOP
    // ========================================================================

    /**
     * Starts a new game under a fresh id. An id that collides with a live game is
     * discarded and a new one drawn; live games are never overwritten.
     */
    public GameServer create(String name, DeckType deckType) {
        for (int attempt = 1; attempt <= MAX_ID_ATTEMPTS; attempt++) {
            String id = idGenerator.get();
            GameServer server = newServer(id, name, deckType);
            if (servers.putIfAbsent(id, server) == null) {
                server.scheduleIdleChecks(scheduler, props.idleCheckInterval());
                log.info("Game {} created name='{}' deck={} (live={})", id, name, deckType.id(), servers.size());
                return server;
            }
            log.debug("Game id {} already live, drawing another (attempt {})", id, attempt);
        }
        throw new IllegalStateException("Could not allocate a free game id after " + MAX_ID_ATTEMPTS + " attempts");
    }

    public Optional<GameServer> lookup(String id) {
        if (id == null) return Optional.empty();
        GameServer s = servers.get(id);
        return (s != null && s.isActive()) ? Optional.of(s) : Optional.empty();
    }

    public boolean exists(String id) {
        return lookup(id).isPresent();
    }

    /** Stops a live game. Returns false if the id is unknown. */
    public boolean stop(String id) {
        GameServer s = (id == null) ? null : servers.get(id);
        if (s == null) return false;
        s.stop();
        return true;
    }

    public int count() {
        return servers.size();
    }

    public Set<String> ids() {
        return Set.copyOf(servers.keySet());
    }

    /** Stops every live game. Bean destroy hook. */
    public void shutdown() {
        log.info("Stopping {} live game(s)", servers.size());
        for (GameServer s : new ArrayList<>(servers.values())) {
            s.stop();
        }
    }

    // ========================================================================
    //  SUPERVISION
    // ========================================================================

    private GameServer newServer(String id, String name, DeckType deckType) {
        return new GameServer(id, name, deckType, workers, broadcaster, clock,
                props.emptyGameTimeout(), this::onTerminated);
    }

    private void onTerminated(GameServer server, GameServer.TerminationReason reason) {
        String id = server.getId();
        servers.remove(id, server);

        if (reason == GameServer.TerminationReason.CRASHED && props.restartCrashedGames()) {
            GameServer fresh = newServer(id, server.getName(), server.getDeckType());
            if (servers.putIfAbsent(id, fresh) == null) {
                fresh.scheduleIdleChecks(scheduler, props.idleCheckInterval());
                log.warn("Game {} crashed, restarted with empty state", id);
                return;
            }
        }
        broadcaster.closeTopic(id);
        log.info("Game {} removed ({}), live={}", id, reason, servers.size());
    }
}
