package com.example.estimations.service;

import com.example.estimations.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Owns exactly one {@link Game}. Every request is queued on the server's mailbox and runs
 * alone, in arrival order; the reply comes back through a {@link CompletableFuture}.
 * Accepted changes are stored first and then published as one {@link GameEvent}.
 *
 * <p>Once terminated (idle, stopped, crashed) the server answers every request, including
 * those already queued, with {@link GameError#NOT_FOUND}. A worker pool that refuses the
 * mailbox stops the server the same way.
 */
public class GameServer {

    private static final Logger log = LoggerFactory.getLogger(GameServer.class);

    public enum Status { ACTIVE, TERMINATED }

    public enum TerminationReason { IDLE, STOPPED, CRASHED }

    /** Notified synchronously when the server terminates. */
    @FunctionalInterface
    public interface TerminationListener {
        void onTerminated(GameServer server, TerminationReason reason);
    }

    private final String id;
    private final String name;
    private final DeckType deckType;
    private final SerialExecutor mailbox;
    private final GameEventBroadcaster broadcaster;
    private final Clock clock;
    private final Duration emptyGameTimeout;
    private final TerminationListener terminationListener;

    private final AtomicReference<Status> status = new AtomicReference<>(Status.ACTIVE);
    private volatile ScheduledFuture<?> idleCheck;

    // --- confined to the mailbox ---
    private Game game;
    private Instant emptySince;

    public GameServer(String id, String name, DeckType deckType,
                      Executor workers, GameEventBroadcaster broadcaster, Clock clock,
                      Duration emptyGameTimeout, TerminationListener terminationListener) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.deckType = Objects.requireNonNull(deckType, "deckType");
        this.mailbox = new SerialExecutor(workers, "game-" + id);
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.emptyGameTimeout = Objects.requireNonNull(emptyGameTimeout, "emptyGameTimeout");
        this.terminationListener = (terminationListener != null) ? terminationListener : (s, r) -> { };

        this.game = Game.create(id, name, deckType, clock.instant());
        this.emptySince = game.getCreatedAt();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public DeckType getDeckType() { return deckType; }
    public Status getStatus() { return status.get(); }
    public boolean isActive() { return status.get() == Status.ACTIVE; }

    // ========================================================================
    //  READS
    // ========================================================================

    public CompletableFuture<Outcome<Game>> getGame() {
        return call("get", () -> Outcome.ok(game));
    }

    /** Pool minus avatars in use, as seen when this request reaches the mailbox. */
    public CompletableFuture<Outcome<List<Integer>>> availableAvatars() {
        return call("availableAvatars", () -> Outcome.ok(game.availableAvatars()));
    }

    public CompletableFuture<Outcome<VoteStatistics>> statistics() {
        return call("statistics", () -> Outcome.ok(game.statistics()));
    }

    // ========================================================================
    //  ROSTER
    // ========================================================================

    /**
     * Checks the avatar and adds the participant in one mailbox turn, so two joins can
     * never both claim the same avatar. Re-joining with one's own avatar is allowed.
     */
    public CompletableFuture<Outcome<Game>> join(String participantId, String participantName,
                                                 Role role, Integer avatarId) {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(participantName, "participantName");
        Objects.requireNonNull(role, "role");
        return call("join", () -> {
            if (avatarId != null && !avatarFreeFor(participantId, avatarId)) {
                log.debug("Game {}: avatar {} unavailable for {}", id, avatarId, participantId);
                return Outcome.failure(GameError.AVATAR_UNAVAILABLE);
            }
            Participant p = Participant.create(participantId, participantName, role, clock.instant())
                    .withAvatar(avatarId);
            Game next = game.addParticipant(p);
            Participant stored = next.getParticipant(participantId).orElseThrow();
            commit(next, GameEvent.participantJoined(id, stored, clock.instant()));
            return Outcome.ok(next);
        });
    }

    private boolean avatarFreeFor(String participantId, int avatarId) {
        if (!Avatars.isValid(avatarId)) return false;
        if (!game.getUsedAvatars().contains(avatarId)) return true;
        return game.getParticipant(participantId)
                .map(p -> Objects.equals(p.getAvatarId(), avatarId))
                .orElse(false);
    }

    public CompletableFuture<Outcome<Game>> leave(String participantId) {
        return call("leave", () -> {
            Game next = game.removeParticipant(participantId);
            if (next != game) {
                commit(next, GameEvent.participantLeft(id, participantId, clock.instant()));
            }
            return Outcome.ok(next);
        });
    }

    public CompletableFuture<Outcome<Game>> setConnected(String participantId, boolean connected) {
        return call("setConnected", () -> {
            Game next = game.setConnected(participantId, connected);
            if (next != game) {
                commit(next, GameEvent.connectivityChanged(id, participantId, connected, clock.instant()));
            }
            return Outcome.ok(next);
        });
    }

    public CompletableFuture<Outcome<Game>> toggleRole(String participantId) {
        return call("toggleRole", () -> {
            Game next = game.toggleRole(participantId);
            if (next != game) {
                commit(next, GameEvent.roleToggled(id, participantId, clock.instant()));
            }
            return Outcome.ok(next);
        });
    }

    // ========================================================================
    //  ROUND
    // ========================================================================

    public CompletableFuture<Outcome<Game>> vote(String participantId, String card) {
        return call("vote", () -> {
            Outcome<Game> r = game.castVote(participantId, card);
            if (!r.isOk()) {
                log.debug("Game {}: vote '{}' by {} rejected: {}", id, card, participantId, r.getError());
                return r;
            }
            Game next = r.getValue();
            if (next != game) {
                commit(next, GameEvent.voteCast(id, participantId, clock.instant()));
            }
            return r;
        });
    }

    public CompletableFuture<Outcome<Game>> reveal() {
        return call("reveal", () -> {
            Game next = game.revealVotes();
            if (next != game) {
                commit(next, GameEvent.votesRevealed(next, clock.instant()));
            }
            return Outcome.ok(next);
        });
    }

    public CompletableFuture<Outcome<Game>> reset() {
        return call("reset", () -> {
            Game next = game.resetRound();
            commit(next, GameEvent.roundReset(next, clock.instant()));
            return Outcome.ok(next);
        });
    }

    public CompletableFuture<Outcome<Game>> setStoryName(String storyName) {
        return call("setStoryName", () -> {
            Game next = game.setStoryName(storyName);
            commit(next, GameEvent.storyChanged(id, next.getStoryName(), clock.instant()));
            return Outcome.ok(next);
        });
    }

    // ========================================================================
    //  LIFECYCLE
    // ========================================================================

    /** Starts the recurring idle check. Called once by the directory after registration. */
    void scheduleIdleChecks(ScheduledExecutorService scheduler, Duration interval) {
        long ms = interval.toMillis();
        idleCheck = scheduler.scheduleAtFixedRate(this::checkIdle, ms, ms, TimeUnit.MILLISECONDS);
    }

    /**
     * Queues an idle check. Completes with {@code true} if the roster has been empty for
     * longer than the grace window and the server terminated.
     */
    CompletableFuture<Boolean> checkIdle() {
        CompletableFuture<Boolean> done = new CompletableFuture<>();
        if (!isActive()) {
            done.complete(false);
            return done;
        }
        mailbox.execute(SerialExecutor.droppable(() -> {
            if (!isActive()) {
                done.complete(false);
                return;
            }
            boolean idle = emptySince != null
                    && Duration.between(emptySince, clock.instant()).compareTo(emptyGameTimeout) > 0;
            if (idle) {
                log.info("Game {} empty since {}, shutting down", id, emptySince);
                terminate(TerminationReason.IDLE);
            }
            done.complete(idle);
        }, () -> {
            onWorkersGone();
            done.complete(false);
        }));
        return done;
    }

    /** Terminates immediately; requests still queued are answered with NOT_FOUND. */
    public void stop() {
        terminate(TerminationReason.STOPPED);
    }

    private void terminate(TerminationReason reason) {
        if (!status.compareAndSet(Status.ACTIVE, Status.TERMINATED)) return;
        ScheduledFuture<?> f = idleCheck;
        if (f != null) f.cancel(false);
        log.info("Game {} terminated ({})", id, reason);
        terminationListener.onTerminated(this, reason);
    }

    // ========================================================================
    //  MAILBOX
    // ========================================================================

    /** Runs a request body on the mailbox. Bodies must only touch state through {@link #commit}. */
    <T> CompletableFuture<Outcome<T>> call(String op, Supplier<Outcome<T>> body) {
        CompletableFuture<Outcome<T>> reply = new CompletableFuture<>();
        if (!isActive()) {
            reply.complete(Outcome.failure(GameError.NOT_FOUND));
            return reply;
        }
        mailbox.execute(SerialExecutor.droppable(() -> {
            if (!isActive()) {
                reply.complete(Outcome.failure(GameError.NOT_FOUND));
                return;
            }
            try {
                reply.complete(body.get());
            } catch (RuntimeException e) {
                log.error("Game {} crashed handling '{}'", id, op, e);
                // replacement is registered before the caller sees the failure
                terminate(TerminationReason.CRASHED);
                reply.completeExceptionally(new GameServerException("Game " + id + " crashed handling " + op, e));
            }
        }, () -> {
            onWorkersGone();
            reply.complete(Outcome.failure(GameError.NOT_FOUND));
        }));
        return reply;
    }

    /** The worker pool refused this game's mailbox; nothing queued will ever run. */
    private void onWorkersGone() {
        if (isActive()) log.warn("Game {}: worker pool refused work, stopping", id);
        terminate(TerminationReason.STOPPED);
    }

    private void commit(Game next, GameEvent event) {
        game = next;
        if (next.isEmpty()) {
            if (emptySince == null) emptySince = clock.instant();
        } else {
            emptySince = null;
        }
        broadcaster.publish(event);
    }

    @Override
    public String toString() {
        return "GameServer{" + id + ", " + status.get() + '}';
    }
}
