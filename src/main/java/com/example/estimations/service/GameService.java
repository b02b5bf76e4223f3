package com.example.estimations.service;

import com.example.estimations.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Entry point for the web layer: resolves games through the {@link GameDirectory}, forwards
 * intents to the owning {@link GameServer} and waits for the reply.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    static final int MAX_NAME_LENGTH = 80;

    private static final SecureRandom RANDOM = new SecureRandom();

    private static final List<String> ADJECTIVES = List.of(
            "swift", "clever", "brave", "bright", "calm", "cool", "eager", "fast", "gentle", "happy",
            "jolly", "kind", "lively", "merry", "nice", "proud", "quick", "sharp", "smart", "sunny", "wise");

    private static final List<String> NOUNS = List.of(
            "falcon", "tiger", "eagle", "lion", "wolf", "bear", "hawk", "phoenix", "dragon", "turtle",
            "panda", "koala", "otter", "fox", "deer", "rabbit", "heron", "crane", "raven", "owl");

    private final GameDirectory directory;
    private final GameEventBroadcaster broadcaster;

    public GameService(GameDirectory directory, GameEventBroadcaster broadcaster) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
    }

    // ========================================================================
    //  GAME LIFECYCLE
    // ========================================================================

    /** Creates a game and returns its id. A blank name is replaced by a generated one. */
    public String createGame(String name, DeckType deckType) {
        String gameName = (name == null || name.isBlank()) ? generateGameName() : name.trim();
        DeckType deck = (deckType == null) ? DeckType.FIBONACCI : deckType;
        return directory.create(gameName, deck).getId();
    }

    public Outcome<Game> getGame(String gameId) {
        return ask(gameId, GameServer::getGame);
    }

    public boolean gameExists(String gameId) {
        return directory.exists(gameId);
    }

    public boolean stopGame(String gameId) {
        return directory.stop(gameId);
    }

    public int gameCount() {
        return directory.count();
    }

    // ========================================================================
    //  PARTICIPATION
    // ========================================================================

    public Outcome<Game> joinGame(String gameId, String participantId, String name, Role role, Integer avatarId) {
        Objects.requireNonNull(participantId, "participantId");
        String display = normalizeName(name);
        Role r = (role == null) ? Role.VOTER : role;
        return ask(gameId, s -> s.join(participantId, display, r, avatarId));
    }

    public Outcome<List<Integer>> availableAvatars(String gameId) {
        return ask(gameId, GameServer::availableAvatars);
    }

    public Outcome<Game> leaveGame(String gameId, String participantId) {
        return ask(gameId, s -> s.leave(participantId));
    }

    public Outcome<Game> setParticipantConnected(String gameId, String participantId, boolean connected) {
        return ask(gameId, s -> s.setConnected(participantId, connected));
    }

    public Outcome<Game> toggleRole(String gameId, String participantId) {
        return ask(gameId, s -> s.toggleRole(participantId));
    }

    // ========================================================================
    //  VOTING
    // ========================================================================

    public Outcome<Game> castVote(String gameId, String participantId, String card) {
        return ask(gameId, s -> s.vote(participantId, card));
    }

    public Outcome<Game> revealVotes(String gameId) {
        return ask(gameId, GameServer::reveal);
    }

    public Outcome<Game> resetRound(String gameId) {
        return ask(gameId, GameServer::reset);
    }

    public Outcome<Game> setStoryName(String gameId, String storyName) {
        return ask(gameId, s -> s.setStoryName(storyName));
    }

    public Outcome<VoteStatistics> statistics(String gameId) {
        return ask(gameId, GameServer::statistics);
    }

    // ========================================================================
    //  EVENTS
    // ========================================================================

    public GameEventBroadcaster.Subscription subscribe(String gameId, Consumer<GameEvent> listener) {
        return broadcaster.subscribe(gameId, listener);
    }

    public void unsubscribe(String gameId, Consumer<GameEvent> listener) {
        broadcaster.unsubscribe(gameId, listener);
    }

    // ========================================================================
    //  DECKS / AVATARS / IDS
    // ========================================================================

    public List<DeckType> deckTypes() {
        return List.of(DeckType.values());
    }

    public List<Avatars.Avatar> avatars() {
        return Avatars.all();
    }

    public Optional<String> avatarUrl(Integer avatarId) {
        return Avatars.url(avatarId);
    }

    /** 16 random bytes, URL-safe Base64 without padding. */
    public String generateParticipantId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    // ========================================================================
    //  HELPERS
    // ========================================================================

    private <T> Outcome<T> ask(String gameId, Function<GameServer, CompletableFuture<Outcome<T>>> request) {
        Optional<GameServer> server = directory.lookup(gameId);
        if (server.isEmpty()) {
            log.debug("Game {} not found", gameId);
            return Outcome.failure(GameError.NOT_FOUND);
        }
        try {
            return request.apply(server.get()).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof GameServerException gse) throw gse;
            throw e;
        }
    }

    static String normalizeName(String s) {
        String t = (s == null) ? "" : s.trim();
        if (t.isEmpty()) t = "Guest";
        if (t.length() > MAX_NAME_LENGTH) t = t.substring(0, MAX_NAME_LENGTH);
        return t;
    }

    static String generateGameName() {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        String adjective = ADJECTIVES.get(rnd.nextInt(ADJECTIVES.size()));
        String noun = NOUNS.get(rnd.nextInt(NOUNS.size()));
        int number = 1 + rnd.nextInt(99);
        return capitalize(adjective) + " " + capitalize(noun) + " " + number;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
