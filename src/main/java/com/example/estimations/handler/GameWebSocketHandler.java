package com.example.estimations.handler;

import com.example.estimations.controller.GameController;
import com.example.estimations.model.*;
import com.example.estimations.service.GameEventBroadcaster;
import com.example.estimations.service.GameService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket adapter for /gameSocket?gameId=..&participantId=..
 * - Subscribes the socket to its game's events and forwards them as JSON frames
 * - Marks the participant connected on open and disconnected on close
 * - Commands: join:&lt;role&gt;:&lt;avatarId|-&gt;:&lt;name&gt;, vote:&lt;card&gt;, reveal, reset,
 *   story:&lt;label&gt;, toggleRole, leave, requestSync, ping
 * - Rejected intents come back as a non-fatal "notice"; an unknown game as "notFound"
 */
@Component
public class GameWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(GameWebSocketHandler.class);

    static final CloseStatus GAME_NOT_FOUND = new CloseStatus(4004, "Game not found");

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 256 * 1024;

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    /** Per WebSocket session → (game, participant, outbound session, subscription) */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public GameWebSocketHandler(GameService gameService, ObjectMapper objectMapper) {
        this.gameService = gameService;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        Map<String, String> q = parseQuery(session.getUri());
        final String gameId        = q.getOrDefault("gameId", "").trim();
        final String participantId = q.getOrDefault("participantId", "anon-" + session.getId()).trim();

        log.info("WS OPEN game={} participant={}", gameId, participantId);

        WebSocketSession out = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
        if (!gameService.gameExists(gameId)) {
            log.info("WS REJECT game={} not found", gameId);
            sendNotFoundAndClose(out);
            return;
        }

        Conn c = new Conn(gameId, participantId, out);
        c.subscription = gameService.subscribe(gameId, event -> forward(c, event));
        bySession.put(session.getId(), c);

        Outcome<Game> r = gameService.setParticipantConnected(gameId, participantId, true);
        if (!r.isOk()) {
            handleFailure(c, r.getError());
            return;
        }
        sendState(c, r.getValue());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={} payload={}", session.getId(), message.getPayload());
            return;
        }

        final String gameId  = c.gameId;
        final String pid     = c.participantId;
        final String payload = message.getPayload();

        // Heartbeat
        if ("ping".equals(payload)) {
            send(c, "pong");
            return;
        }

        // Join: "join:<voter|spectator>:<avatarId|->:<urlEncodedName>"
        if (payload.startsWith("join:")) {
            String[] parts = payload.split(":", 4);
            if (parts.length < 4) {
                log.debug("Malformed join from {}: {}", pid, payload);
                return;
            }
            Role role = Role.parse(parts[1]);
            Integer avatarId = parseAvatar(parts[2]);
            String name = decode(parts[3]);
            Outcome<Game> r = gameService.joinGame(gameId, pid, name, role, avatarId);
            if (r.isOk()) sendState(c, r.getValue());
            else handleFailure(c, r.getError());
            return;
        }

        // Vote: "vote:<card>"
        if (payload.startsWith("vote:")) {
            String card = decode(payload.substring("vote:".length()));
            reply(c, gameService.castVote(gameId, pid, card));
            return;
        }

        // Story: "story:<urlEncodedLabel>" (empty clears)
        if (payload.startsWith("story:")) {
            String label = decode(payload.substring("story:".length()));
            reply(c, gameService.setStoryName(gameId, label));
            return;
        }

        switch (payload) {
            case "reveal"     -> reply(c, gameService.revealVotes(gameId));
            case "reset"      -> reply(c, gameService.resetRound(gameId));
            case "toggleRole" -> reply(c, gameService.toggleRole(gameId, pid));
            case "leave"      -> reply(c, gameService.leaveGame(gameId, pid));
            case "requestSync" -> {
                Outcome<Game> r = gameService.getGame(gameId);
                if (r.isOk()) sendState(c, r.getValue());
                else handleFailure(c, r.getError());
            }
            default -> log.debug("Ignored message: {}", payload);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} : transport error", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Conn c = bySession.remove(session.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE game={} participant={} code={} reason={}",
                c.gameId, c.participantId, status.getCode(), status.getReason());

        if (c.subscription != null) c.subscription.close();
        // the game may already be gone; NOT_FOUND is fine here
        gameService.setParticipantConnected(c.gameId, c.participantId, false);
    }

    /* ---------------- outbound ---------------- */

    private void reply(Conn c, Outcome<Game> r) {
        if (!r.isOk()) handleFailure(c, r.getError());
    }

    private void handleFailure(Conn c, GameError error) {
        if (error == GameError.NOT_FOUND) {
            bySession.values().remove(c);
            if (c.subscription != null) c.subscription.close();
            sendNotFoundAndClose(c.out);
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "notice");
        payload.put("error", error.name());
        sendJson(c, payload);
    }

    private void sendState(Conn c, Game game) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "state");
        payload.put("you", c.participantId);
        payload.put("game", GameController.GameView.from(game));
        sendJson(c, payload);
    }

    /** Event → JSON frame. Observers re-fetch with requestSync when they need more. */
    void forward(Conn c, GameEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", "event");
        payload.put("event", event.type().name());
        payload.put("gameId", event.gameId());
        payload.put("occurredAt", event.occurredAt().toString());
        if (event.participantId() != null) payload.put("participantId", event.participantId());
        if (event.participant() != null) payload.put("participant", GameController.ParticipantView.from(event.participant(), false));
        if (event.game() != null) payload.put("game", GameController.GameView.from(event.game()));
        if (event.type() == GameEvent.Type.STORY_CHANGED) payload.put("storyName", event.storyName());
        sendJson(c, payload);
    }

    private void sendJson(Conn c, Map<String, Object> payload) {
        try {
            send(c, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            log.error("WS frame serialization failed (game={}, type={})", c.gameId, payload.get("type"), e);
        }
    }

    private void send(Conn c, String text) {
        try {
            if (c.out.isOpen()) c.out.sendMessage(new TextMessage(text));
        } catch (IOException | RuntimeException e) {
            log.warn("WS send failed (game={}, participant={}): {}", c.gameId, c.participantId, e.toString());
        }
    }

    private void sendNotFoundAndClose(WebSocketSession out) {
        try {
            if (out.isOpen()) out.sendMessage(new TextMessage("{\"type\":\"notFound\",\"redirect\":\"/\"}"));
        } catch (IOException e) {
            log.debug("WS notFound frame not delivered: {}", e.toString());
        }
        try {
            out.close(GAME_NOT_FOUND);
        } catch (IOException e) {
            log.debug("WS close after notFound failed: {}", e.toString());
        }
    }

    /* ---------------- helpers ---------------- */

    private static Map<String, String> parseQuery(URI uri) {
        return parseQuery(uri == null ? null : uri.getRawQuery());
    }

    /** Bad escapes are kept verbatim rather than failing the handshake. */
    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> map = new HashMap<>();
        if (rawQuery == null) return map;
        for (String kv : rawQuery.split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                map.put(decode(kv.substring(0, i)), decode(kv.substring(i + 1)));
            }
        }
        return map;
    }

    private static String decode(String s) {
        try { return URLDecoder.decode(s, StandardCharsets.UTF_8); }
        catch (IllegalArgumentException e) { return s; }
    }

    private static Integer parseAvatar(String s) {
        if (s == null || s.isBlank() || "-".equals(s.trim())) return null;
        try { return Integer.valueOf(s.trim()); }
        catch (NumberFormatException e) { return -1; } // never valid → AVATAR_UNAVAILABLE
    }

    int connectionCount() {
        return bySession.size();
    }

    /** Connection state for one socket. */
    static final class Conn {
        final String gameId;
        final String participantId;
        final WebSocketSession out;
        volatile GameEventBroadcaster.Subscription subscription;

        Conn(String gameId, String participantId, WebSocketSession out) {
            this.gameId = Objects.requireNonNull(gameId, "gameId");
            this.participantId = Objects.requireNonNull(participantId, "participantId");
            this.out = Objects.requireNonNull(out, "out");
        }
    }
}
