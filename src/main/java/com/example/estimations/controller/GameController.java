package com.example.estimations.controller;

import com.example.estimations.model.*;
import com.example.estimations.service.GameService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.*;

@RestController
@RequestMapping("/api")
public class GameController {

  private final GameService gameService;

  public GameController(GameService gameService) {
    this.gameService = gameService;
  }

  // --- Create --------------------------------------------------------------

  @PostMapping("/games")
  public ResponseEntity<CreatedView> create(@RequestBody(required = false) CreateRequest body) {
    String name = (body == null ? null : body.name);
    DeckType deck = DeckType.fromId(body == null ? null : body.deck);
    String id = gameService.createGame(name, deck);
    return ResponseEntity.created(URI.create("/api/games/" + id)).body(new CreatedView(id));
  }

  // --- Exists / Get --------------------------------------------------------

  @GetMapping("/games/{id}/exists")
  public ResponseEntity<ExistsView> exists(@PathVariable String id) {
    return ResponseEntity.ok(new ExistsView(gameService.gameExists(id)));
  }

  @GetMapping("/games/{id}")
  public ResponseEntity<?> get(@PathVariable String id) {
    Outcome<Game> r = gameService.getGame(id);
    if (!r.isOk()) return notFound(id);
    return ResponseEntity.ok(GameView.from(r.getValue()));
  }

  @GetMapping("/games/{id}/avatars")
  public ResponseEntity<?> avatars(@PathVariable String id) {
    Outcome<List<Integer>> r = gameService.availableAvatars(id);
    if (!r.isOk()) return notFound(id);
    return ResponseEntity.ok(new AvatarsView(r.getValue()));
  }

  // --- Stop ----------------------------------------------------------------

  @DeleteMapping("/games/{id}")
  public ResponseEntity<?> stop(@PathVariable String id) {
    if (!gameService.stopGame(id)) return notFound(id);
    return ResponseEntity.noContent().build();
  }

  // --- Decks ---------------------------------------------------------------

  @GetMapping("/decks")
  public List<DeckView> decks() {
    List<DeckView> out = new ArrayList<>();
    for (DeckType d : gameService.deckTypes()) out.add(DeckView.from(d));
    return out;
  }

  private static ResponseEntity<ErrorView> notFound(String id) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorView("Game not found: " + id));
  }

  // ===== DTOs (Views/Requests) ============================================

  /** POST body */
  public static final class CreateRequest {
    public String name;
    public String deck;
  }

  public static final class CreatedView {
    public String id;
    public CreatedView(String id) { this.id = id; }
  }

  public static final class ExistsView {
    public boolean exists;
    public ExistsView(boolean exists) { this.exists = exists; }
  }

  public static final class AvatarsView {
    public List<Integer> available;
    public AvatarsView(List<Integer> available) { this.available = available; }
  }

  public static final class DeckView {
    public String id;
    public String displayName;
    public List<String> cards;

    public static DeckView from(DeckType d) {
      DeckView v = new DeckView();
      v.id = d.id();
      v.displayName = d.displayName();
      v.cards = d.cards();
      return v;
    }
  }

  /** Game snapshot. Votes and statistics stay hidden until the cards are revealed. */
  public static final class GameView {
    public String id;
    public String name;
    public String deck;
    public List<String> cards;
    public String roundState;
    public String storyName;
    public String createdAt;
    public boolean allVotersVoted;
    public boolean anyVotes;
    public List<ParticipantView> participants;
    public StatisticsView statistics;

    public static GameView from(Game g) {
      Objects.requireNonNull(g, "g");
      GameView v = new GameView();
      v.id = g.getId();
      v.name = g.getName();
      v.deck = g.getDeckType().id();
      v.cards = g.getDeckType().cards();
      v.roundState = g.getRoundState().name().toLowerCase(Locale.ROOT);
      v.storyName = g.getStoryName();
      v.createdAt = g.getCreatedAt().toString();
      v.allVotersVoted = g.allVotersVoted();
      v.anyVotes = g.anyVotes();

      List<ParticipantView> ps = new ArrayList<>();
      for (Participant p : g.getParticipants().values()) ps.add(ParticipantView.from(p, g.isRevealed()));
      v.participants = ps;

      v.statistics = g.isRevealed() ? StatisticsView.from(g.statistics()) : null;
      return v;
    }
  }

  public static final class ParticipantView {
    public String id;
    public String name;
    public String initial;
    public String role;
    public boolean voted;
    public String vote;
    public Integer avatarId;
    public String avatarUrl;
    public boolean connected;

    public static ParticipantView from(Participant p, boolean revealed) {
      ParticipantView v = new ParticipantView();
      v.id = p.getId();
      v.name = p.getName();
      v.initial = p.initial();
      v.role = p.getRole().name().toLowerCase(Locale.ROOT);
      v.voted = p.hasVoted();
      v.vote = revealed ? p.getVote() : null;
      v.avatarId = p.getAvatarId();
      v.avatarUrl = Avatars.url(p.getAvatarId()).orElse(null);
      v.connected = p.isConnected();
      return v;
    }
  }

  public static final class StatisticsView {
    public Double average;
    public Map<String, Integer> distribution;

    public static StatisticsView from(VoteStatistics s) {
      StatisticsView v = new StatisticsView();
      v.average = s.average().isPresent() ? s.average().getAsDouble() : null;
      v.distribution = s.distribution();
      return v;
    }
  }

  public static final class ErrorView {
    public boolean ok = false;
    public String message;
    public ErrorView(String message) {
      this.message = (message == null ? "Internal error" : message);
    }
  }
}
