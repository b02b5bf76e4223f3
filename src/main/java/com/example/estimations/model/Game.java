package com.example.estimations.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Game aggregate: roster, round state, story and avatar bookkeeping.
 * Immutable; every transition returns a new instance. Only the owning
 * {@code GameServer} invokes transitions, so this class has no locking.
 */
public final class Game {

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    private final String id;
    private final String name;
    private final DeckType deckType;
    private final RoundState roundState;
    private final String storyName;

    /** Participants by id, in join order. */
    private final Map<String, Participant> participants;

    /** Avatar ids held by current participants. */
    private final Set<Integer> usedAvatars;

    private final Instant createdAt;

    private Game(String id, String name, DeckType deckType, RoundState roundState, String storyName,
                 Map<String, Participant> participants, Set<Integer> usedAvatars, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.deckType = Objects.requireNonNull(deckType, "deckType");
        this.roundState = Objects.requireNonNull(roundState, "roundState");
        this.storyName = storyName;
        this.participants = Collections.unmodifiableMap(participants);
        this.usedAvatars = Collections.unmodifiableSet(usedAvatars);
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public static Game create(String id, String name, DeckType deckType) {
        return create(id, name, deckType, Instant.now());
    }

    public static Game create(String id, String name, DeckType deckType, Instant createdAt) {
        return new Game(id, name, deckType, RoundState.VOTING, null,
                new LinkedHashMap<>(), new TreeSet<>(), createdAt);
    }

    private Game with(RoundState state, String story, Map<String, Participant> roster, Set<Integer> avatars) {
        return new Game(id, name, deckType, state, story, roster, avatars, createdAt);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public String getId() { return id; }
    public String getName() { return name; }
    public DeckType getDeckType() { return deckType; }
    public RoundState getRoundState() { return roundState; }
    public boolean isRevealed() { return roundState == RoundState.REVEALED; }
    public String getStoryName() { return storyName; }
    public Instant getCreatedAt() { return createdAt; }

    /** Participants by id, in join order (read-only view). */
    public Map<String, Participant> getParticipants() { return participants; }

    public Set<Integer> getUsedAvatars() { return usedAvatars; }

    public Optional<Participant> getParticipant(String participantId) {
        if (participantId == null) return Optional.empty();
        return Optional.ofNullable(participants.get(participantId));
    }

    public boolean hasParticipant(String participantId) {
        return participantId != null && participants.containsKey(participantId);
    }

    public int participantCount() { return participants.size(); }

    public boolean isEmpty() { return participants.isEmpty(); }

    public List<Participant> voters() {
        List<Participant> out = new ArrayList<>();
        for (Participant p : participants.values()) {
            if (p.isVoter()) out.add(p);
        }
        return out;
    }

    public List<Participant> spectators() {
        List<Participant> out = new ArrayList<>();
        for (Participant p : participants.values()) {
            if (p.isSpectator()) out.add(p);
        }
        return out;
    }

    public List<Participant> connectedParticipants() {
        List<Participant> out = new ArrayList<>();
        for (Participant p : participants.values()) {
            if (p.isConnected()) out.add(p);
        }
        return out;
    }

    /** Pool ids not held by anyone, ascending. */
    public List<Integer> availableAvatars() {
        List<Integer> out = new ArrayList<>();
        for (Integer a : Avatars.allIds()) {
            if (!usedAvatars.contains(a)) out.add(a);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Roster transitions
    // ---------------------------------------------------------------------

    /**
     * Inserts the participant and claims its avatar. A participant already present under the
     * same id is replaced and its previous avatar released; its card carries over, and while
     * revealed so does its role. Availability is the caller's check.
     */
    public Game addParticipant(Participant p) {
        Objects.requireNonNull(p, "participant");
        Map<String, Participant> roster = new LinkedHashMap<>(participants);
        Set<Integer> avatars = new TreeSet<>(usedAvatars);

        Participant previous = roster.put(p.getId(), carryOver(participants.get(p.getId()), p));
        if (previous != null && previous.getAvatarId() != null) {
            avatars.remove(previous.getAvatarId());
        }
        if (p.getAvatarId() != null) {
            avatars.add(p.getAvatarId());
        }
        return with(roundState, storyName, roster, avatars);
    }

    private Participant carryOver(Participant previous, Participant next) {
        if (previous == null) return next;
        Participant out = next;
        if (isRevealed() && out.getRole() != previous.getRole()) out = out.toggleRole();
        if (previous.hasVoted()) out = out.vote(previous.getVote());
        return out;
    }

    /** Removes the participant and releases its avatar. No-op if absent. */
    public Game removeParticipant(String participantId) {
        Participant p = participants.get(participantId);
        if (p == null) return this;

        Map<String, Participant> roster = new LinkedHashMap<>(participants);
        roster.remove(participantId);
        Set<Integer> avatars = new TreeSet<>(usedAvatars);
        if (p.getAvatarId() != null) {
            avatars.remove(p.getAvatarId());
        }
        return with(roundState, storyName, roster, avatars);
    }

    /** Applies {@code fn} to one participant. No-op if absent or unchanged. */
    public Game updateParticipant(String participantId, UnaryOperator<Participant> fn) {
        Participant cur = participants.get(participantId);
        if (cur == null) return this;
        Participant next = fn.apply(cur);
        if (next.equals(cur)) return this;
        if (!Objects.equals(next.getAvatarId(), cur.getAvatarId())) {
            throw new IllegalArgumentException("avatar changes must go through addParticipant");
        }

        Map<String, Participant> roster = new LinkedHashMap<>(participants);
        roster.put(participantId, next);
        return with(roundState, storyName, roster, usedAvatars);
    }

    public Game setConnected(String participantId, boolean connected) {
        return updateParticipant(participantId, p -> p.withConnected(connected));
    }

    /** Flips voter/spectator and clears the vote. No-op while revealed: cards stay frozen. */
    public Game toggleRole(String participantId) {
        if (isRevealed()) return this;
        return updateParticipant(participantId, Participant::toggleRole);
    }

    // ---------------------------------------------------------------------
    // Round transitions
    // ---------------------------------------------------------------------

    /**
     * Records a vote while voting. Re-voting overwrites. Spectators and unknown ids
     * leave the game unchanged.
     */
    public Outcome<Game> castVote(String participantId, String card) {
        if (roundState == RoundState.REVEALED) return Outcome.failure(GameError.ALREADY_REVEALED);
        if (!CardDecks.isValidCard(deckType, card)) return Outcome.failure(GameError.INVALID_CARD);
        return Outcome.ok(updateParticipant(participantId, p -> p.vote(card)));
    }

    public Game revealVotes() {
        if (roundState == RoundState.REVEALED) return this;
        return with(RoundState.REVEALED, storyName, new LinkedHashMap<>(participants), usedAvatars);
    }

    /** Clears every vote and the story, back to voting. */
    public Game resetRound() {
        Map<String, Participant> roster = new LinkedHashMap<>();
        for (Map.Entry<String, Participant> e : participants.entrySet()) {
            roster.put(e.getKey(), e.getValue().clearVote());
        }
        return with(RoundState.VOTING, null, roster, usedAvatars);
    }

    public Game setStoryName(String story) {
        String s = (story == null || story.isBlank()) ? null : story.trim();
        return with(roundState, s, new LinkedHashMap<>(participants), usedAvatars);
    }

    // ---------------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------------

    /** True if at least one connected voter exists and all connected voters voted. */
    public boolean allVotersVoted() {
        boolean anyConnected = false;
        for (Participant p : participants.values()) {
            if (!p.isVoter() || !p.isConnected()) continue;
            anyConnected = true;
            if (!p.hasVoted()) return false;
        }
        return anyConnected;
    }

    public boolean anyVotes() {
        for (Participant p : participants.values()) {
            if (p.isVoter() && p.hasVoted()) return true;
        }
        return false;
    }

    /** Computed from the roster on every call; nothing is cached. */
    public VoteStatistics statistics() {
        Map<String, Integer> counts = new HashMap<>();
        long sum = 0;
        int numeric = 0;
        for (Participant p : participants.values()) {
            if (!p.isVoter() || !p.hasVoted()) continue;
            String v = p.getVote();
            counts.merge(v, 1, Integer::sum);
            OptionalInt n = CardDecks.numericValue(v);
            if (n.isPresent()) {
                sum += n.getAsInt();
                numeric++;
            }
        }

        List<String> cards = new ArrayList<>(counts.keySet());
        cards.sort(CardDecks.distributionOrder(deckType));
        Map<String, Integer> distribution = new LinkedHashMap<>();
        for (String c : cards) distribution.put(c, counts.get(c));

        OptionalDouble average = OptionalDouble.empty();
        if (numeric > 0) {
            BigDecimal avg = BigDecimal.valueOf(sum)
                    .divide(BigDecimal.valueOf(numeric), 1, RoundingMode.HALF_UP);
            average = OptionalDouble.of(avg.doubleValue());
        }
        return new VoteStatistics(average, distribution);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Game g)) return false;
        return id.equals(g.id)
                && name.equals(g.name)
                && deckType == g.deckType
                && roundState == g.roundState
                && Objects.equals(storyName, g.storyName)
                && participants.equals(g.participants)
                && usedAvatars.equals(g.usedAvatars)
                && createdAt.equals(g.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, deckType, roundState, storyName, participants, usedAvatars, createdAt);
    }

    @Override
    public String toString() {
        return "Game{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", deckType=" + deckType +
                ", roundState=" + roundState +
                ", storyName='" + storyName + '\'' +
                ", participants=" + participants.size() +
                ", usedAvatars=" + usedAvatars +
                '}';
    }
}
