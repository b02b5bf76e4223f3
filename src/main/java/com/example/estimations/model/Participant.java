package com.example.estimations.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable room occupant. Every transition returns a new instance; none of them can fail.
 */
public final class Participant {

    private final String id;
    private final String name;
    private final Role role;
    private final String vote;          // current card, null = not voted
    private final Integer avatarId;     // null = no avatar
    private final boolean connected;    // live socket presence, not membership
    private final Instant joinedAt;

    private Participant(String id, String name, Role role, String vote,
                        Integer avatarId, boolean connected, Instant joinedAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.role = Objects.requireNonNull(role, "role");
        this.vote = vote;
        this.avatarId = avatarId;
        this.connected = connected;
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
    }

    public static Participant create(String id, String name, Role role) {
        return create(id, name, role, Instant.now());
    }

    public static Participant create(String id, String name, Role role, Instant joinedAt) {
        return new Participant(id, name, role, null, null, true, joinedAt);
    }

    // identity
    public String getId() { return id; }
    public String getName() { return name; }
    public Instant getJoinedAt() { return joinedAt; }

    // state
    public Role getRole() { return role; }
    public String getVote() { return vote; }
    public Integer getAvatarId() { return avatarId; }
    public boolean isConnected() { return connected; }

    public boolean hasVoted() { return vote != null; }
    public boolean isVoter() { return role == Role.VOTER; }
    public boolean isSpectator() { return role == Role.SPECTATOR; }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    /** Records a vote. Spectators are returned unchanged. */
    public Participant vote(String card) {
        if (role == Role.SPECTATOR) return this;
        return new Participant(id, name, role, card, avatarId, connected, joinedAt);
    }

    public Participant clearVote() {
        if (vote == null) return this;
        return new Participant(id, name, role, null, avatarId, connected, joinedAt);
    }

    public Participant withConnected(boolean connected) {
        if (this.connected == connected) return this;
        return new Participant(id, name, role, vote, avatarId, connected, joinedAt);
    }

    public Participant withAvatar(Integer avatarId) {
        return new Participant(id, name, role, vote, avatarId, connected, joinedAt);
    }

    /** Flips voter/spectator. The vote is always dropped so no stale card survives. */
    public Participant toggleRole() {
        return new Participant(id, name, role.toggled(), null, avatarId, connected, joinedAt);
    }

    /** Upper-case first letter of the name, used when no avatar is shown. */
    public String initial() {
        String t = name.trim();
        if (t.isEmpty()) return "?";
        return t.substring(0, t.offsetByCodePoints(0, 1)).toUpperCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Participant p)) return false;
        return connected == p.connected
                && id.equals(p.id)
                && name.equals(p.name)
                && role == p.role
                && Objects.equals(vote, p.vote)
                && Objects.equals(avatarId, p.avatarId)
                && joinedAt.equals(p.joinedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, role, vote, avatarId, connected, joinedAt);
    }

    @Override
    public String toString() {
        return "Participant{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", role=" + role +
                ", vote='" + vote + '\'' +
                ", avatarId=" + avatarId +
                ", connected=" + connected +
                '}';
    }
}
