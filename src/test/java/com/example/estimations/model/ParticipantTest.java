package com.example.estimations.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ParticipantTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void create_startsConnectedWithoutVoteOrAvatar() {
        Participant p = Participant.create("p1", "Alice", Role.VOTER, T0);
        assertTrue(p.isConnected());
        assertFalse(p.hasVoted());
        assertNull(p.getAvatarId());
        assertEquals(T0, p.getJoinedAt());
    }

    @Test
    void vote_ignoredForSpectators() {
        Participant spectator = Participant.create("p1", "Po", Role.SPECTATOR, T0);
        assertSame(spectator, spectator.vote("5"));

        Participant voter = Participant.create("p2", "Bob", Role.VOTER, T0).vote("5").vote("8");
        assertEquals("8", voter.getVote());
    }

    @Test
    void toggleRole_alwaysDropsVote() {
        Participant p = Participant.create("p1", "Alice", Role.VOTER, T0).vote("3");

        Participant once = p.toggleRole();
        assertEquals(Role.SPECTATOR, once.getRole());
        assertNull(once.getVote());

        Participant twice = once.toggleRole();
        assertEquals(Role.VOTER, twice.getRole());
        assertNull(twice.getVote(), "vote is cleared, not restored");
    }

    @Test
    void withConnected_returnsSameInstanceWhenUnchanged() {
        Participant p = Participant.create("p1", "Alice", Role.VOTER, T0);
        assertSame(p, p.withConnected(true));

        Participant off = p.withConnected(false);
        assertFalse(off.isConnected());
        assertNotEquals(p, off);
    }

    @Test
    void initial_isUpperCaseFirstLetter() {
        assertEquals("A", Participant.create("p1", "alice", Role.VOTER, T0).initial());
        assertEquals("Z", Participant.create("p2", "  zoe", Role.VOTER, T0).initial());
    }

    @Test
    void rolesParseLeniently() {
        assertEquals(Role.SPECTATOR, Role.parse(" Spectator "));
        assertEquals(Role.VOTER, Role.parse("voter"));
        assertEquals(Role.VOTER, Role.parse(null));
        assertEquals(Role.VOTER, Role.SPECTATOR.toggled());
    }
}
