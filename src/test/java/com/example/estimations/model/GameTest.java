package com.example.estimations.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GameTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static Game fib() {
        return Game.create("abc123", "Sprint 42", DeckType.FIBONACCI, T0);
    }

    private static Participant voter(String id) {
        return Participant.create(id, "Name " + id, Role.VOTER, T0);
    }

    private static Game vote(Game g, String pid, String card) {
        Outcome<Game> r = g.castVote(pid, card);
        assertTrue(r.isOk(), () -> "vote " + card + " failed: " + r.getError());
        return r.getValue();
    }

    @Test
    @DisplayName("Fibonacci round: 5, 8, 5 averages 6.0")
    void fibonacciRound_statistics() {
        Game g = fib().addParticipant(voter("a")).addParticipant(voter("b")).addParticipant(voter("c"));
        g = vote(g, "a", "5");
        g = vote(g, "b", "8");
        g = vote(g, "c", "5");
        g = g.revealVotes();

        VoteStatistics s = g.statistics();
        assertEquals(6.0, s.average().getAsDouble());
        assertEquals(Map.of("5", 2, "8", 1), s.distribution());
        assertEquals(List.of("5", "8"), List.copyOf(s.distribution().keySet()));
        assertEquals(3, s.totalVotes());
    }

    @Test
    @DisplayName("T-shirt round has no average")
    void tshirtRound_noAverage() {
        Game g = Game.create("x", "Sizes", DeckType.TSHIRT, T0)
                .addParticipant(voter("a")).addParticipant(voter("b"));
        g = vote(g, "a", "M");
        g = vote(g, "b", "L");
        g = g.revealVotes();

        VoteStatistics s = g.statistics();
        assertTrue(s.average().isEmpty());
        assertEquals(List.of("M", "L"), List.copyOf(s.distribution().keySet()));
        assertEquals(Map.of("M", 1, "L", 1), s.distribution());
    }

    @Test
    void average_roundsToOneDecimal_andIgnoresSpecials() {
        Game g = fib().addParticipant(voter("a")).addParticipant(voter("b"))
                .addParticipant(voter("c")).addParticipant(voter("d"));
        g = vote(g, "a", "1");
        g = vote(g, "b", "2");
        g = vote(g, "c", "2");
        g = vote(g, "d", "coffee");

        VoteStatistics s = g.statistics();
        assertEquals(1.7, s.average().getAsDouble(), 1e-9);
        assertEquals(List.of("1", "2", "coffee"), List.copyOf(s.distribution().keySet()));
    }

    @Test
    void revote_overwritesPreviousCard() {
        Game g = fib().addParticipant(voter("a"));
        g = vote(g, "a", "3");
        g = vote(g, "a", "13");

        assertEquals("13", g.getParticipant("a").orElseThrow().getVote());
        assertEquals(Map.of("13", 1), g.statistics().distribution());
    }

    @Test
    void revealWithoutVotes_succeedsWithEmptyStatistics() {
        Game g = fib().addParticipant(voter("a")).revealVotes();
        assertTrue(g.isRevealed());
        assertTrue(g.statistics().average().isEmpty());
        assertTrue(g.statistics().distribution().isEmpty());
    }

    @Test
    void castVote_rejectedAfterRevealAndForForeignCards() {
        Game g = fib().addParticipant(voter("a"));
        assertEquals(GameError.INVALID_CARD, g.castVote("a", "XL").getError());
        assertEquals(GameError.INVALID_CARD, g.castVote("a", null).getError());

        Game revealed = g.revealVotes();
        assertEquals(GameError.ALREADY_REVEALED, revealed.castVote("a", "5").getError());
        assertEquals(GameError.ALREADY_REVEALED, revealed.castVote("a", "XL").getError(),
                "revealed is checked before card validity");
    }

    @Test
    void castVote_bySpectatorOrUnknownId_leavesGameUnchanged() {
        Game g = fib().addParticipant(Participant.create("s", "Po", Role.SPECTATOR, T0));
        assertSame(g, g.castVote("s", "5").getValue());
        assertSame(g, g.castVote("nobody", "5").getValue());
    }

    @Test
    void reveal_isIdempotent() {
        Game g = vote(fib().addParticipant(voter("a")), "a", "8");
        Game once = g.revealVotes();
        Game twice = once.revealVotes();
        assertSame(once, twice);
        assertEquals(once, twice);
    }

    @Test
    void reset_clearsVotesAndStory() {
        Game g = fib().addParticipant(voter("a")).addParticipant(voter("b")).setStoryName("  JIRA-1 ");
        assertEquals("JIRA-1", g.getStoryName());
        g = vote(g, "a", "5");
        g = g.revealVotes().resetRound();

        assertEquals(RoundState.VOTING, g.getRoundState());
        assertNull(g.getStoryName());
        assertTrue(g.getParticipants().values().stream().noneMatch(Participant::hasVoted));
        assertFalse(g.anyVotes());

        // reset from voting works as well
        assertEquals(RoundState.VOTING, fib().resetRound().getRoundState());
    }

    @Test
    void blankStory_clearsLabel() {
        Game g = fib().setStoryName("Login page").setStoryName("   ");
        assertNull(g.getStoryName());
    }

    @Test
    void toggleRoleTwice_restoresRoleButNotVote() {
        Game g = vote(fib().addParticipant(voter("a")), "a", "5");
        Game toggled = g.toggleRole("a").toggleRole("a");

        Participant p = toggled.getParticipant("a").orElseThrow();
        assertEquals(Role.VOTER, p.getRole());
        assertNull(p.getVote());
    }

    @Test
    void toggleRole_whileRevealed_leavesCardsAndStatisticsAlone() {
        Game g = fib().addParticipant(voter("a")).addParticipant(voter("b"));
        g = vote(g, "a", "5");
        g = vote(g, "b", "13");
        Game revealed = g.revealVotes();
        assertEquals(9.0, revealed.statistics().average().getAsDouble());

        Game after = revealed.toggleRole("b");

        assertSame(revealed, after);
        assertEquals("13", after.getParticipant("b").orElseThrow().getVote());
        assertEquals(Role.VOTER, after.getParticipant("b").orElseThrow().getRole());
        assertEquals(Map.of("5", 1, "13", 1), after.statistics().distribution());

        // unfrozen again after reset
        Game reset = after.resetRound().toggleRole("b");
        assertEquals(Role.SPECTATOR, reset.getParticipant("b").orElseThrow().getRole());
    }

    @Test
    void rejoin_whileRevealed_keepsCardAndRole() {
        Game g = vote(fib().addParticipant(voter("a")).addParticipant(voter("b")), "b", "13").revealVotes();

        Game after = g.addParticipant(Participant.create("b", "Bob (new tab)", Role.SPECTATOR, T0));

        Participant b = after.getParticipant("b").orElseThrow();
        assertEquals("Bob (new tab)", b.getName());
        assertEquals(Role.VOTER, b.getRole());
        assertEquals("13", b.getVote());
        assertEquals(13.0, after.statistics().average().getAsDouble());
    }

    @Test
    void rejoin_whileVoting_keepsCardForVoters() {
        Game g = vote(fib().addParticipant(voter("a")), "a", "8");

        Game sameRole = g.addParticipant(voter("a"));
        assertEquals("8", sameRole.getParticipant("a").orElseThrow().getVote());

        Game asSpectator = g.addParticipant(Participant.create("a", "Alice", Role.SPECTATOR, T0));
        assertEquals(Role.SPECTATOR, asSpectator.getParticipant("a").orElseThrow().getRole());
        assertNull(asSpectator.getParticipant("a").orElseThrow().getVote(), "spectators hold no card");
    }

    @Test
    void avatars_claimedOnJoinAndReleasedOnLeave() {
        Game g = fib()
                .addParticipant(voter("a").withAvatar(3))
                .addParticipant(voter("b").withAvatar(5));
        assertEquals(Set.of(3, 5), g.getUsedAvatars());
        assertEquals(List.of(1, 2, 4, 6, 7), g.availableAvatars());

        g = g.removeParticipant("a");
        assertEquals(Set.of(5), g.getUsedAvatars());
        assertTrue(g.availableAvatars().contains(3));
    }

    @Test
    void rejoin_replacesParticipantAndReleasesOldAvatar() {
        Game g = fib().addParticipant(voter("a").withAvatar(2));
        g = g.addParticipant(Participant.create("a", "Alice again", Role.SPECTATOR, T0).withAvatar(4));

        assertEquals(1, g.participantCount());
        assertEquals(Set.of(4), g.getUsedAvatars());
        assertEquals("Alice again", g.getParticipant("a").orElseThrow().getName());
    }

    @Test
    void removeUnknown_isNoOp() {
        Game g = fib().addParticipant(voter("a"));
        assertSame(g, g.removeParticipant("zzz"));
        assertSame(g, g.setConnected("zzz", false));
    }

    @Test
    void allVotersVoted_onlyCountsConnectedVoters() {
        Game g = fib().addParticipant(voter("a")).addParticipant(voter("b"))
                .addParticipant(Participant.create("s", "Po", Role.SPECTATOR, T0));
        assertFalse(g.allVotersVoted());

        g = vote(g, "a", "5");
        assertFalse(g.allVotersVoted());
        assertTrue(g.anyVotes());

        g = g.setConnected("b", false);
        assertTrue(g.allVotersVoted(), "disconnected voter b does not block");

        g = g.setConnected("a", false);
        assertFalse(g.allVotersVoted(), "no connected voter left");
    }

    @Test
    void statistics_ignoreSpectators() {
        Game g = vote(fib().addParticipant(voter("a")), "a", "8");
        g = g.toggleRole("a");
        assertTrue(g.statistics().distribution().isEmpty());
    }

    @Test
    void participants_keepJoinOrder() {
        Game g = fib().addParticipant(voter("c")).addParticipant(voter("a")).addParticipant(voter("b"));
        assertEquals(List.of("c", "a", "b"), List.copyOf(g.getParticipants().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> g.getParticipants().clear());
    }
}
