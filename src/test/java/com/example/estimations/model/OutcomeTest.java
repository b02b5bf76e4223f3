package com.example.estimations.model;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void ok_carriesValue() {
        Outcome<String> r = Outcome.ok("x");
        assertTrue(r.isOk());
        assertNull(r.getError());
        assertEquals("x", r.getValue());
        assertEquals(Outcome.ok(1), r.map(String::length));
    }

    @Test
    void failure_carriesErrorAndRefusesValue() {
        Outcome<String> r = Outcome.failure(GameError.NOT_FOUND);
        assertFalse(r.isOk());
        assertEquals(GameError.NOT_FOUND, r.getError());
        assertThrows(NoSuchElementException.class, r::getValue);
        assertTrue(r.toOptional().isEmpty());
        assertEquals(GameError.NOT_FOUND, r.map(String::length).getError());
    }
}
