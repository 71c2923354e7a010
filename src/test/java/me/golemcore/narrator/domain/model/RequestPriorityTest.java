package me.golemcore.narrator.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestPriorityTest {

    @Test
    void parsesWireValuesCaseInsensitively() {
        assertEquals(RequestPriority.HIGH, RequestPriority.parse("HIGH"));
        assertEquals(RequestPriority.LOW, RequestPriority.parse(" low "));
        assertEquals(RequestPriority.NORMAL, RequestPriority.parse("normal"));
    }

    @Test
    void blankMeansNormal() {
        assertEquals(RequestPriority.NORMAL, RequestPriority.parse(null));
        assertEquals(RequestPriority.NORMAL, RequestPriority.parse(""));
    }

    @Test
    void unknownValueIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> RequestPriority.parse("urgent"));
    }

    @Test
    void ranksAreOrdered() {
        assertTrue(RequestPriority.HIGH.getRank() > RequestPriority.NORMAL.getRank());
        assertTrue(RequestPriority.NORMAL.getRank() > RequestPriority.LOW.getRank());
    }

    @Test
    void speechRequestDefaultsToNormalPriority() {
        assertEquals(RequestPriority.NORMAL, SpeechRequest.builder().text("x").build().effectivePriority());
    }
}
