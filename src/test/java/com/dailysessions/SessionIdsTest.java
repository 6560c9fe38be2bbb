package com.dailysessions;

import org.junit.Test;

import static com.dailysessions.TestEvents.at;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class SessionIdsTest {

    @Test
    public void joinsUserProductAndStart() {
        assertEquals("U1#P1#2024-01-05T10:00:00.000Z",
                SessionIds.sessionId("U1", "P1", at("2024-01-05T10:00:00Z")));
    }

    @Test
    public void separatorInsideIdsDoesNotCollide() {
        String left = SessionIds.sessionId("U1#P1", "X", at("2024-01-05T10:00:00Z"));
        String right = SessionIds.sessionId("U1", "P1#X", at("2024-01-05T10:00:00Z"));

        assertNotEquals(left, right);
        assertEquals("U1\\#P1#X#2024-01-05T10:00:00.000Z", left);
    }

    @Test
    public void escapeCharacterIsEscaped() {
        assertNotEquals(
                SessionIds.sessionId("U1\\", "#P1", at("2024-01-05T10:00:00Z")),
                SessionIds.sessionId("U1\\#", "P1", at("2024-01-05T10:00:00Z")));
    }

    @Test
    public void differentStartsGiveDifferentIds() {
        assertNotEquals(
                SessionIds.sessionId("U1", "P1", at("2024-01-05T10:00:00Z")),
                SessionIds.sessionId("U1", "P1", at("2024-01-05T10:00:00.001Z")));
    }
}
