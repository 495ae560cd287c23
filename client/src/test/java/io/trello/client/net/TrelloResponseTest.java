package io.trello.client.net;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.exception.TrelloException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TrelloResponseTest {

    @Test
    public void testJsonIsDecodedOnce() {
        TrelloResponse response = new TrelloResponse(200, "{\"id\":\"b1\"}");

        JsonNode json = response.json();

        assertEquals("b1", json.get("id").asText());
        assertSame(json, response.json());
        assertTrue(response.success());
    }

    @Test
    public void testEmptyBodyIsJsonNull() {
        assertTrue(new TrelloResponse(200, "").json().isNull());
    }

    @Test
    public void testMalformedBody() {
        TrelloResponse response = new TrelloResponse(200, "<html>");

        assertThrows(TrelloException.class, response::json);
    }

    @Test
    public void testClassification() {
        assertTrue(new TrelloResponse(204, "").success());
        assertFalse(new TrelloResponse(302, "").success());
        assertTrue(new TrelloResponse(401, "").unauthorized());
        assertFalse(new TrelloResponse(403, "").unauthorized());
    }
}
