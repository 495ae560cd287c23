package io.trello.client.net;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TrelloRequestTest {

    @Test
    public void testRelativeUriEncodesQuery() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("name", "Hello World & more");
        params.put("filter", "open");
        TrelloRequest request = new TrelloRequest(HttpMethod.GET, "https://api.trello.com", "/1/search",
                params, Map.of(), null);

        assertEquals("/1/search?name=Hello%20World%20%26%20more&filter=open", request.relativeUri());
        assertEquals("https://api.trello.com/1/search?name=Hello%20World%20%26%20more&filter=open", request.url());
    }

    @Test
    public void testNoQuery() {
        TrelloRequest request = new TrelloRequest(HttpMethod.DELETE, "https://api.trello.com", "/1/cards/c1");

        assertEquals("/1/cards/c1", request.relativeUri());
        assertNull(request.body());
    }

    @Test
    public void testWithQueryParamsKeepsExistingValues() {
        TrelloRequest request = new TrelloRequest(HttpMethod.GET, "https://api.trello.com", "/1/boards",
                Map.of("key", "mine"), Map.of(), null);

        TrelloRequest merged = request.withQueryParams(Map.of("key", "other", "token", "t"));

        assertEquals("mine", merged.queryParams().get("key"));
        assertEquals("t", merged.queryParams().get("token"));
        assertEquals(Map.of("key", "mine"), request.queryParams());
    }

    @Test
    public void testWithersReturnNewRequests() {
        TrelloRequest request = new TrelloRequest(HttpMethod.POST, "https://api.trello.com", "/1/cards");

        TrelloRequest changed = request.withHeader("Accept", "application/json").withBody("{}");

        assertTrue(request.headers().isEmpty());
        assertEquals("application/json", changed.headers().get("Accept"));
        assertEquals("{}", changed.body());
    }

    @Test
    public void testToStringHidesCredentials() {
        TrelloRequest request = new TrelloRequest(HttpMethod.GET, "https://api.trello.com", "/1/boards/b1",
                Map.of("token", "secret"), Map.of(), null);

        assertEquals("GET /1/boards/b1", request.toString());
    }

    @Test
    public void testQueryParamsAreImmutable() {
        TrelloRequest request = new TrelloRequest(HttpMethod.GET, "https://api.trello.com", "/1/boards",
                new LinkedHashMap<>(Map.of("a", "1")), Map.of(), null);

        assertThrows(UnsupportedOperationException.class, () -> request.queryParams().put("b", "2"));
    }
}
