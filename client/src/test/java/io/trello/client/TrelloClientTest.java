package io.trello.client;

import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.exception.InvalidAccessTokenException;
import io.trello.client.exception.TransportException;
import io.trello.client.exception.TrelloApiException;
import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpClientBuilder;
import io.trello.client.http.jdk.JdkHttpClientBuilder;
import io.trello.client.model.Board;
import io.trello.client.model.Member;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.LoggerFactory;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;

public class TrelloClientTest extends AbstractTrelloClientTest {

    @Test
    public void testGetPrefixesVersionAndAddsCredentials() {
        givenThat(get(urlPathEqualTo("/1/boards/b1"))
                .willReturn(okJson("{\"id\":\"b1\",\"name\":\"Demo\"}")));

        JsonNode board = client().get("/boards/b1", Map.of("fields", "name"));

        assertEquals("Demo", board.get("name").asText());
        verify(getRequestedFor(urlPathEqualTo("/1/boards/b1"))
                .withQueryParam("fields", equalTo("name"))
                .withQueryParam("key", equalTo(KEY))
                .withQueryParam("token", equalTo(TOKEN))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testPathWithoutLeadingSlash() {
        givenThat(get(urlPathEqualTo("/1/members/me"))
                .willReturn(okJson("{\"id\":\"m1\"}")));

        assertEquals("m1", client().get("members/me").get("id").asText());
    }

    @Test
    public void testPostSendsJsonBody() {
        givenThat(post(urlPathEqualTo("/1/boards"))
                .willReturn(okJson("{\"id\":\"b2\",\"name\":\"New\"}")));

        JsonNode created = client().post("/boards", Map.of("name", "New"));

        assertEquals("b2", created.get("id").asText());
        verify(postRequestedFor(urlPathEqualTo("/1/boards"))
                .withHeader("Content-Type", containing("application/json"))
                .withRequestBody(equalToJson("{\"name\":\"New\"}")));
    }

    @Test
    public void testUnauthorizedRaisesInvalidAccessToken() {
        givenThat(get(urlPathEqualTo("/1/boards/b1"))
                .willReturn(aResponse().withStatus(401).withBody("invalid token")));

        InvalidAccessTokenException e = assertThrows(InvalidAccessTokenException.class,
                () -> client().get("/boards/b1"));
        assertEquals(401, e.getStatus());
        assertEquals("invalid token", e.getResponseBody());
    }

    @Test
    public void testErrorStatusRaisesApiException() {
        givenThat(get(urlPathEqualTo("/1/boards/missing"))
                .willReturn(aResponse().withStatus(404).withBody("The requested resource was not found.")));

        TrelloApiException e = assertThrows(TrelloApiException.class, () -> client().get("/boards/missing"));
        assertEquals(404, e.getStatus());
        assertTrue(e.isClientError());
        assertFalse(e.isServerError());
        assertEquals("The requested resource was not found.", e.getResponseBody());
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    public void testErrorStatusIsNotLoggedAsError() {
        givenThat(get(urlPathEqualTo("/1/boards/missing")).willReturn(aResponse().withStatus(404)));
        Logger logger = (Logger) LoggerFactory.getLogger(TrelloClient.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThrows(TrelloApiException.class, () -> client().get("/boards/missing"));

            assertTrue(appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains("404")));
            assertTrue(appender.list.stream().noneMatch(event -> event.getLevel().isGreaterOrEqual(Level.WARN)));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    public void testServerError() {
        givenThat(get(urlPathEqualTo("/1/boards/b1"))
                .willReturn(aResponse().withStatus(503).withBody("")));

        TrelloApiException e = assertThrows(TrelloApiException.class, () -> client().get("/boards/b1"));
        assertTrue(e.isServerError());
    }

    @Test
    public void testConnectionRefusedRaisesTransportException() {
        TrelloClient client = client();
        server.stop();

        TransportException e = assertThrows(TransportException.class, () -> client.get("/boards/b1"));
        assertNotNull(e.getCause());
    }

    @Test
    public void testWriteWithoutTokenFailsBeforeSending() {
        TrelloClient client = new TrelloClient(configuration().developerPublicKey(KEY).build());

        assertThrows(ConfigurationException.class, () -> client.post("/boards", Map.of("name", "New")));
        assertThrows(ConfigurationException.class, () -> client.delete("/boards/b1"));
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testUnconfiguredClientFailsBeforeSending() {
        TrelloClient client = new TrelloClient(configuration().build());

        assertThrows(ConfigurationException.class, () -> client.get("/boards/b1"));
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testTransportIsResolvedOnceAndLazily() {
        HttpClientBuilder builder = Mockito.spy(new JdkHttpClientBuilder());
        TrelloClient client = new TrelloClient(configuration()
                .developerPublicKey(KEY)
                .httpClientBuilder(builder)
                .build());
        Mockito.verify(builder, Mockito.never()).create(anyString());

        givenThat(get(anyUrl()).willReturn(okJson("{}")));
        client.get("/boards/b1");
        client.get("/boards/b2");

        Mockito.verify(builder, Mockito.times(1)).create(serverUrl());
    }

    @Test
    public void testCloseReleasesTransport() {
        HttpClient transport = Mockito.mock(HttpClient.class);
        HttpClientBuilder builder = Mockito.mock(HttpClientBuilder.class);
        Mockito.when(builder.create(anyString())).thenReturn(transport);
        TrelloClient client = new TrelloClient(configuration()
                .developerPublicKey(KEY)
                .httpClientBuilder(builder)
                .build());

        assertSame(transport, client.httpClient());
        client.close();
        client.close();

        Mockito.verify(transport, Mockito.times(1)).close();
        assertThrows(IllegalStateException.class, () -> client.get("/boards/b1"));
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testCloseBeforeFirstCallCreatesNothing() {
        HttpClientBuilder builder = Mockito.mock(HttpClientBuilder.class);
        TrelloClient client = new TrelloClient(configuration()
                .developerPublicKey(KEY)
                .httpClientBuilder(builder)
                .build());

        client.close();

        Mockito.verify(builder, Mockito.never()).create(anyString());
    }

    @Test
    public void testFindAndFindMany() {
        givenThat(get(urlPathEqualTo("/1/boards/b1"))
                .willReturn(okJson("{\"id\":\"b1\",\"name\":\"Demo\"}")));
        givenThat(get(urlPathEqualTo("/1/members/me/boards"))
                .willReturn(okJson("[{\"id\":\"b1\"},{\"id\":\"b2\"}]")));

        TrelloClient client = client();
        Board board = client.find(Board.TYPE, "b1");
        List<Board> boards = Board.all(client);

        assertEquals("Demo", board.getName());
        assertEquals(List.of("b1", "b2"), boards.stream().map(Board::getId).toList());
    }

    @Test
    public void testCreate() {
        givenThat(post(urlPathEqualTo("/1/boards"))
                .willReturn(okJson("{\"id\":\"b9\",\"name\":\"Created\"}")));

        Board board = client().create(Board.TYPE, Map.of("name", "Created"));

        assertEquals("b9", board.getId());
        assertFalse(board.isDirty());
        assertThrows(IllegalArgumentException.class, () -> client().create(Board.TYPE, Map.of("url", "x")));
    }

    @Test
    public void testMe() {
        givenThat(get(urlPathEqualTo("/1/members/me"))
                .willReturn(okJson("{\"id\":\"m1\",\"username\":\"bobtester\",\"fullName\":\"Bob Tester\"}")));

        Member me = client().me();

        assertEquals("m1", me.getId());
        assertEquals("Bob Tester", me.getFullName());
    }
}
