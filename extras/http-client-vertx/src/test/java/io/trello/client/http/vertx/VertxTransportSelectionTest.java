package io.trello.client.http.vertx;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.trello.client.TrelloClient;
import io.trello.client.config.TrelloConfiguration;
import io.trello.client.model.Board;
import io.trello.client.net.HttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

public class VertxTransportSelectionTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testVertxWinsWhenInstalled() {
        assertEquals(VertxHttpClientBuilder.NAME, HttpClients.resolve(TrelloConfiguration.builder().build()).name());
    }

    @Test
    public void testJdkCanStillBeSelectedByName() {
        assertEquals("jdk", HttpClients.resolve(TrelloConfiguration.builder().httpClient("jdk").build()).name());
    }

    @Test
    public void testClientOverVertx() {
        givenThat(get(urlPathEqualTo("/1/boards/b1"))
                .willReturn(okJson("{\"id\":\"b1\",\"name\":\"Demo\"}")));

        try (TrelloClient client = new TrelloClient(TrelloConfiguration.builder()
                .apiUrl("http://localhost:" + server.port())
                .httpClient(VertxHttpClientBuilder.NAME)
                .developerPublicKey("key")
                .build())) {
            Board board = Board.find(client, "b1");

            assertEquals("Demo", board.getName());
        }
        verify(getRequestedFor(urlPathEqualTo("/1/boards/b1")).withQueryParam("key", equalTo("key")));
    }

    @Test
    public void testClosingClientStopsVertxThreads() throws Exception {
        givenThat(get(urlPathEqualTo("/1/boards/b1")).willReturn(okJson("{\"id\":\"b1\"}")));
        Set<Thread> before = vertxThreads();

        TrelloClient client = new TrelloClient(TrelloConfiguration.builder()
                .apiUrl("http://localhost:" + server.port())
                .developerPublicKey("key")
                .build());
        Board.find(client, "b1");
        assertFalse(startedSince(before).isEmpty());

        client.close();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!startedSince(before).isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertEquals(Set.of(), startedSince(before));
    }

    private static Set<Thread> startedSince(Set<Thread> before) {
        Set<Thread> threads = vertxThreads();
        threads.removeAll(before);
        return threads;
    }

    // Event loop threads are not daemons, so any left running keeps the JVM alive.
    private static Set<Thread> vertxThreads() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> thread.isAlive() && !thread.isDaemon() && thread.getName().startsWith("vert.x-"))
                .collect(Collectors.toCollection(HashSet::new));
    }
}
