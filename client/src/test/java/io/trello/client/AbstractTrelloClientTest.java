package io.trello.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.trello.client.config.TrelloConfiguration;
import io.trello.client.config.TrelloConfigurationBuilder;
import io.trello.client.http.jdk.JdkHttpClientBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;

/**
 * Runs a WireMock server standing in for api.trello.com and hands out clients pointed at it.
 */
public abstract class AbstractTrelloClientTest {

    protected static final String KEY = "public-key";
    protected static final String TOKEN = "member-token";

    protected WireMockServer server;

    @BeforeEach
    public void startServer() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        configureFor("localhost", server.port());
    }

    @AfterEach
    public void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    protected String serverUrl() {
        return "http://localhost:" + server.port();
    }

    protected TrelloConfigurationBuilder configuration() {
        return TrelloConfiguration.builder()
                .apiUrl(serverUrl())
                .httpClientBuilder(new JdkHttpClientBuilder());
    }

    /**
     * @return a client using basic auth with both key and token
     */
    protected TrelloClient client() {
        return new TrelloClient(configuration()
                .developerPublicKey(KEY)
                .memberToken(TOKEN)
                .build());
    }
}
