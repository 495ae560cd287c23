package io.trello.client.http.vertx;

import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

/**
 * Builds {@link VertxHttpClient}s. Registered as the {@code vertx} transport, which the
 * Trello client prefers over {@code jdk} whenever this artifact is on the classpath.
 * <p>
 * Without an explicit {@link Vertx} instance each created client starts its own and
 * stops it again on {@link HttpClient#close()}. An explicit instance is left running.
 */
public class VertxHttpClientBuilder implements HttpClientBuilder {

    public static final String NAME = "vertx";

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    /**
     * @param options copied on every {@link #create(String)}; host, port and TLS are
     *                overridden from the base URL
     */
    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HttpClient create(String url) {
        HttpClientOptions copy = options != null ? new HttpClientOptions(options) : new HttpClientOptions();
        if (vertx != null) {
            return new VertxHttpClient(url, vertx, false, copy);
        }
        return new VertxHttpClient(url, Vertx.vertx(), true, copy);
    }
}
