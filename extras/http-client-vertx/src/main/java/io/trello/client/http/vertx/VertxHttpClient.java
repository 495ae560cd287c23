package io.trello.client.http.vertx;

import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpResponse;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@link HttpClient} on top of a Vert.x {@link io.vertx.core.http.HttpClient}. Host, port
 * and TLS come from the base URL; request paths are sent as given, query string included.
 * <p>
 * {@link #close()} closes the Vert.x client, and the {@link Vertx} instance too when this
 * client started it.
 */
public class VertxHttpClient implements HttpClient {

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final io.vertx.core.http.HttpClient client;

    VertxHttpClient(String baseUrl, Vertx vertx, boolean ownsVertx, HttpClientOptions options) {
        URI target;
        try {
            target = parse(baseUrl);
        } catch (IllegalArgumentException e) {
            if (ownsVertx) {
                vertx.close();
            }
            throw e;
        }
        boolean secure = "https".equalsIgnoreCase(target.getScheme());
        int port = target.getPort() != -1 ? target.getPort() : (secure ? 443 : 80);
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.client = vertx.createHttpClient(options
                .setDefaultHost(target.getHost())
                .setDefaultPort(port)
                .setSsl(secure));
    }

    private static URI parse(String baseUrl) {
        try {
            URI uri = URI.create(baseUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URI [" + baseUrl + "] has no scheme or host");
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + baseUrl + "] is not valid", e);
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new VertxGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new VertxPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new VertxPutRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new VertxDeleteRequestBuilder(path);
    }

    /**
     * Blocks until the client, and an owned {@link Vertx}, are closed. Must not be called
     * from an event loop thread.
     */
    @Override
    public void close() {
        try {
            await(client.close());
        } finally {
            if (ownsVertx) {
                await(vertx.close());
            }
        }
    }

    private static void await(Future<Void> future) {
        future.toCompletionStage().toCompletableFuture().join();
    }

    private abstract class VertxRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        private final HttpMethod method;
        private final Map<String, String> headers = new LinkedHashMap<>();

        VertxRequestBuilder(String path, HttpMethod method) {
            this.path = path;
            this.method = method;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            this.headers.putAll(headers);
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        @Nullable String body() {
            return null;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            String body = body();
            return client.request(method, path)
                    .compose(request -> {
                        request.headers().addAll(headers);
                        return body == null ? request.send() : request.send(body);
                    })
                    .compose(RESPONSE_MAPPER)
                    .toCompletionStage()
                    .toCompletableFuture();
        }
    }

    private abstract class VertxBodyRequestBuilder<T extends RequestBuilder<T>> extends VertxRequestBuilder<T> {
        private String body = "";

        VertxBodyRequestBuilder(String path, HttpMethod method) {
            super(path, method);
        }

        T setBody(@Nullable String body) {
            this.body = body == null ? "" : body;
            return self();
        }

        @Override
        String body() {
            return body;
        }
    }

    private class VertxGetRequestBuilder extends VertxRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        VertxGetRequestBuilder(String path) {
            super(path, HttpMethod.GET);
        }
    }

    private class VertxDeleteRequestBuilder extends VertxRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        VertxDeleteRequestBuilder(String path) {
            super(path, HttpMethod.DELETE);
        }
    }

    private class VertxPostRequestBuilder extends VertxBodyRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        VertxPostRequestBuilder(String path) {
            super(path, HttpMethod.POST);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            return setBody(body);
        }
    }

    private class VertxPutRequestBuilder extends VertxBodyRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        VertxPutRequestBuilder(String path) {
            super(path, HttpMethod.PUT);
        }

        @Override
        public PutRequestBuilder body(@Nullable String body) {
            return setBody(body);
        }
    }

    // Buffered here so that HttpResponse.body() never blocks on the event loop.
    private static final Function<HttpClientResponse, Future<HttpResponse>> RESPONSE_MAPPER = response ->
            response.body().map(buffer -> new VertxHttpResponse(response.statusCode(), asString(buffer)));

    private static String asString(@Nullable Buffer buffer) {
        return buffer == null ? "" : buffer.toString();
    }

    private record VertxHttpResponse(int statusCode, String body) implements HttpResponse {
    }
}
