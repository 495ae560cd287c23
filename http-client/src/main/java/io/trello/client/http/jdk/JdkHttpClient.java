package io.trello.client.http.jdk;

import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpResponse;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * {@link HttpClient} backed by {@link java.net.http.HttpClient}. Only scheme, host and
 * port of the base URL are kept; request paths carry the rest.
 */
class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;
    private final @Nullable Duration requestTimeout;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration connectTimeout, @Nullable Duration requestTimeout) {
        this.baseUrl = origin(baseUrl);
        this.requestTimeout = requestTimeout;
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        this.httpClient = builder.build();
    }

    private static String origin(String baseUrl) {
        URI uri;
        try {
            uri = URI.create(baseUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + baseUrl + "] is not valid", e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("URI [" + baseUrl + "] is not valid");
        }
        return uri.getScheme() + "://" + uri.getRawAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteRequestBuilder(path);
    }

    @Override
    public void close() {
        // java.net.http.HttpClient only gained close() in JDK 21.
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String method;
        private final String path;
        private final Map<String, String> headers = new LinkedHashMap<>();

        JdkRequestBuilder(String method, String path) {
            this.method = method;
            this.path = path;
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

        BodyPublisher bodyPublisher() {
            return BodyPublishers.noBody();
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .method(method, bodyPublisher());
            if (requestTimeout != null) {
                builder.timeout(requestTimeout);
            }
            headers.forEach(builder::header);
            return httpClient
                    .sendAsync(builder.build(), BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(response -> new JdkHttpResponse(response.statusCode(), response.body()));
        }
    }

    private abstract class JdkBodyRequestBuilder<T extends RequestBuilder<T>> extends JdkRequestBuilder<T> {
        private String body = "";

        JdkBodyRequestBuilder(String method, String path) {
            super(method, path);
        }

        T setBody(@Nullable String body) {
            this.body = body == null ? "" : body;
            return self();
        }

        @Override
        BodyPublisher bodyPublisher() {
            return BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        JdkGetRequestBuilder(String path) {
            super("GET", path);
        }
    }

    private class JdkDeleteRequestBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        JdkDeleteRequestBuilder(String path) {
            super("DELETE", path);
        }
    }

    private class JdkPostRequestBuilder extends JdkBodyRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        JdkPostRequestBuilder(String path) {
            super("POST", path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            return setBody(body);
        }
    }

    private class JdkPutRequestBuilder extends JdkBodyRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        JdkPutRequestBuilder(String path) {
            super("PUT", path);
        }

        @Override
        public PutRequestBuilder body(@Nullable String body) {
            return setBody(body);
        }
    }

    private record JdkHttpResponse(int statusCode, String body) implements HttpResponse {

        JdkHttpResponse(int statusCode, @Nullable String body) {
            this.statusCode = statusCode;
            this.body = body == null ? "" : body;
        }
    }
}
