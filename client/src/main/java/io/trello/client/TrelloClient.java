package io.trello.client;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.auth.AuthPolicy;
import io.trello.client.config.TrelloConfiguration;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.exception.InvalidAccessTokenException;
import io.trello.client.exception.TransportException;
import io.trello.client.exception.TrelloApiException;
import io.trello.client.exception.TrelloException;
import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpResponse;
import io.trello.client.model.Member;
import io.trello.client.net.HttpClients;
import io.trello.client.net.HttpMethod;
import io.trello.client.net.TrelloRequest;
import io.trello.client.net.TrelloResponse;
import io.trello.util.Assert;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking access to the Trello REST API for one set of credentials.
 * <p>
 * Paths are relative to the API version, so {@code get("/boards/b1")} requests
 * {@code /1/boards/b1}. Every call returns the decoded JSON body or throws a
 * {@link TrelloException}:
 * <ul>
 *   <li>{@link io.trello.client.exception.ConfigurationException} before sending, when no
 *       transport is installed or the credentials the call needs are missing</li>
 *   <li>{@link InvalidAccessTokenException} on HTTP 401</li>
 *   <li>{@link TrelloApiException} on any other non-2xx status</li>
 *   <li>{@link TransportException} when no response arrived</li>
 * </ul>
 * The HTTP transport is chosen on the first call and kept until {@link #close()}, which
 * releases it. Instances are safe to share between threads.
 */
public class TrelloClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrelloClient.class);

    public static final int API_VERSION = 1;

    private static final String VERSION_PREFIX = "/" + API_VERSION;
    private static final String APPLICATION_JSON = "application/json";

    private final TrelloConfiguration configuration;
    private final AuthPolicy authPolicy;
    private volatile @Nullable HttpClient httpClient;
    private boolean closed;

    public TrelloClient(TrelloConfiguration configuration) {
        this(configuration, AuthPolicy.forConfiguration(Assert.checkNotNullParam("configuration", configuration)));
    }

    public TrelloClient(TrelloConfiguration configuration, AuthPolicy authPolicy) {
        this.configuration = Assert.checkNotNullParam("configuration", configuration);
        this.authPolicy = Assert.checkNotNullParam("authPolicy", authPolicy);
    }

    public TrelloConfiguration getConfiguration() {
        return configuration;
    }

    public AuthPolicy getAuthPolicy() {
        return authPolicy;
    }

    public JsonNode get(String path) {
        return get(path, Map.of());
    }

    public JsonNode get(String path, Map<String, String> params) {
        return execute(request(HttpMethod.GET, path, params, null)).json();
    }

    /**
     * @param path the collection or action path
     * @param body a JSON tree or any value Jackson can serialize, e.g. a {@code Map}
     * @return the decoded response
     */
    public JsonNode post(String path, Object body) {
        return execute(request(HttpMethod.POST, path, Map.of(), body)).json();
    }

    public JsonNode put(String path, Object body) {
        return execute(request(HttpMethod.PUT, path, Map.of(), body)).json();
    }

    public JsonNode delete(String path) {
        return execute(request(HttpMethod.DELETE, path, Map.of(), null)).json();
    }

    private TrelloRequest request(HttpMethod method, String path, Map<String, String> params, @Nullable Object body) {
        Assert.checkNotNullParam("path", path);
        Assert.checkNotNullParam("params", params);
        String versioned = VERSION_PREFIX + (path.startsWith("/") ? path : "/" + path);
        return new TrelloRequest(method, configuration.getApiUrl(), versioned, params, Map.of(), toJson(body))
                .withHeader("Accept", APPLICATION_JSON)
                .withHeader("Content-Type", APPLICATION_JSON);
    }

    private static @Nullable String toJson(@Nullable Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String) {
            return (String) body;
        }
        try {
            return Utils.toJson(body);
        } catch (JsonProcessingException e) {
            throw new TrelloException("Failed to serialize request body: " + e.getMessage(), e);
        }
    }

    /**
     * Authorizes and sends a request, then checks the response status.
     *
     * @param request the unsigned request
     * @return the successful response
     */
    public TrelloResponse execute(TrelloRequest request) {
        Assert.checkNotNullParam("request", request);
        TrelloRequest authorized = authPolicy.authorize(request);
        LOGGER.debug("Sending {}", authorized);
        HttpResponse httpResponse = await(authorized, send(authorized));
        TrelloResponse response = new TrelloResponse(httpResponse.statusCode(), httpResponse.body());
        LOGGER.debug("{} returned status {}", authorized, response.status());
        if (response.success()) {
            return response;
        }
        LOGGER.debug("{} failed with status {}: {}", authorized, response.status(), response.body());
        if (response.unauthorized()) {
            throw new InvalidAccessTokenException("Trello rejected the access token for " + authorized, response.body());
        }
        throw new TrelloApiException(response.status(), response.body());
    }

    private CompletableFuture<HttpResponse> send(TrelloRequest request) {
        HttpClient client = httpClient();
        String uri = request.relativeUri();
        switch (request.method()) {
            case GET:
                return client.get(uri).addHeaders(request.headers()).send();
            case POST:
                return client.post(uri).addHeaders(request.headers()).body(request.body()).send();
            case PUT:
                return client.put(uri).addHeaders(request.headers()).body(request.body()).send();
            case DELETE:
                return client.delete(uri).addHeaders(request.headers()).send();
            default:
                throw new IllegalArgumentException("Unsupported method " + request.method());
        }
    }

    private static HttpResponse await(TrelloRequest request, CompletableFuture<HttpResponse> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for " + request, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransportException("Failed to send " + request + ": " + cause, cause);
        }
    }

    HttpClient httpClient() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (this) {
                if (closed) {
                    throw new IllegalStateException(this + " is closed");
                }
                client = httpClient;
                if (client == null) {
                    client = HttpClients.resolve(configuration).create(configuration.getApiUrl());
                    httpClient = client;
                }
            }
        }
        return client;
    }

    /**
     * Closes the HTTP transport, if one was created. Later calls fail with
     * {@link IllegalStateException}. Closing twice does nothing.
     */
    @Override
    public void close() {
        HttpClient client;
        synchronized (this) {
            closed = true;
            client = httpClient;
            httpClient = null;
        }
        if (client != null) {
            LOGGER.debug("Closing the HTTP client of {}", this);
            client.close();
        }
    }

    /**
     * @param type the entity type
     * @param id the entity id, or for members also the username
     * @return the loaded entity
     */
    public <T extends BasicData> T find(EntityType<T> type, String id) {
        return find(type, id, Map.of());
    }

    public <T extends BasicData> T find(EntityType<T> type, String id, Map<String, String> params) {
        return type.fromJson(this, get(type.memberPath(id), params));
    }

    /**
     * @param type the element type
     * @param path a path returning a JSON array, e.g. {@code /members/me/boards}
     * @param params query parameters
     * @return the entities in response order
     */
    public <T extends BasicData> List<T> findMany(EntityType<T> type, String path, Map<String, String> params) {
        return type.fromJsonArray(this, get(path, params));
    }

    /**
     * Creates an entity from attribute values, as if they were set one by one and saved.
     *
     * @param type the entity type
     * @param attributes writable attribute values
     * @return the created entity, loaded from the response
     */
    public <T extends BasicData> T create(EntityType<T> type, Map<String, ?> attributes) {
        Assert.checkNotNullParam("attributes", attributes);
        for (String name : attributes.keySet()) {
            if (!type.getSchema().require(name).isSentOnCreate()) {
                throw new IllegalArgumentException("Attribute '" + name + "' of " + type.getName() + " is read-only");
            }
        }
        return type.fromJson(this, post(type.getPath(), attributes));
    }

    /**
     * @return the member the configured token belongs to
     */
    public Member me() {
        return find(Member.TYPE, "me");
    }

    @Override
    public String toString() {
        return "TrelloClient{" + configuration + "}";
    }
}
