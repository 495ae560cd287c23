package io.trello.client.net;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * One call against the Trello API, as built by the client and consumed by an
 * {@link io.trello.client.auth.AuthPolicy} and then the transport.
 *
 * @param method the HTTP method
 * @param baseUrl scheme, host and optional port, e.g. {@code https://api.trello.com}
 * @param path the version-prefixed path without query string, e.g. {@code /1/boards/b1}
 * @param queryParams query parameters in insertion order
 * @param headers request headers
 * @param body the JSON body for POST and PUT, if any
 */
public record TrelloRequest(HttpMethod method, String baseUrl, String path, Map<String, String> queryParams,
                            Map<String, String> headers, @Nullable String body) {

    public TrelloRequest {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("baseUrl", baseUrl);
        Assert.checkNotNullParam("path", path);
        queryParams = Collections.unmodifiableMap(new LinkedHashMap<>(Assert.checkNotNullParam("queryParams", queryParams)));
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(Assert.checkNotNullParam("headers", headers)));
    }

    public TrelloRequest(HttpMethod method, String baseUrl, String path) {
        this(method, baseUrl, path, Map.of(), Map.of(), null);
    }

    /**
     * Adds query parameters. A parameter already on the request keeps its value.
     *
     * @param params the parameters to add
     * @return a new request
     */
    public TrelloRequest withQueryParams(Map<String, String> params) {
        Map<String, String> merged = new LinkedHashMap<>(params);
        merged.putAll(queryParams);
        return new TrelloRequest(method, baseUrl, path, merged, headers, body);
    }

    public TrelloRequest withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new TrelloRequest(method, baseUrl, path, queryParams, merged, body);
    }

    public TrelloRequest withBody(@Nullable String body) {
        return new TrelloRequest(method, baseUrl, path, queryParams, headers, body);
    }

    /**
     * @return path plus encoded query string, relative to {@link #baseUrl()}
     */
    public String relativeUri() {
        if (queryParams.isEmpty()) {
            return path;
        }
        return path + "?" + QueryStrings.format(queryParams);
    }

    public String url() {
        return baseUrl + relativeUri();
    }

    @Override
    public String toString() {
        // Query parameters may carry the API key and token.
        return method + " " + path;
    }
}
