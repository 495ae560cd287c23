package io.trello.client.http;

import io.trello.client.http.jdk.JdkHttpClientBuilder;

/**
 * Creates {@link HttpClient} instances bound to a base URL.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}, so each one
 * must have a public no-argument constructor and a stable {@link #name()} under which
 * it can be selected.
 */
public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * @return the name this implementation is selected by, e.g. {@code "jdk"}
     */
    String name();

    HttpClient create(String url);
}
