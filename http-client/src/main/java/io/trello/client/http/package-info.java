/**
 * Pluggable HTTP transport used by the Trello client.
 *
 * <p>This package defines the transport contract only. Every implementation sends a
 * request against a base URL and hands back the status code and the fully buffered body,
 * whatever the status is.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.trello.client.http.HttpClient} - request builders for GET, POST, PUT and DELETE</li>
 *   <li>{@link io.trello.client.http.HttpClientBuilder} - factory, discovered via {@link java.util.ServiceLoader}</li>
 *   <li>{@link io.trello.client.http.HttpResponse} - status and body</li>
 * </ul>
 *
 * <h2>Provider System</h2>
 * <ul>
 *   <li>{@code jdk} - {@link io.trello.client.http.jdk.JdkHttpClientBuilder}, backed by {@code java.net.http}, always installed</li>
 *   <li>{@code vertx} - shipped by the {@code trello-java-extras-http-client-vertx} artifact</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://api.trello.com");
 * HttpResponse response = client.get("/1/boards/b1?key=KEY&token=TOKEN")
 *     .addHeader("Accept", "application/json")
 *     .send()
 *     .get();
 * }</pre>
 */
@NullMarked
package io.trello.client.http;

import org.jspecify.annotations.NullMarked;
