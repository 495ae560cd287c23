package io.trello.client.http;

/**
 * HTTP response wrapper containing status code and response body.
 *
 * <p>Implementations hand back every status code unchanged; deciding what a 401 or a
 * 404 means is up to the caller.
 */
public interface HttpResponse {

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the response body content as a string.
     *
     * @return the response body, may be empty but not null
     */
    String body();
}
