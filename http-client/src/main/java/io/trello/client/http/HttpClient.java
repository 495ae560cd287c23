package io.trello.client.http;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal asynchronous HTTP client bound to one base URL.
 * <p>
 * Paths passed to the request methods are appended to the base URL as is, so they must
 * already carry any encoded query string. The returned futures complete with the response
 * for every status code and fail only when no response was received.
 * <p>
 * Closing a client releases the threads and connections it owns. Requests must not be
 * sent after that.
 */
public interface HttpClient extends AutoCloseable {

    /**
     * @param baseUrl scheme, host and optional port of the server
     * @return a client from the always installed {@code jdk} transport
     */
    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    PutRequestBuilder put(String path);

    DeleteRequestBuilder delete(String path);

    @Override
    void close();

    interface RequestBuilder<T extends RequestBuilder<T>> {

        /**
         * Sends the request. The body is fully read before the future completes.
         */
        CompletableFuture<HttpResponse> send();

        /**
         * Sets a header, replacing an earlier value of the same name.
         */
        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {
    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {
    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {

        /**
         * @param body the request body, null for an empty one
         */
        PostRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return body(body).send();
        }
    }

    interface PutRequestBuilder extends RequestBuilder<PutRequestBuilder> {

        PutRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return body(body).send();
        }
    }
}
