package io.trello.client.exception;

/**
 * Base exception for every failure raised by the Trello client.
 * <p>
 * Specialized subclasses describe where the failure originated:
 * <ul>
 *   <li>{@link ConfigurationException} - no usable transport, or credentials missing for the call</li>
 *   <li>{@link InvalidAccessTokenException} - the server rejected the credentials (HTTP 401)</li>
 *   <li>{@link TrelloApiException} - any other non-2xx response</li>
 *   <li>{@link NotFoundException} - a required association resolved to nothing</li>
 *   <li>{@link TransportException} - network failure, DNS failure or timeout</li>
 *   <li>{@link NotSavedException} - the operation needs an entity id that is not there yet</li>
 * </ul>
 * The client never retries. Callers that want retry or backoff decide it from the
 * exception type and, for API errors, from the HTTP status.
 */
public class TrelloException extends RuntimeException {

    /**
     * Creates a new TrelloException with the specified message.
     *
     * @param msg the exception message
     */
    public TrelloException(final String msg) {
        super(msg);
    }

    /**
     * Creates a new TrelloException with the specified message and cause.
     *
     * @param msg the exception message
     * @param cause the underlying cause
     */
    public TrelloException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
