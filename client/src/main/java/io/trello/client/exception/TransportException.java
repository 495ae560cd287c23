package io.trello.client.exception;

/**
 * Network-level failure: timeout, connection refused, DNS resolution, interrupted wait.
 * The request may or may not have reached Trello.
 */
public class TransportException extends TrelloException {

    public TransportException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
