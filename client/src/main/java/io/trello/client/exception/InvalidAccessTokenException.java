package io.trello.client.exception;

/**
 * Thrown when Trello answers a signed request with HTTP 401. The credentials were
 * present but rejected (expired, revoked or wrong), so a new token is needed.
 */
public class InvalidAccessTokenException extends TrelloApiException {

    public InvalidAccessTokenException(final String msg, final String responseBody) {
        super(msg, 401, responseBody);
    }
}
