package io.trello.client.exception;

/**
 * Thrown when a required single association comes back empty.
 */
public class NotFoundException extends TrelloException {

    public NotFoundException(final String msg) {
        super(msg);
    }
}
