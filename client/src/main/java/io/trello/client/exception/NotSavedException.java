package io.trello.client.exception;

/**
 * Thrown when an operation needs the id of an entity that has not been created on
 * Trello yet, e.g. deleting or refreshing an unsaved card.
 */
public class NotSavedException extends TrelloException {

    public NotSavedException(final String msg) {
        super(msg);
    }
}
