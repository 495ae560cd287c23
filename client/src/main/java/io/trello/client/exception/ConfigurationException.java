package io.trello.client.exception;

/**
 * Thrown when the client cannot issue a request because of how it was set up: no HTTP
 * transport is installed, or the credentials a call needs are absent. Always raised
 * before anything goes over the network.
 */
public class ConfigurationException extends TrelloException {

    public ConfigurationException(final String msg) {
        super(msg);
    }

    public ConfigurationException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
