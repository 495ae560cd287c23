package io.trello.client.exception;

/**
 * Thrown for a non-2xx response from the Trello API.
 * <p>
 * 4xx statuses mean the request itself is wrong and repeating it will not help.
 * 5xx statuses may be worth retrying later.
 */
public class TrelloApiException extends TrelloException {

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final int status;

    private final String responseBody;

    public TrelloApiException(final int status, final String responseBody) {
        this("Trello API returned status " + status + ": " + abbreviate(responseBody), status, responseBody);
    }

    protected TrelloApiException(final String msg, final int status, final String responseBody) {
        super(msg);
        this.status = status;
        this.responseBody = responseBody;
    }

    /**
     * @return the HTTP status of the failed response
     */
    public int getStatus() {
        return status;
    }

    /**
     * @return the raw body of the failed response, never null
     */
    public String getResponseBody() {
        return responseBody;
    }

    public boolean isClientError() {
        return status >= 400 && status < 500;
    }

    public boolean isServerError() {
        return status >= 500;
    }

    static String abbreviate(String body) {
        if (body.length() <= MAX_BODY_IN_MESSAGE) {
            return body;
        }
        return body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
