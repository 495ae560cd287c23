package io.trello.client.net;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.exception.TrelloException;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Status and body of one API call. The body is decoded to JSON on first use only.
 */
public final class TrelloResponse {

    private final int status;
    private final String body;
    private @Nullable JsonNode json;

    public TrelloResponse(int status, String body) {
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }

    public boolean success() {
        return status >= 200 && status < 300;
    }

    public boolean unauthorized() {
        return status == 401;
    }

    /**
     * @return the decoded body, {@link com.fasterxml.jackson.databind.node.NullNode} when empty
     * @throws TrelloException if the body is not valid JSON
     */
    public JsonNode json() {
        if (json == null) {
            try {
                json = Utils.readTree(body);
            } catch (JsonProcessingException e) {
                throw new TrelloException("Trello returned a body that is not JSON (status " + status + ")", e);
            }
        }
        return json;
    }
}
