package io.trello.client.model;

import java.util.List;
import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.net.QueryStrings;
import org.jspecify.annotations.Nullable;

/**
 * A callback Trello calls when the model it watches changes.
 */
public class Webhook extends BasicData {

    public static final EntityType<Webhook> TYPE = EntityType.builder(Webhook.class, Webhook::new)
            .path("/webhooks")
            .schema(Schema.builder()
                    .attribute("description", "callbackURL", "idModel", "active")
                    .readonly("consecutiveFailures", "firstConsecutiveFailDate")
                    .build())
            .build();

    public Webhook(TrelloClient client) {
        super(client, TYPE);
    }

    public static Webhook find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    /**
     * @return the webhooks registered with the configured token
     * @throws ConfigurationException if no token is configured
     */
    public static List<Webhook> all(TrelloClient client) {
        String token = client.getConfiguration().getAccessToken();
        if (token == null) {
            throw new ConfigurationException("Listing webhooks needs a member token or an OAuth token");
        }
        return client.findMany(TYPE, "/tokens/" + QueryStrings.encode(token) + "/webhooks", Map.of());
    }

    public @Nullable String getDescription() {
        return getString("description");
    }

    public void setDescription(@Nullable String description) {
        setAttribute("description", description);
    }

    public @Nullable String getCallbackUrl() {
        return getString("callbackURL");
    }

    public void setCallbackUrl(String callbackUrl) {
        setAttribute("callbackURL", callbackUrl);
    }

    /**
     * @return the id of the board, card, list or member being watched
     */
    public @Nullable String getModelId() {
        return getString("idModel");
    }

    public void setModelId(String modelId) {
        setAttribute("idModel", modelId);
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(getBoolean("active"));
    }

    public void setActive(boolean active) {
        setAttribute("active", active);
    }
}
