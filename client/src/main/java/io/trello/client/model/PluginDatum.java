package io.trello.client.model;

import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * Data a Power-Up stored on a card. The value is whatever string the Power-Up wrote.
 */
public class PluginDatum extends BasicData {

    public static final EntityType<PluginDatum> TYPE = EntityType.builder(PluginDatum.class, PluginDatum::new)
            .schema(Schema.builder()
                    .readonly("idPlugin", "scope", "idModel", "value", "access")
                    .build())
            .build();

    public PluginDatum(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getPluginId() {
        return getString("idPlugin");
    }

    public @Nullable String getValue() {
        return getString("value");
    }

    public @Nullable String getAccess() {
        return getString("access");
    }
}
