package io.trello.client.model;

import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * Whether one checklist item on a card is done.
 */
public class CheckItemState extends BasicData {

    public static final EntityType<CheckItemState> TYPE = EntityType.builder(CheckItemState.class, CheckItemState::new)
            .schema(Schema.builder()
                    .readonly("idCheckItem", "state")
                    .build())
            .build();

    public CheckItemState(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getCheckItemId() {
        return getString("idCheckItem");
    }

    public boolean isComplete() {
        return "complete".equals(getString("state"));
    }
}
