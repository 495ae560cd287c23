package io.trello.client.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A checklist on a card. Its items come with the checklist itself rather than through
 * an association.
 */
public class Checklist extends BasicData {

    public static final HasOne<Card> CARD = AssociationBuilder.hasOne("card", () -> Card.TYPE)
            .path("/cards/{idCard}")
            .build();

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/boards/{idBoard}")
            .optional()
            .build();

    public static final EntityType<Checklist> TYPE = EntityType.builder(Checklist.class, Checklist::new)
            .path("/checklists")
            .schema(Schema.builder()
                    .attribute("name", "pos")
                    .createOnly("idCard", "idChecklistSource")
                    .readonly("idBoard", "checkItems")
                    .build())
            .associations(CARD, BOARD)
            .build();

    public Checklist(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    public @Nullable String getCardId() {
        return getString("idCard");
    }

    public void setCardId(String cardId) {
        setAttribute("idCard", cardId);
    }

    public List<Item> getItems() {
        JsonNode items = getAttribute("checkItems");
        if (items == null || !items.isArray()) {
            return List.of();
        }
        List<Item> result = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            result.add(new Item(item.path("id").asText(), item.path("name").asText(),
                    "complete".equals(item.path("state").asText())));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Adds an item and refreshes the checklist, which drops unsaved changes.
     */
    public void addItem(String name) {
        Assert.checkNotBlankParam("name", name);
        getClient().post(TYPE.memberPath(requireId("add an item to")) + "/checkItems", Map.of("name", name));
        refresh();
    }

    public Card card() {
        return one(CARD).orElseThrow();
    }

    public Optional<Board> board() {
        return one(BOARD);
    }

    /**
     * One entry of a checklist.
     *
     * @param id the item id
     * @param name the item text
     * @param complete whether it is checked
     */
    public record Item(String id, String name, boolean complete) {
    }
}
