package io.trello.client.model;

import java.util.List;
import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasMany;
import io.trello.client.association.HasOne;
import io.trello.client.association.MultiAssociation;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * A list of cards on a board. Named to stay clear of {@link java.util.List}.
 */
public class TrelloList extends BasicData {

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/boards/{idBoard}")
            .build();

    public static final HasMany<Card> CARDS = AssociationBuilder.hasMany("cards", () -> Card.TYPE)
            .path("/lists/{id}/cards")
            .build();

    public static final HasMany<Action> ACTIONS = AssociationBuilder.hasMany("actions", () -> Action.TYPE)
            .path("/lists/{id}/actions")
            .build();

    public static final EntityType<TrelloList> TYPE = EntityType.builder(TrelloList.class, TrelloList::new)
            .path("/lists")
            .schema(Schema.builder()
                    .attribute("name", "closed", "pos", "idBoard")
                    .createOnly("idListSource")
                    .readonly("subscribed")
                    .build())
            .associations(BOARD, CARDS, ACTIONS)
            .build();

    public TrelloList(TrelloClient client) {
        super(client, TYPE);
    }

    public static TrelloList find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    public boolean isClosed() {
        return Boolean.TRUE.equals(getBoolean("closed"));
    }

    public void setClosed(boolean closed) {
        setAttribute("closed", closed);
    }

    public @Nullable Double getPosition() {
        return getDouble("pos");
    }

    public void setPosition(double position) {
        setAttribute("pos", position);
    }

    public @Nullable String getBoardId() {
        return getString("idBoard");
    }

    public void setBoardId(String boardId) {
        setAttribute("idBoard", boardId);
    }

    public boolean isSubscribed() {
        return Boolean.TRUE.equals(getBoolean("subscribed"));
    }

    public Board board() {
        return one(BOARD).orElseThrow();
    }

    public MultiAssociation<Card> cards() {
        return many(CARDS);
    }

    public List<Card> cards(String filter) {
        return many(CARDS, Map.of("filter", filter));
    }

    public MultiAssociation<Action> actions() {
        return many(ACTIONS);
    }
}
