package io.trello.client.model;

import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

public class Label extends BasicData {

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/boards/{idBoard}")
            .build();

    public static final EntityType<Label> TYPE = EntityType.builder(Label.class, Label::new)
            .path("/labels")
            .schema(Schema.builder()
                    .attribute("name", "color")
                    .createOnly("idBoard")
                    .build())
            .associations(BOARD)
            .build();

    public Label(TrelloClient client) {
        super(client, TYPE);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    /**
     * @return e.g. {@code green}, or null for a colorless label
     */
    public @Nullable String getColor() {
        return getString("color");
    }

    public void setColor(@Nullable String color) {
        setAttribute("color", color);
    }

    public @Nullable String getBoardId() {
        return getString("idBoard");
    }

    public void setBoardId(String boardId) {
        setAttribute("idBoard", boardId);
    }

    public Board board() {
        return one(BOARD).orElseThrow();
    }
}
