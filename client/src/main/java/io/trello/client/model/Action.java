package io.trello.client.model;

import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * Something a member did, e.g. create a card or comment on one. Actions are read-only.
 */
public class Action extends BasicData {

    public static final HasOne<Member> MEMBER_CREATOR = AssociationBuilder.hasOne("memberCreator", () -> Member.TYPE)
            .path("/members/{idMemberCreator}")
            .build();

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/actions/{id}/board")
            .optional()
            .build();

    public static final HasOne<Card> CARD = AssociationBuilder.hasOne("card", () -> Card.TYPE)
            .path("/actions/{id}/card")
            .optional()
            .build();

    public static final EntityType<Action> TYPE = EntityType.builder(Action.class, Action::new)
            .path("/actions")
            .schema(Schema.builder()
                    .readonly("type", "date", "data", "idMemberCreator")
                    .build())
            .associations(MEMBER_CREATOR, BOARD, CARD)
            .build();

    public Action(TrelloClient client) {
        super(client, TYPE);
    }

    public static Action find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    /**
     * @return the Trello action type, e.g. {@code createCard} or {@code commentCard}
     */
    public @Nullable String getActionType() {
        return getString("type");
    }

    public @Nullable Instant getDate() {
        return getInstant("date");
    }

    /**
     * @return the action payload, {@link MissingNode} when absent
     */
    public JsonNode getData() {
        JsonNode data = getAttribute("data");
        return data == null ? MissingNode.getInstance() : data;
    }

    /**
     * @return the comment text for {@code commentCard} actions
     */
    public @Nullable String getText() {
        JsonNode text = getData().path("text");
        return text.isTextual() ? text.asText() : null;
    }

    public @Nullable String getMemberCreatorId() {
        return getString("idMemberCreator");
    }

    public Member memberCreator() {
        return one(MEMBER_CREATOR).orElseThrow();
    }

    public Optional<Board> board() {
        return one(BOARD);
    }

    public Optional<Card> card() {
        return one(CARD);
    }
}
