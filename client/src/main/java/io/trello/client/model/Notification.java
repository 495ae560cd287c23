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
 * Something Trello told the member about, e.g. being added to a card. Only the read
 * flag can be changed.
 */
public class Notification extends BasicData {

    public static final HasOne<Member> MEMBER_CREATOR = AssociationBuilder.hasOne("memberCreator", () -> Member.TYPE)
            .path("/members/{idMemberCreator}")
            .optional()
            .build();

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/notifications/{id}/board")
            .optional()
            .build();

    public static final HasOne<Card> CARD = AssociationBuilder.hasOne("card", () -> Card.TYPE)
            .path("/notifications/{id}/card")
            .optional()
            .build();

    public static final EntityType<Notification> TYPE = EntityType.builder(Notification.class, Notification::new)
            .path("/notifications")
            .schema(Schema.builder()
                    .attribute("unread")
                    .readonly("type", "date", "data", "idMemberCreator")
                    .build())
            .associations(MEMBER_CREATOR, BOARD, CARD)
            .build();

    public Notification(TrelloClient client) {
        super(client, TYPE);
    }

    public static Notification find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    public boolean isUnread() {
        return Boolean.TRUE.equals(getBoolean("unread"));
    }

    public void setUnread(boolean unread) {
        setAttribute("unread", unread);
    }

    /**
     * Clears the unread flag and saves. Does nothing if it is already read.
     */
    public void markAsRead() {
        setUnread(false);
        save();
    }

    /**
     * @return the Trello notification type, e.g. {@code addedToCard}
     */
    public @Nullable String getNotificationType() {
        return getString("type");
    }

    public @Nullable Instant getDate() {
        return getInstant("date");
    }

    public JsonNode getData() {
        JsonNode data = getAttribute("data");
        return data == null ? MissingNode.getInstance() : data;
    }

    public @Nullable String getMemberCreatorId() {
        return getString("idMemberCreator");
    }

    public Optional<Member> memberCreator() {
        return one(MEMBER_CREATOR);
    }

    public Optional<Board> board() {
        return one(BOARD);
    }

    public Optional<Card> card() {
        return one(CARD);
    }
}
