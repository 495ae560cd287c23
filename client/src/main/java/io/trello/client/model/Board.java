package io.trello.client.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

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
 * A Trello board.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Board board = Board.find(client, "b1");
 * for (Card card : board.cards()) {
 *     System.out.println(card.getName());
 * }
 * List<Card> archived = board.cards("closed");
 * }</pre>
 */
public class Board extends BasicData {

    public static final HasMany<Card> CARDS = AssociationBuilder.hasMany("cards", () -> Card.TYPE)
            .path("/boards/{id}/cards")
            .build();

    public static final HasMany<TrelloList> LISTS = AssociationBuilder.hasMany("lists", () -> TrelloList.TYPE)
            .path("/boards/{id}/lists")
            .build();

    public static final HasMany<Member> MEMBERS = AssociationBuilder.hasMany("members", () -> Member.TYPE)
            .path("/boards/{id}/members")
            .build();

    public static final HasMany<Label> LABELS = AssociationBuilder.hasMany("labels", () -> Label.TYPE)
            .path("/boards/{id}/labels")
            .build();

    public static final HasMany<Checklist> CHECKLISTS = AssociationBuilder.hasMany("checklists", () -> Checklist.TYPE)
            .path("/boards/{id}/checklists")
            .build();

    public static final HasMany<Action> ACTIONS = AssociationBuilder.hasMany("actions", () -> Action.TYPE)
            .path("/boards/{id}/actions")
            .build();

    public static final HasMany<CustomField> CUSTOM_FIELDS = AssociationBuilder.hasMany("customFields", () -> CustomField.TYPE)
            .path("/boards/{id}/customFields")
            .build();

    public static final HasOne<Organization> ORGANIZATION = AssociationBuilder.hasOne("organization", () -> Organization.TYPE)
            .path("/organizations/{idOrganization}")
            .optional()
            .build();

    public static final EntityType<Board> TYPE = EntityType.builder(Board.class, Board::new)
            .path("/boards")
            .schema(Schema.builder()
                    .attribute("name", "desc", "closed", "idOrganization", "pinned")
                    .createOnly("idBoardSource", "keepFromSource", "defaultLabels", "defaultLists")
                    .readonly("url", "shortUrl", "starred", "dateLastActivity", "prefs", "labelNames")
                    .build())
            .associations(CARDS, LISTS, MEMBERS, LABELS, CHECKLISTS, ACTIONS, CUSTOM_FIELDS, ORGANIZATION)
            .build();

    public Board(TrelloClient client) {
        super(client, TYPE);
    }

    public static Board find(TrelloClient client, String id) {
        return client.find(TYPE, id);
    }

    /**
     * @return the boards of the member the token belongs to
     */
    public static List<Board> all(TrelloClient client) {
        return client.findMany(TYPE, "/members/me/boards", Map.of());
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    public @Nullable String getDescription() {
        return getString("desc");
    }

    public void setDescription(@Nullable String description) {
        setAttribute("desc", description);
    }

    public boolean isClosed() {
        return Boolean.TRUE.equals(getBoolean("closed"));
    }

    public void setClosed(boolean closed) {
        setAttribute("closed", closed);
    }

    public @Nullable String getOrganizationId() {
        return getString("idOrganization");
    }

    public void setOrganizationId(@Nullable String organizationId) {
        setAttribute("idOrganization", organizationId);
    }

    /**
     * Copies lists and cards from another board when the new board is created.
     */
    public void setSourceBoardId(String sourceBoardId) {
        setAttribute("idBoardSource", sourceBoardId);
    }

    public boolean isStarred() {
        return Boolean.TRUE.equals(getBoolean("starred"));
    }

    public @Nullable String getUrl() {
        return getString("url");
    }

    public @Nullable Instant getLastActivity() {
        return getInstant("dateLastActivity");
    }

    public MultiAssociation<Card> cards() {
        return many(CARDS);
    }

    /**
     * @param filter {@code open}, {@code closed}, {@code visible} or {@code all}
     */
    public List<Card> cards(String filter) {
        return many(CARDS, Map.of("filter", filter));
    }

    public MultiAssociation<TrelloList> lists() {
        return many(LISTS);
    }

    /**
     * @param filter {@code open}, {@code closed} or {@code all}
     */
    public List<TrelloList> lists(String filter) {
        return many(LISTS, Map.of("filter", filter));
    }

    public MultiAssociation<Member> members() {
        return many(MEMBERS);
    }

    public MultiAssociation<Label> labels() {
        return many(LABELS);
    }

    public MultiAssociation<Checklist> checklists() {
        return many(CHECKLISTS);
    }

    public MultiAssociation<Action> actions() {
        return many(ACTIONS);
    }

    public MultiAssociation<CustomField> customFields() {
        return many(CUSTOM_FIELDS);
    }

    /**
     * @return the workspace the board belongs to, empty for personal boards
     */
    public Optional<Organization> organization() {
        return one(ORGANIZATION);
    }
}
