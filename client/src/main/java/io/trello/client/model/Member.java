package io.trello.client.model;

import java.util.List;
import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasMany;
import io.trello.client.association.MultiAssociation;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * A Trello user. Members are found by id or by username and cannot be created through
 * the API.
 */
public class Member extends BasicData {

    public static final HasMany<Board> BOARDS = AssociationBuilder.hasMany("boards", () -> Board.TYPE)
            .path("/members/{id}/boards")
            .build();

    public static final HasMany<Card> CARDS = AssociationBuilder.hasMany("cards", () -> Card.TYPE)
            .path("/members/{id}/cards")
            .build();

    public static final HasMany<Organization> ORGANIZATIONS = AssociationBuilder.hasMany("organizations", () -> Organization.TYPE)
            .path("/members/{id}/organizations")
            .build();

    public static final HasMany<Action> ACTIONS = AssociationBuilder.hasMany("actions", () -> Action.TYPE)
            .path("/members/{id}/actions")
            .build();

    public static final HasMany<Notification> NOTIFICATIONS = AssociationBuilder.hasMany("notifications", () -> Notification.TYPE)
            .path("/members/{id}/notifications")
            .build();

    public static final EntityType<Member> TYPE = EntityType.builder(Member.class, Member::new)
            .path("/members")
            .schema(Schema.builder()
                    .attribute("fullName", "username", "initials", "bio")
                    .readonly("avatarHash", "url", "email", "memberType", "confirmed", "idBoards", "idOrganizations")
                    .build())
            .associations(BOARDS, CARDS, ORGANIZATIONS, ACTIONS, NOTIFICATIONS)
            .build();

    public Member(TrelloClient client) {
        super(client, TYPE);
    }

    /**
     * @param idOrUsername a member id or username
     */
    public static Member find(TrelloClient client, String idOrUsername) {
        return client.find(TYPE, idOrUsername);
    }

    /**
     * @return the member the configured token belongs to
     */
    public static Member me(TrelloClient client) {
        return client.me();
    }

    public @Nullable String getFullName() {
        return getString("fullName");
    }

    public void setFullName(String fullName) {
        setAttribute("fullName", fullName);
    }

    public @Nullable String getUsername() {
        return getString("username");
    }

    public void setUsername(String username) {
        setAttribute("username", username);
    }

    public @Nullable String getInitials() {
        return getString("initials");
    }

    public void setInitials(String initials) {
        setAttribute("initials", initials);
    }

    public @Nullable String getBio() {
        return getString("bio");
    }

    public void setBio(@Nullable String bio) {
        setAttribute("bio", bio);
    }

    public @Nullable String getEmail() {
        return getString("email");
    }

    public @Nullable String getUrl() {
        return getString("url");
    }

    public MultiAssociation<Board> boards() {
        return many(BOARDS);
    }

    /**
     * @param filter e.g. {@code open}, {@code closed}, {@code starred} or {@code all}
     */
    public List<Board> boards(String filter) {
        return many(BOARDS, Map.of("filter", filter));
    }

    public MultiAssociation<Card> cards() {
        return many(CARDS);
    }

    public MultiAssociation<Organization> organizations() {
        return many(ORGANIZATIONS);
    }

    public MultiAssociation<Action> actions() {
        return many(ACTIONS);
    }

    public MultiAssociation<Notification> notifications() {
        return many(NOTIFICATIONS);
    }

    /**
     * Always fetched; the cached {@link #notifications()} are left alone.
     */
    public List<Notification> unreadNotifications() {
        return many(NOTIFICATIONS, Map.of("read_filter", "unread"));
    }
}
