package io.trello.client.model;

import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasMany;
import io.trello.client.association.MultiAssociation;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import org.jspecify.annotations.Nullable;

/**
 * A Trello workspace.
 */
public class Organization extends BasicData {

    public static final HasMany<Board> BOARDS = AssociationBuilder.hasMany("boards", () -> Board.TYPE)
            .path("/organizations/{id}/boards")
            .build();

    public static final HasMany<Member> MEMBERS = AssociationBuilder.hasMany("members", () -> Member.TYPE)
            .path("/organizations/{id}/members")
            .build();

    public static final HasMany<Action> ACTIONS = AssociationBuilder.hasMany("actions", () -> Action.TYPE)
            .path("/organizations/{id}/actions")
            .build();

    public static final EntityType<Organization> TYPE = EntityType.builder(Organization.class, Organization::new)
            .path("/organizations")
            .schema(Schema.builder()
                    .attribute("name", "displayName", "desc", "website")
                    .readonly("url", "logoHash", "idBoards")
                    .build())
            .associations(BOARDS, MEMBERS, ACTIONS)
            .build();

    public Organization(TrelloClient client) {
        super(client, TYPE);
    }

    public static Organization find(TrelloClient client, String idOrName) {
        return client.find(TYPE, idOrName);
    }

    public @Nullable String getName() {
        return getString("name");
    }

    public void setName(String name) {
        setAttribute("name", name);
    }

    public @Nullable String getDisplayName() {
        return getString("displayName");
    }

    public void setDisplayName(String displayName) {
        setAttribute("displayName", displayName);
    }

    public @Nullable String getDescription() {
        return getString("desc");
    }

    public void setDescription(@Nullable String description) {
        setAttribute("desc", description);
    }

    public @Nullable String getWebsite() {
        return getString("website");
    }

    public void setWebsite(@Nullable String website) {
        setAttribute("website", website);
    }

    public @Nullable String getUrl() {
        return getString("url");
    }

    public MultiAssociation<Board> boards() {
        return many(BOARDS);
    }

    public MultiAssociation<Member> members() {
        return many(MEMBERS);
    }

    public MultiAssociation<Action> actions() {
        return many(ACTIONS);
    }
}
