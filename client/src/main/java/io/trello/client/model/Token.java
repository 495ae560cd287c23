package io.trello.client.model;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasOne;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import io.trello.client.exception.ConfigurationException;
import org.jspecify.annotations.Nullable;

/**
 * An API token a member granted to an application. Tokens are looked up by their
 * value, not by id.
 */
public class Token extends BasicData {

    public static final HasOne<Member> MEMBER = AssociationBuilder.hasOne("member", () -> Member.TYPE)
            .path("/members/{idMember}")
            .build();

    public static final EntityType<Token> TYPE = EntityType.builder(Token.class, Token::new)
            .path("/tokens")
            .schema(Schema.builder()
                    .readonly("identifier", "idMember", "dateCreated", "dateExpires", "permissions")
                    .build())
            .associations(MEMBER)
            .build();

    public Token(TrelloClient client) {
        super(client, TYPE);
    }

    /**
     * @param token the token value
     */
    public static Token find(TrelloClient client, String token) {
        return client.find(TYPE, token);
    }

    /**
     * @return the token the client is configured with
     * @throws ConfigurationException if no token is configured
     */
    public static Token current(TrelloClient client) {
        String token = client.getConfiguration().getAccessToken();
        if (token == null) {
            throw new ConfigurationException("Looking up the current token needs a member token or an OAuth token");
        }
        return find(client, token);
    }

    /**
     * @return the name of the application the token was granted to
     */
    public @Nullable String getIdentifier() {
        return getString("identifier");
    }

    public @Nullable String getMemberId() {
        return getString("idMember");
    }

    public @Nullable Instant getDateCreated() {
        return getInstant("dateCreated");
    }

    /**
     * @return when the token expires, null if it never does
     */
    public @Nullable Instant getDateExpires() {
        return getInstant("dateExpires");
    }

    public JsonNode getPermissions() {
        JsonNode permissions = getAttribute("permissions");
        return permissions == null ? MissingNode.getInstance() : permissions;
    }

    public Member member() {
        return one(MEMBER).orElseThrow();
    }
}
