package io.trello.client.association;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.AbstractTrelloClientTest;
import io.trello.client.TrelloClient;
import io.trello.client.exception.NotFoundException;
import io.trello.client.exception.NotSavedException;
import io.trello.client.exception.TrelloApiException;
import io.trello.client.model.Board;
import io.trello.client.model.Card;
import io.trello.client.model.Organization;
import io.trello.client.model.TrelloList;
import io.trello.util.Utils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

public class AssociationTest extends AbstractTrelloClientTest {

    private TrelloClient client;

    @BeforeEach
    public void createClient() {
        client = client();
    }

    private static JsonNode json(String json) throws Exception {
        return Utils.OBJECT_MAPPER.readTree(json);
    }

    private Board board() throws Exception {
        return Board.TYPE.fromJson(client, json("{\"id\":\"b1\",\"name\":\"Demo\",\"idOrganization\":\"o1\"}"));
    }

    private Card card() throws Exception {
        return Card.TYPE.fromJson(client, json("{\"id\":\"c1\",\"idList\":\"l1\",\"idBoard\":\"b1\"}"));
    }

    @Test
    public void testHasOneIsCached() throws Exception {
        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(okJson("{\"id\":\"l1\",\"name\":\"Todo\"}")));
        Card card = card();

        TrelloList first = card.list();
        TrelloList second = card.list();

        assertSame(first, second);
        assertEquals("Todo", first.getName());
        assertEquals(AssociationSlot.State.RESOLVED, card.getAssociationState("list"));
        verify(1, getRequestedFor(urlPathEqualTo("/1/lists/l1")));
    }

    @Test
    public void testReloadForcesExactlyOneCall() throws Exception {
        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(okJson("{\"id\":\"l1\",\"name\":\"Todo\"}")));
        Card card = card();
        card.list();

        card.reload("list");
        assertEquals(AssociationSlot.State.UNRESOLVED, card.getAssociationState("list"));
        card.list();
        card.list();

        verify(2, getRequestedFor(urlPathEqualTo("/1/lists/l1")));
    }

    @Test
    public void testCachesArePerInstance() throws Exception {
        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(okJson("{\"id\":\"l1\"}")));

        card().list();
        card().list();

        verify(2, getRequestedFor(urlPathEqualTo("/1/lists/l1")));
    }

    @Test
    public void testUnknownAssociation() throws Exception {
        Card card = card();

        assertThrows(IllegalArgumentException.class, () -> card.reload("nope"));
        assertThrows(IllegalArgumentException.class, () -> card.getAssociationState("nope"));
    }

    @Test
    public void testOptionalWithUnsetAttributeMakesNoCall() throws Exception {
        Board board = Board.TYPE.fromJson(client, json("{\"id\":\"b1\"}"));

        assertEquals(Optional.empty(), board.organization());
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testOptionalWithEmptyResponse() throws Exception {
        givenThat(get(urlPathEqualTo("/1/organizations/o1")).willReturn(okJson("{}")));

        assertEquals(Optional.empty(), board().organization());
    }

    @Test
    public void testOptionalPresent() throws Exception {
        givenThat(get(urlPathEqualTo("/1/organizations/o1"))
                .willReturn(okJson("{\"id\":\"o1\",\"displayName\":\"Acme\"}")));

        Optional<Organization> organization = board().organization();

        assertTrue(organization.isPresent());
        assertEquals("Acme", organization.get().getDisplayName());
    }

    @Test
    public void testRequiredWithEmptyResponse() throws Exception {
        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(aResponse().withStatus(200).withBody("")));
        Card card = card();

        assertThrows(NotFoundException.class, card::list);
        assertEquals(AssociationSlot.State.FAILED, card.getAssociationState("list"));
    }

    @Test
    public void testRequiredWithUnsetAttribute() throws Exception {
        Card card = Card.TYPE.fromJson(client, json("{\"id\":\"c1\"}"));

        assertThrows(NotFoundException.class, card::list);
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testFailureIsCachedUntilReload() throws Exception {
        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(aResponse().withStatus(500).withBody("oops")));
        Card card = card();

        assertThrows(TrelloApiException.class, card::list);
        assertThrows(TrelloApiException.class, card::list);
        verify(1, getRequestedFor(urlPathEqualTo("/1/lists/l1")));

        givenThat(get(urlPathEqualTo("/1/lists/l1")).willReturn(okJson("{\"id\":\"l1\"}")));
        card.reload(Card.LIST);

        assertEquals("l1", card.list().getId());
    }

    @Test
    public void testHasManyKeepsServerOrder() throws Exception {
        givenThat(get(urlPathEqualTo("/1/boards/b1/cards"))
                .willReturn(okJson("[{\"id\":\"c3\"},{\"id\":\"c1\"},{\"id\":\"c2\"}]")));

        MultiAssociation<Card> cards = board().cards();

        assertEquals(List.of("c3", "c1", "c2"), cards.stream().map(Card::getId).toList());
        assertThrows(UnsupportedOperationException.class, () -> cards.add(new Card(client)));
    }

    @Test
    public void testHasManyIsCached() throws Exception {
        givenThat(get(urlPathEqualTo("/1/boards/b1/cards")).willReturn(okJson("[{\"id\":\"c1\"}]")));
        Board board = board();

        assertSame(board.cards(), board.cards());
        verify(1, getRequestedFor(urlPathEqualTo("/1/boards/b1/cards")));
    }

    @Test
    public void testFilterIsNeverCached() throws Exception {
        givenThat(get(urlPathEqualTo("/1/boards/b1/cards"))
                .withQueryParam("filter", equalTo("closed"))
                .willReturn(okJson("[{\"id\":\"c9\"}]")));
        givenThat(get(urlPathEqualTo("/1/boards/b1/cards"))
                .withQueryParam("filter", absent())
                .willReturn(okJson("[{\"id\":\"c1\"},{\"id\":\"c2\"}]")));
        Board board = board();

        MultiAssociation<Card> all = board.cards();
        List<Card> closed = board.cards("closed");
        List<Card> closedAgain = all.filter("closed");

        assertEquals(List.of("c9"), closed.stream().map(Card::getId).toList());
        assertEquals(closed, closedAgain);
        assertSame(all, board.cards());
        assertEquals(2, board.cards().size());
        verify(1, getRequestedFor(urlPathEqualTo("/1/boards/b1/cards")).withQueryParam("filter", absent()));
        verify(2, getRequestedFor(urlPathEqualTo("/1/boards/b1/cards")).withQueryParam("filter", equalTo("closed")));
    }

    @Test
    public void testFilterBeforeFirstAccessLeavesCacheUnresolved() throws Exception {
        givenThat(get(urlPathEqualTo("/1/boards/b1/lists")).willReturn(okJson("[]")));
        Board board = board();

        board.lists("closed");

        assertEquals(AssociationSlot.State.UNRESOLVED, board.getAssociationState("lists"));
    }

    @Test
    public void testDeclaredParamsAreSent() throws Exception {
        HasMany<Card> visible = AssociationBuilder.hasMany("visible", () -> Card.TYPE)
                .path("/boards/{id}/cards")
                .param("filter", "visible")
                .param("fields", "name")
                .build();
        givenThat(get(urlPathEqualTo("/1/boards/b1/cards")).willReturn(okJson("[]")));

        visible.fetch(board(), Map.of("filter", "closed"));

        verify(getRequestedFor(urlPathEqualTo("/1/boards/b1/cards"))
                .withQueryParam("filter", equalTo("closed"))
                .withQueryParam("fields", equalTo("name")));
    }

    @Test
    public void testUnsavedOwner() {
        Board board = new Board(client);

        assertThrows(NotSavedException.class, board::cards);
        assertEquals(0, server.getAllServeEvents().size());
    }

    @Test
    public void testUnsavedOwnerCachesNothing() {
        givenThat(post(urlPathEqualTo("/1/boards")).willReturn(okJson("{\"id\":\"b7\",\"name\":\"New\"}")));
        givenThat(get(urlPathEqualTo("/1/boards/b7/cards")).willReturn(okJson("[{\"id\":\"c1\"}]")));
        Board board = new Board(client);
        board.setName("New");

        assertThrows(NotSavedException.class, board::cards);
        assertEquals(AssociationSlot.State.UNRESOLVED, board.getAssociationState("cards"));

        board.save();

        assertEquals(1, board.cards().size());
        assertEquals(AssociationSlot.State.RESOLVED, board.getAssociationState("cards"));
    }

    @Test
    public void testForeignAssociationIsRejected() throws Exception {
        Board board = board();

        assertThrows(IllegalArgumentException.class, () -> board.reload(Card.LIST));
    }

    @Test
    public void testResolvePath() throws Exception {
        assertEquals("/lists/l1", Card.LIST.resolvePath(card()));
        assertEquals("/boards/b1/cards", Board.CARDS.resolvePath(board()));
        assertNull(Board.ORGANIZATION.resolvePath(Board.TYPE.fromJson(client, json("{\"id\":\"b1\"}"))));
    }

    @Test
    public void testBuilderNeedsPath() {
        assertThrows(IllegalStateException.class, () -> AssociationBuilder.hasOne("x", () -> Card.TYPE).build());
    }

    @Test
    public void testRegistry() {
        AssociationRegistry registry = Board.TYPE.getAssociations();

        assertSame(Board.CARDS, registry.require("cards"));
        assertTrue(registry.get("nope").isEmpty());
        assertEquals(List.of("cards", "lists", "members", "labels", "checklists", "actions", "organization"),
                List.copyOf(registry.names()));
        assertThrows(IllegalArgumentException.class, () -> AssociationRegistry.of(List.of(Board.CARDS, Board.CARDS)));
    }
}
