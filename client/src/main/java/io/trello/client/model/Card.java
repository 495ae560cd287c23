package io.trello.client.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.AssociationBuilder;
import io.trello.client.association.HasMany;
import io.trello.client.association.HasOne;
import io.trello.client.association.MultiAssociation;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.data.Schema;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A card on a list.
 */
public class Card extends BasicData {

    public static final HasOne<TrelloList> LIST = AssociationBuilder.hasOne("list", () -> TrelloList.TYPE)
            .path("/lists/{idList}")
            .build();

    public static final HasOne<Board> BOARD = AssociationBuilder.hasOne("board", () -> Board.TYPE)
            .path("/boards/{idBoard}")
            .build();

    public static final HasMany<Member> MEMBERS = AssociationBuilder.hasMany("members", () -> Member.TYPE)
            .path("/cards/{id}/members")
            .build();

    public static final HasMany<Checklist> CHECKLISTS = AssociationBuilder.hasMany("checklists", () -> Checklist.TYPE)
            .path("/cards/{id}/checklists")
            .build();

    public static final HasMany<Label> LABELS = AssociationBuilder.hasMany("labels", () -> Label.TYPE)
            .path("/cards/{id}/labels")
            .build();

    public static final HasMany<Action> ACTIONS = AssociationBuilder.hasMany("actions", () -> Action.TYPE)
            .path("/cards/{id}/actions")
            .build();

    public static final HasMany<Attachment> ATTACHMENTS = AssociationBuilder.hasMany("attachments", () -> Attachment.TYPE)
            .path("/cards/{id}/attachments")
            .build();

    public static final HasMany<CustomFieldItem> CUSTOM_FIELD_ITEMS = AssociationBuilder.hasMany("customFieldItems", () -> CustomFieldItem.TYPE)
            .path("/cards/{id}/customFieldItems")
            .build();

    public static final HasMany<CheckItemState> CHECK_ITEM_STATES = AssociationBuilder.hasMany("checkItemStates", () -> CheckItemState.TYPE)
            .path("/cards/{id}/checkItemStates")
            .build();

    public static final HasMany<PluginDatum> PLUGIN_DATA = AssociationBuilder.hasMany("pluginData", () -> PluginDatum.TYPE)
            .path("/cards/{id}/pluginData")
            .build();

    public static final EntityType<Card> TYPE = EntityType.builder(Card.class, Card::new)
            .path("/cards")
            .schema(Schema.builder()
                    .attribute("name", "desc", "closed", "idList", "idBoard", "pos", "due", "dueComplete",
                            "idMembers", "idLabels")
                    .createOnly("idCardSource", "keepFromSource", "urlSource")
                    .readonly("idShort", "url", "shortUrl", "dateLastActivity", "idChecklists", "badges")
                    .build())
            .associations(LIST, BOARD, MEMBERS, CHECKLISTS, LABELS, ACTIONS, ATTACHMENTS, CUSTOM_FIELD_ITEMS,
                    CHECK_ITEM_STATES, PLUGIN_DATA)
            .build();

    public Card(TrelloClient client) {
        super(client, TYPE);
    }

    public static Card find(TrelloClient client, String id) {
        return client.find(TYPE, id);
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

    public @Nullable String getListId() {
        return getString("idList");
    }

    public void setListId(String listId) {
        setAttribute("idList", listId);
    }

    public @Nullable String getBoardId() {
        return getString("idBoard");
    }

    public void setBoardId(String boardId) {
        setAttribute("idBoard", boardId);
    }

    public @Nullable Double getPosition() {
        return getDouble("pos");
    }

    public void setPosition(double position) {
        setAttribute("pos", position);
    }

    /**
     * @param position {@code top} or {@code bottom}
     */
    public void setPosition(String position) {
        setAttribute("pos", position);
    }

    public @Nullable Instant getDue() {
        return getInstant("due");
    }

    public void setDue(@Nullable Instant due) {
        setInstant("due", due);
    }

    public boolean isDueComplete() {
        return Boolean.TRUE.equals(getBoolean("dueComplete"));
    }

    public void setDueComplete(boolean dueComplete) {
        setAttribute("dueComplete", dueComplete);
    }

    public List<String> getMemberIds() {
        return getStringList("idMembers");
    }

    public void setMemberIds(List<String> memberIds) {
        setAttribute("idMembers", memberIds);
    }

    public List<String> getLabelIds() {
        return getStringList("idLabels");
    }

    public void setLabelIds(List<String> labelIds) {
        setAttribute("idLabels", labelIds);
    }

    public @Nullable Integer getShortId() {
        JsonNode value = getAttribute("idShort");
        return value == null ? null : value.asInt();
    }

    public @Nullable String getUrl() {
        return getString("url");
    }

    public @Nullable Instant getLastActivity() {
        return getInstant("dateLastActivity");
    }

    public TrelloList list() {
        return one(LIST).orElseThrow();
    }

    public Board board() {
        return one(BOARD).orElseThrow();
    }

    public MultiAssociation<Member> members() {
        return many(MEMBERS);
    }

    public MultiAssociation<Checklist> checklists() {
        return many(CHECKLISTS);
    }

    public MultiAssociation<Label> labels() {
        return many(LABELS);
    }

    public MultiAssociation<Action> actions() {
        return many(ACTIONS);
    }

    /**
     * @param filter an action type such as {@code commentCard}
     */
    public List<Action> actions(String filter) {
        return many(ACTIONS, Map.of("filter", filter));
    }

    /**
     * Posts a comment. The cached actions are dropped so the next access includes it.
     *
     * @param text the comment text
     * @return the {@code commentCard} action Trello created
     */
    public Action addComment(String text) {
        Assert.checkNotBlankParam("text", text);
        JsonNode response = getClient().post(TYPE.memberPath(requireId("comment on")) + "/actions/comments",
                Map.of("text", text));
        reload(ACTIONS);
        return Action.TYPE.fromJson(getClient(), response);
    }

    /**
     * Moves the card to another list right away and loads the updated card, which drops
     * unsaved changes. Nothing is sent when it is already there.
     *
     * @param list the target list, possibly on another board
     */
    public void moveToList(TrelloList list) {
        String listId = Assert.checkNotNullParam("list id", list.getId());
        if (listId.equals(getListId())) {
            return;
        }
        String id = requireId("move");
        String boardId = list.getBoardId();
        Map<String, String> changes = boardId == null || boardId.equals(getBoardId())
                ? Map.of("idList", listId)
                : Map.of("idList", listId, "idBoard", boardId);
        JsonNode response = getClient().put(TYPE.memberPath(id), changes);
        load(response);
        reload(LIST);
        reload(BOARD);
    }

    /**
     * Assigns a member to the card. The cached members are dropped.
     */
    public void addMember(Member member) {
        String memberId = Assert.checkNotNullParam("member id", member.getId());
        getClient().post(TYPE.memberPath(requireId("add a member to")) + "/idMembers", Map.of("value", memberId));
        reload(MEMBERS);
    }

    public void removeMember(Member member) {
        String memberId = Assert.checkNotNullParam("member id", member.getId());
        getClient().delete(TYPE.memberPath(requireId("remove a member from")) + "/idMembers/" + memberId);
        reload(MEMBERS);
    }

    public MultiAssociation<Attachment> attachments() {
        return many(ATTACHMENTS);
    }

    /**
     * Attaches a link. The cached attachments are dropped.
     *
     * @param url the address to attach
     * @param name the display name, or null to let Trello derive one
     * @return the created attachment
     */
    public Attachment addAttachment(String url, @Nullable String name) {
        Assert.checkNotBlankParam("url", url);
        Map<String, String> body = name == null ? Map.of("url", url) : Map.of("url", url, "name", name);
        JsonNode response = getClient().post(TYPE.memberPath(requireId("attach to")) + "/attachments", body);
        reload(ATTACHMENTS);
        return Attachment.TYPE.fromJson(getClient(), response);
    }

    public void removeAttachment(Attachment attachment) {
        String attachmentId = Assert.checkNotNullParam("attachment id", attachment.getId());
        getClient().delete(TYPE.memberPath(requireId("remove an attachment from")) + "/attachments/" + attachmentId);
        reload(ATTACHMENTS);
    }

    /**
     * @return the values set on this card for the board's custom fields
     */
    public MultiAssociation<CustomFieldItem> customFieldItems() {
        return many(CUSTOM_FIELD_ITEMS);
    }

    /**
     * Sets a text, number, date or checkbox custom field. The cached items are dropped.
     *
     * @param field the custom field
     * @param kind {@code text}, {@code number}, {@code date} or {@code checked}
     * @param value the value in Trello's string form, e.g. {@code "true"} for a checkbox
     */
    public void setCustomFieldValue(CustomField field, String kind, String value) {
        Assert.checkNotBlankParam("kind", kind);
        Assert.checkNotNullParam("value", value);
        putCustomFieldItem(field, Map.of("value", Map.of(kind, value)));
    }

    /**
     * Selects an option of a dropdown custom field.
     */
    public void setCustomFieldOption(CustomField field, CustomField.Option option) {
        putCustomFieldItem(field, Map.of("idValue", option.id()));
    }

    public void clearCustomField(CustomField field) {
        putCustomFieldItem(field, Map.of("value", "", "idValue", ""));
    }

    private void putCustomFieldItem(CustomField field, Map<String, ?> body) {
        String fieldId = Assert.checkNotNullParam("custom field id", field.getId());
        getClient().put(TYPE.memberPath(requireId("set a custom field of")) + "/customField/" + fieldId + "/item", body);
        reload(CUSTOM_FIELD_ITEMS);
    }

    public MultiAssociation<CheckItemState> checkItemStates() {
        return many(CHECK_ITEM_STATES);
    }

    public MultiAssociation<PluginDatum> pluginData() {
        return many(PLUGIN_DATA);
    }
}
