package io.trello.client.data;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.Association;
import io.trello.client.association.AssociationSlot;
import io.trello.client.association.HasMany;
import io.trello.client.association.HasOne;
import io.trello.client.association.MultiAssociation;
import io.trello.client.exception.NotSavedException;
import io.trello.client.exception.TrelloException;
import io.trello.util.Assert;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of every Trello entity: a schema-checked attribute map with dirty tracking,
 * persistence through the {@link TrelloClient} it was created with, and per-instance
 * caches for the associations its {@link EntityType} declares.
 * <p>
 * Saving an entity without an id creates it and sends every attribute that is set.
 * Saving an entity with an id sends only the attributes changed since the last load or
 * save. Deleting does not clear the in-memory object; drop the reference instead.
 * <p>
 * Two entities are equal when they have the same class and the same id. An entity
 * without an id is only equal to itself.
 * <p>
 * Attribute access is not synchronized. Association caches are, so concurrent first
 * access to an association issues a single request.
 */
public abstract class BasicData {

    private static final Logger LOGGER = LoggerFactory.getLogger(BasicData.class);

    private final TrelloClient client;

    private final EntityType<?> type;

    private final Attributes attributes;

    private final Map<String, AssociationSlot<?>> slots = new HashMap<>();

    protected BasicData(TrelloClient client, EntityType<?> type) {
        this.client = Assert.checkNotNullParam("client", client);
        this.type = Assert.checkNotNullParam("type", type);
        this.attributes = new Attributes(type.getSchema());
    }

    public TrelloClient getClient() {
        return client;
    }

    public EntityType<?> getType() {
        return type;
    }

    /**
     * Replaces all attributes with those of {@code json} and resets dirty tracking.
     *
     * @param json a JSON object as returned by the API
     * @throws TrelloException if {@code json} is not an object
     * @throws IllegalStateException if {@code json} carries a different id than this entity
     */
    public void load(JsonNode json) {
        if (!json.isObject()) {
            throw new TrelloException("Expected a JSON object for " + type.getName() + " but got " + json.getNodeType());
        }
        ObjectNode object = (ObjectNode) json;
        String currentId = getId();
        JsonNode loadedId = object.get(Schema.ID);
        if (currentId != null) {
            if (loadedId == null || loadedId.isNull()) {
                object = object.deepCopy();
                object.put(Schema.ID, currentId);
            } else if (!currentId.equals(loadedId.asText())) {
                throw new IllegalStateException(type.getName() + " " + currentId + " cannot be loaded with id " + loadedId.asText());
            }
        }
        attributes.load(object);
    }

    public @Nullable String getId() {
        return getString(Schema.ID);
    }

    /**
     * @return true once the entity exists on Trello, i.e. has an id
     */
    public boolean isPersisted() {
        return getId() != null;
    }

    public boolean isDirty() {
        return attributes.isDirty();
    }

    /**
     * @return the names of the attributes changed since the last load or save
     */
    public Set<String> getChangedAttributes() {
        return attributes.changed();
    }

    /**
     * @param name a schema attribute
     * @return the raw JSON value, or null if unset
     */
    public @Nullable JsonNode getAttribute(String name) {
        return attributes.get(name);
    }

    /**
     * @return a copy of all attributes currently set
     */
    public ObjectNode getAttributes() {
        return attributes.values();
    }

    protected @Nullable String getString(String name) {
        JsonNode value = attributes.get(name);
        return value == null ? null : value.asText();
    }

    protected @Nullable Boolean getBoolean(String name) {
        JsonNode value = attributes.get(name);
        return value == null ? null : value.asBoolean();
    }

    protected @Nullable Double getDouble(String name) {
        JsonNode value = attributes.get(name);
        return value == null ? null : value.asDouble();
    }

    protected @Nullable Instant getInstant(String name) {
        String value = getString(name);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new TrelloException("Attribute '" + name + "' of " + type.getName() + " is not a timestamp: " + value, e);
        }
    }

    protected List<String> getStringList(String name) {
        JsonNode value = attributes.get(name);
        if (value == null || !value.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            values.add(element.asText());
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @param name a writable schema attribute
     * @param value any value Jackson can turn into JSON, or null to clear it
     * @throws IllegalArgumentException if the attribute is unknown or read-only
     * @throws IllegalStateException if the attribute is create-only and the entity already exists
     */
    protected void setAttribute(String name, @Nullable Object value) {
        AttributeDefinition definition = type.getSchema().require(name);
        if (definition.access() == AttributeDefinition.Access.CREATE_ONLY && isPersisted()) {
            throw new IllegalStateException("Attribute '" + name + "' of " + type.getName() + " can only be set before it is created");
        }
        attributes.set(name, value == null ? null : Utils.OBJECT_MAPPER.valueToTree(value));
    }

    protected void setInstant(String name, @Nullable Instant value) {
        setAttribute(name, value == null ? null : TextNode.valueOf(value.toString()));
    }

    /**
     * Creates the entity if it has no id, otherwise sends the changed attributes.
     * Nothing is sent for a persisted entity without changes.
     */
    public void save() {
        if (isPersisted()) {
            update();
        } else {
            create();
        }
    }

    private void create() {
        ObjectNode payload = Utils.OBJECT_MAPPER.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = attributes.values().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (type.getSchema().require(field.getKey()).isSentOnCreate()) {
                payload.set(field.getKey(), field.getValue());
            }
        }
        LOGGER.debug("Creating {} with attributes {}", type.getName(), fieldNames(payload));
        load(client.post(type.getPath(), payload));
    }

    private void update() {
        String id = requireId("update");
        ObjectNode changes = attributes.changedValues();
        changes.retain(sentOnUpdate(changes));
        if (changes.isEmpty()) {
            LOGGER.debug("{} {} has no changes to save", type.getName(), id);
            return;
        }
        LOGGER.debug("Updating {} {} with attributes {}", type.getName(), id, fieldNames(changes));
        JsonNode response = client.put(type.memberPath(id), changes);
        if (response.isObject() && response.hasNonNull(Schema.ID)) {
            load(response);
        } else {
            attributes.markClean();
        }
    }

    private List<String> sentOnUpdate(ObjectNode changes) {
        List<String> names = new ArrayList<>();
        for (String name : fieldNames(changes)) {
            if (type.getSchema().require(name).isSentOnUpdate()) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<String> fieldNames(ObjectNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    /**
     * Deletes the entity on Trello. The object keeps its attributes.
     *
     * @throws NotSavedException if the entity has no id
     */
    public void delete() {
        client.delete(type.memberPath(requireId("delete")));
    }

    /**
     * Fetches the entity again and loads the result, discarding unsaved changes.
     * Association caches are kept; use {@link #reload(String)} for those.
     *
     * @throws NotSavedException if the entity has no id
     */
    public void refresh() {
        load(client.get(type.memberPath(requireId("refresh"))));
    }

    protected String requireId(String operation) {
        String id = getId();
        if (id == null) {
            throw new NotSavedException("Cannot " + operation + " a " + type.getName() + " that has not been saved");
        }
        return id;
    }

    /**
     * Resolves a single association, at most once per instance until reloaded.
     *
     * @throws NotSavedException if the association is looked up by the id of an unsaved
     *         entity; nothing is cached then
     */
    protected <T extends BasicData> Optional<T> one(HasOne<T> association) {
        AssociationSlot<Optional<T>> slot = slot(association);
        association.checkOwner(this);
        return slot.get(() -> association.resolve(this));
    }

    /**
     * Resolves a collection association, at most once per instance until reloaded.
     *
     * @throws NotSavedException if the entity has not been saved; nothing is cached then
     */
    protected <T extends BasicData> MultiAssociation<T> many(HasMany<T> association) {
        AssociationSlot<MultiAssociation<T>> slot = slot(association);
        association.checkOwner(this);
        return slot.get(() -> association.resolve(this));
    }

    /**
     * Fetches a collection association with extra parameters, e.g. a status filter.
     * Always goes to the API and leaves the cached collection alone.
     */
    protected <T extends BasicData> List<T> many(HasMany<T> association, Map<String, String> params) {
        return association.fetch(this, params);
    }

    /**
     * Forgets the cached value of an association so the next access fetches it again.
     *
     * @param associationName an association declared by this entity type
     * @throws IllegalArgumentException if there is no such association
     */
    public void reload(String associationName) {
        reload(type.getAssociations().require(associationName));
    }

    public void reload(Association<?, ?> association) {
        requireOwn(association);
        AssociationSlot<?> slot;
        synchronized (slots) {
            slot = slots.get(association.getName());
        }
        if (slot != null) {
            slot.reset();
        }
    }

    /**
     * @param associationName an association declared by this entity type
     * @return the state of its cache on this instance
     */
    public AssociationSlot.State getAssociationState(String associationName) {
        type.getAssociations().require(associationName);
        AssociationSlot<?> slot;
        synchronized (slots) {
            slot = slots.get(associationName);
        }
        return slot == null ? AssociationSlot.State.UNRESOLVED : slot.state();
    }

    private void requireOwn(Association<?, ?> association) {
        if (type.getAssociations().get(association.getName()).orElse(null) != association) {
            throw new IllegalArgumentException(association.getName() + " is not an association of " + type.getName());
        }
    }

    @SuppressWarnings("unchecked")
    private <R> AssociationSlot<R> slot(Association<?, R> association) {
        requireOwn(association);
        synchronized (slots) {
            return (AssociationSlot<R>) slots.computeIfAbsent(association.getName(), name -> new AssociationSlot<R>());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        String id = getId();
        return id != null && id.equals(((BasicData) o).getId());
    }

    @Override
    public int hashCode() {
        String id = getId();
        return id == null ? System.identityHashCode(this) : 31 * getClass().hashCode() + id.hashCode();
    }

    @Override
    public String toString() {
        return type.getName() + attributes.values();
    }
}
