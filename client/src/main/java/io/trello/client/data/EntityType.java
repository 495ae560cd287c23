package io.trello.client.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.TrelloClient;
import io.trello.client.association.Association;
import io.trello.client.association.AssociationRegistry;
import io.trello.client.exception.TrelloException;
import io.trello.client.net.QueryStrings;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Everything the client needs to know about one kind of entity: where it lives in the
 * API, which attributes it has, which associations it declares, and how to instantiate it.
 * Each entity class holds exactly one, shared by all its instances.
 *
 * @param <T> the entity class
 */
public final class EntityType<T extends BasicData> {

    private final Class<T> entityClass;
    private final @Nullable String path;
    private final Function<TrelloClient, T> factory;
    private final Schema schema;
    private final AssociationRegistry associations;

    private EntityType(Builder<T> builder) {
        this.entityClass = builder.entityClass;
        this.path = builder.path;
        this.factory = builder.factory;
        this.schema = Assert.checkNotNullParam("schema", builder.schema);
        this.associations = AssociationRegistry.of(builder.associations);
    }

    public static <T extends BasicData> Builder<T> builder(Class<T> entityClass, Function<TrelloClient, T> factory) {
        return new Builder<>(entityClass, factory);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public String getName() {
        return entityClass.getSimpleName();
    }

    /**
     * @return false for entities that only exist below their owner, e.g. card attachments
     */
    public boolean hasPath() {
        return path != null;
    }

    /**
     * @return the collection path, e.g. {@code /boards}
     * @throws UnsupportedOperationException if the entity has no path of its own
     */
    public String getPath() {
        if (path == null) {
            throw new UnsupportedOperationException(getName() + " can only be reached through the entity that owns it");
        }
        return path;
    }

    /**
     * @param id an entity id, or a username for members
     * @return the path of that entity, e.g. {@code /boards/b1}
     * @throws UnsupportedOperationException if the entity has no path of its own
     */
    public String memberPath(String id) {
        return getPath() + "/" + QueryStrings.encode(Assert.checkNotNullParam("id", id));
    }

    public Schema getSchema() {
        return schema;
    }

    public AssociationRegistry getAssociations() {
        return associations;
    }

    public T newInstance(TrelloClient client) {
        return factory.apply(client);
    }

    public T fromJson(TrelloClient client, JsonNode json) {
        T entity = newInstance(client);
        entity.load(json);
        return entity;
    }

    /**
     * @param client the client the entities will use
     * @param json a JSON array, or JSON null for none
     * @return one entity per element, in the order of the array
     */
    public List<T> fromJsonArray(TrelloClient client, JsonNode json) {
        if (json.isNull() || json.isMissingNode()) {
            return List.of();
        }
        if (!json.isArray()) {
            throw new TrelloException("Expected a JSON array of " + getName() + " but got " + json.getNodeType());
        }
        List<T> entities = new ArrayList<>(json.size());
        for (JsonNode element : json) {
            entities.add(fromJson(client, element));
        }
        return Collections.unmodifiableList(entities);
    }

    @Override
    public String toString() {
        return "EntityType[" + getName() + (path != null ? " " + path : "") + "]";
    }

    public static class Builder<T extends BasicData> {
        private final Class<T> entityClass;
        private final Function<TrelloClient, T> factory;
        private @Nullable String path;
        private @Nullable Schema schema;
        private final List<Association<?, ?>> associations = new ArrayList<>();

        private Builder(Class<T> entityClass, Function<TrelloClient, T> factory) {
            this.entityClass = Assert.checkNotNullParam("entityClass", entityClass);
            this.factory = Assert.checkNotNullParam("factory", factory);
        }

        /**
         * Leave unset for entities without a path of their own; they can then be read
         * through associations but not found, saved, refreshed or deleted.
         */
        public Builder<T> path(String path) {
            this.path = Assert.checkNotBlankParam("path", path);
            return this;
        }

        public Builder<T> schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        public Builder<T> associations(Association<?, ?>... associations) {
            Collections.addAll(this.associations, associations);
            return this;
        }

        public EntityType<T> build() {
            return new EntityType<>(this);
        }
    }
}
