package io.trello.client.association;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.util.Assert;

/**
 * An ordered collection of related entities, e.g. the cards on a board.
 *
 * @param <T> the target entity class
 */
public final class HasMany<T extends BasicData> extends Association<T, MultiAssociation<T>> {

    HasMany(String name, Supplier<EntityType<T>> target, String pathTemplate, Map<String, String> params) {
        super(name, target, pathTemplate, params);
    }

    @Override
    public MultiAssociation<T> resolve(BasicData owner) {
        return new MultiAssociation<>(owner, this, fetch(owner, Map.of()));
    }

    /**
     * Fetches the collection with extra query parameters. The result is never cached.
     *
     * @param owner the owning entity
     * @param overrides parameters added to, or replacing, the declared ones
     * @return the entities in the order Trello returned them
     */
    public List<T> fetch(BasicData owner, Map<String, String> overrides) {
        Assert.checkNotNullParam("overrides", overrides);
        String path = resolvePath(owner);
        if (path == null) {
            return List.of();
        }
        return new HasManyFetcher<>(getTarget()).fetch(owner.getClient(), path, mergeParams(overrides));
    }
}
