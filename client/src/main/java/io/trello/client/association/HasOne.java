package io.trello.client.association;

import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.exception.NotFoundException;

/**
 * A single related entity, e.g. the list a card is in.
 * <p>
 * An optional association resolves to an empty value when Trello returns nothing or when
 * the attribute its path refers to is unset, without calling the API in the latter case.
 * A required one raises {@link NotFoundException} instead.
 *
 * @param <T> the target entity class
 */
public final class HasOne<T extends BasicData> extends Association<T, Optional<T>> {

    private final boolean optional;

    HasOne(String name, Supplier<EntityType<T>> target, String pathTemplate, Map<String, String> params, boolean optional) {
        super(name, target, pathTemplate, params);
        this.optional = optional;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public Optional<T> resolve(BasicData owner) {
        String path = resolvePath(owner);
        if (path == null) {
            if (optional) {
                return Optional.empty();
            }
            throw new NotFoundException(owner.getType().getName() + " " + owner.getId() + " has no " + getName());
        }
        return new HasOneFetcher<>(getTarget(), optional).fetch(owner.getClient(), path, getParams());
    }
}
