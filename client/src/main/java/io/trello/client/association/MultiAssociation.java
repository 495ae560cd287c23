package io.trello.client.association;

import java.util.AbstractList;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;

import io.trello.client.data.BasicData;
import io.trello.util.Assert;

/**
 * Read-only view of a resolved collection association.
 * <p>
 * {@link #filter(Map)} asks Trello for a different selection of the same association.
 * Filtered results are fetched on each call and do not affect this list.
 *
 * @param <T> the element entity class
 */
public final class MultiAssociation<T extends BasicData> extends AbstractList<T> implements RandomAccess {

    private final BasicData owner;
    private final HasMany<T> association;
    private final List<T> elements;

    MultiAssociation(BasicData owner, HasMany<T> association, List<T> elements) {
        this.owner = Assert.checkNotNullParam("owner", owner);
        this.association = Assert.checkNotNullParam("association", association);
        this.elements = List.copyOf(elements);
    }

    @Override
    public T get(int index) {
        return elements.get(index);
    }

    @Override
    public int size() {
        return elements.size();
    }

    public BasicData getOwner() {
        return owner;
    }

    public HasMany<T> getAssociation() {
        return association;
    }

    /**
     * @param params query parameters, e.g. {@code filter=closed}
     * @return a freshly fetched selection
     */
    public List<T> filter(Map<String, String> params) {
        return association.fetch(owner, params);
    }

    /**
     * Shorthand for Trello's {@code filter} parameter, e.g. {@code open}, {@code closed}, {@code all}.
     */
    public List<T> filter(String filter) {
        return filter(Map.of("filter", Assert.checkNotBlankParam("filter", filter)));
    }
}
