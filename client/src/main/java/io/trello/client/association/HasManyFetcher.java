package io.trello.client.association;

import java.util.List;
import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.util.Assert;

/**
 * Expects a JSON array and keeps the order Trello returns.
 */
public class HasManyFetcher<T extends BasicData> implements AssociationFetcher<T, List<T>> {

    private final EntityType<T> target;

    public HasManyFetcher(EntityType<T> target) {
        this.target = Assert.checkNotNullParam("target", target);
    }

    @Override
    public List<T> fetch(TrelloClient client, String path, Map<String, String> params) {
        return target.fromJsonArray(client, client.get(path, params));
    }
}
