package io.trello.client.association;

import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;
import io.trello.client.data.EntityType;
import io.trello.client.exception.NotFoundException;
import io.trello.client.exception.TrelloException;
import io.trello.util.Assert;

/**
 * Expects one JSON object. An empty response is absent when the association is optional
 * and {@link NotFoundException} otherwise.
 */
public class HasOneFetcher<T extends BasicData> implements AssociationFetcher<T, Optional<T>> {

    private final EntityType<T> target;

    private final boolean optional;

    public HasOneFetcher(EntityType<T> target, boolean optional) {
        this.target = Assert.checkNotNullParam("target", target);
        this.optional = optional;
    }

    @Override
    public Optional<T> fetch(TrelloClient client, String path, Map<String, String> params) {
        JsonNode json = client.get(path, params);
        if (isEmpty(json)) {
            if (optional) {
                return Optional.empty();
            }
            throw new NotFoundException("No " + target.getName() + " found at " + path);
        }
        if (!json.isObject()) {
            throw new TrelloException("Expected a JSON object at " + path + " but got " + json.getNodeType());
        }
        return Optional.of(target.fromJson(client, json));
    }

    private static boolean isEmpty(JsonNode json) {
        return json.isNull() || json.isMissingNode() || (json.isContainerNode() && json.isEmpty());
    }
}
