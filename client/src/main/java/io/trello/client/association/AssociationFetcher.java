package io.trello.client.association;

import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.data.BasicData;

/**
 * Performs the API call behind an association and maps the JSON to entities.
 *
 * @param <T> the target entity class
 * @param <R> the mapped result
 */
public interface AssociationFetcher<T extends BasicData, R> {

    /**
     * @param client the client of the owning entity
     * @param path the resolved path, relative to the API version
     * @param params the query parameters
     * @return the mapped result
     */
    R fetch(TrelloClient client, String path, Map<String, String> params);
}
