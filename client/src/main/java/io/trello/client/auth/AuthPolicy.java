package io.trello.client.auth;

import io.trello.client.config.TrelloConfiguration;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.net.TrelloRequest;

/**
 * Adds credentials to outgoing requests.
 */
public interface AuthPolicy {

    /**
     * @param request the unsigned request
     * @return a request carrying the credentials
     * @throws ConfigurationException if the credentials this request needs are not configured
     */
    TrelloRequest authorize(TrelloRequest request);

    /**
     * Picks the policy matching the configured credentials: an OAuth token selects
     * {@link OAuthPolicy}, anything else {@link BasicAuthPolicy}.
     *
     * @param configuration the client configuration
     * @return the policy
     */
    static AuthPolicy forConfiguration(TrelloConfiguration configuration) {
        if (configuration.isOAuth()) {
            return new OAuthPolicy(configuration);
        }
        return new BasicAuthPolicy(configuration);
    }
}
