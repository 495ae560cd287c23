package io.trello.client.auth;

import java.util.LinkedHashMap;
import java.util.Map;

import io.trello.client.config.TrelloConfiguration;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.net.TrelloRequest;
import org.jspecify.annotations.Nullable;

/**
 * Sends the developer public key and the member token as {@code key} and {@code token}
 * query parameters. Reads can go out with the key alone; writes need the token.
 */
public class BasicAuthPolicy implements AuthPolicy {

    private final @Nullable String developerPublicKey;

    private final @Nullable String memberToken;

    public BasicAuthPolicy(TrelloConfiguration configuration) {
        this(configuration.getDeveloperPublicKey(), configuration.getMemberToken());
    }

    public BasicAuthPolicy(@Nullable String developerPublicKey, @Nullable String memberToken) {
        this.developerPublicKey = developerPublicKey;
        this.memberToken = memberToken;
    }

    @Override
    public TrelloRequest authorize(TrelloRequest request) {
        if (developerPublicKey == null) {
            throw new ConfigurationException("Trello has not been configured: set a developer public key "
                    + "or OAuth consumer credentials");
        }
        if (memberToken == null && request.method().isWrite()) {
            throw new ConfigurationException(request.method() + " " + request.path()
                    + " needs a member token or OAuth credentials");
        }
        Map<String, String> credentials = new LinkedHashMap<>();
        credentials.put("key", developerPublicKey);
        if (memberToken != null) {
            credentials.put("token", memberToken);
        }
        return request.withQueryParams(credentials);
    }
}
