package io.trello;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.trello.client.TrelloClient;
import io.trello.client.config.TrelloConfiguration;
import io.trello.client.net.HttpClients;
import io.trello.client.net.QueryStrings;
import io.trello.util.Assert;

/**
 * Entry point of the Trello client library.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TrelloClient client = Trello.client(TrelloConfiguration.builder()
 *     .developerPublicKey(KEY)
 *     .memberToken(TOKEN)
 *     .build());
 * Member bob = Member.find(client, "bobtester");
 * bob.boards().forEach(board -> System.out.println(board.getName()));
 * }</pre>
 *
 * A member token is obtained once, by sending the user to {@link #authorizeUrl}.
 */
public final class Trello {

    public static final int API_VERSION = TrelloClient.API_VERSION;

    public static final String API_URL = TrelloConfiguration.DEFAULT_API_URL + "/" + API_VERSION;

    /**
     * Page where developers look up their public key.
     */
    public static final String PUBLIC_KEY_URL = "https://trello.com/app-key";

    public static final String AUTHORIZE_URL = "https://trello.com/" + API_VERSION + "/authorize";

    public static final List<String> HTTP_CLIENT_PRIORITY = HttpClients.PRIORITY;

    private Trello() {
    }

    public static TrelloClient client(TrelloConfiguration configuration) {
        return new TrelloClient(configuration);
    }

    public static String authorizeUrl(TrelloConfiguration configuration) {
        return authorizeUrl(configuration, AuthorizationRequest.builder().build());
    }

    /**
     * Builds the URL a user opens to grant this application a token.
     *
     * @param configuration supplies the developer public key when the request has none
     * @param request the requested scope, expiration and callback behaviour
     * @return the authorization URL
     * @throws IllegalArgumentException if no key is given in either argument
     */
    public static String authorizeUrl(TrelloConfiguration configuration, AuthorizationRequest request) {
        Assert.checkNotNullParam("configuration", configuration);
        Assert.checkNotNullParam("request", request);
        String key = request.key();
        if (key == null) {
            key = configuration.getDeveloperPublicKey();
        }
        if (key == null) {
            throw new IllegalArgumentException("Please configure your Trello public key");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", key);
        params.put("name", request.name());
        params.put("scope", request.scope());
        params.put("expiration", request.expiration());
        params.put("response_type", request.responseType());
        if (request.callbackMethod() != null) {
            params.put("callback_method", request.callbackMethod());
        }
        if (request.returnUrl() != null) {
            params.put("return_url", request.returnUrl());
        }
        return AUTHORIZE_URL + "?" + QueryStrings.format(params);
    }
}
