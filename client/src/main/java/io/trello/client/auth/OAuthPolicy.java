package io.trello.client.auth;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.UUID;
import java.util.function.Supplier;

import io.trello.client.config.TrelloConfiguration;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.net.QueryStrings;
import io.trello.client.net.TrelloRequest;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Signs every request with OAuth 1.0a (HMAC-SHA1) and sends the result in the
 * {@code Authorization} header. The signature covers the method, the URL and all query
 * parameters; JSON bodies are not part of it.
 */
public class OAuthPolicy implements AuthPolicy {

    static final String AUTHORIZATION = "Authorization";

    private final @Nullable String consumerKey;
    private final @Nullable String consumerSecret;
    private final @Nullable String token;
    private final String tokenSecret;
    private final Clock clock;
    private final Supplier<String> nonces;

    public OAuthPolicy(TrelloConfiguration configuration) {
        this(configuration, Clock.systemUTC(), () -> UUID.randomUUID().toString().replace("-", ""));
    }

    OAuthPolicy(TrelloConfiguration configuration, Clock clock, Supplier<String> nonces) {
        this.consumerKey = configuration.getOAuthConsumerKey();
        this.consumerSecret = configuration.getOAuthConsumerSecret();
        this.token = configuration.getOauthToken();
        this.tokenSecret = Utils.defaultIfNull(configuration.getOauthTokenSecret(), "");
        this.clock = clock;
        this.nonces = nonces;
    }

    @Override
    public TrelloRequest authorize(TrelloRequest request) {
        if (consumerKey == null || consumerSecret == null) {
            throw new ConfigurationException("OAuth signing needs both a consumer key and a consumer secret");
        }
        if (token == null && request.method().isWrite()) {
            throw new ConfigurationException(request.method() + " " + request.path() + " needs an OAuth token");
        }

        Map<String, String> oauthParams = new LinkedHashMap<>();
        oauthParams.put("oauth_consumer_key", consumerKey);
        oauthParams.put("oauth_nonce", nonces.get());
        oauthParams.put("oauth_signature_method", OAuthSignature.METHOD);
        oauthParams.put("oauth_timestamp", Long.toString(clock.instant().getEpochSecond()));
        if (token != null) {
            oauthParams.put("oauth_token", token);
        }
        oauthParams.put("oauth_version", "1.0");

        Map<String, String> signed = new LinkedHashMap<>(request.queryParams());
        signed.putAll(oauthParams);
        String signature = OAuthSignature.sign(request.method().name(), request.baseUrl() + request.path(),
                signed, consumerSecret, tokenSecret);
        oauthParams.put("oauth_signature", signature);

        return request.withHeader(AUTHORIZATION, header(oauthParams));
    }

    private static String header(Map<String, String> oauthParams) {
        StringJoiner joiner = new StringJoiner(", ", "OAuth ", "");
        for (Map.Entry<String, String> entry : oauthParams.entrySet()) {
            joiner.add(QueryStrings.encode(entry.getKey()) + "=\"" + QueryStrings.encode(entry.getValue()) + "\"");
        }
        return joiner.toString();
    }
}
