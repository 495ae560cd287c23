package io.trello.client.config;

import java.util.Properties;

import io.trello.client.http.HttpClientBuilder;
import io.trello.util.Assert;
import io.trello.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Credentials and transport settings of one {@link io.trello.client.TrelloClient}.
 * <p>
 * Instances are immutable. Every field is optional on its own, but some calls need a
 * particular combination:
 * <ul>
 *   <li>basic auth: {@code developerPublicKey} for reads, plus {@code memberToken} for writes</li>
 *   <li>OAuth: {@code consumerKey}, {@code consumerSecret} and {@code oauthToken}
 *       ({@code oauthTokenSecret} when the token has one)</li>
 * </ul>
 * Trello's application key and its secret double as OAuth consumer credentials, so when no
 * consumer key or secret is configured, {@code developerPublicKey} and
 * {@code developerPublicKeySecret} are used in their place.
 * The transport is either injected with {@link TrelloConfigurationBuilder#httpClientBuilder},
 * picked by name with {@link TrelloConfigurationBuilder#httpClient}, or, when neither is set,
 * the first installed implementation in priority order.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TrelloConfiguration configuration = TrelloConfiguration.builder()
 *     .consumerKey(CONSUMER_KEY)
 *     .consumerSecret(CONSUMER_SECRET)
 *     .oauthToken(TOKEN)
 *     .oauthTokenSecret(TOKEN_SECRET)
 *     .build();
 * }</pre>
 */
public final class TrelloConfiguration {

    public static final String DEFAULT_API_URL = "https://api.trello.com";

    public static final String CONSUMER_KEY = "trello.consumer_key";
    public static final String CONSUMER_SECRET = "trello.consumer_secret";
    public static final String OAUTH_TOKEN = "trello.oauth_token";
    public static final String OAUTH_TOKEN_SECRET = "trello.oauth_token_secret";
    public static final String DEVELOPER_PUBLIC_KEY = "trello.developer_public_key";
    public static final String DEVELOPER_PUBLIC_KEY_SECRET = "trello.developer_public_key_secret";
    public static final String MEMBER_TOKEN = "trello.member_token";
    public static final String API_URL = "trello.api_url";
    public static final String HTTP_CLIENT = "trello.http_client";

    private final @Nullable String consumerKey;
    private final @Nullable String consumerSecret;
    private final @Nullable String oauthToken;
    private final @Nullable String oauthTokenSecret;
    private final @Nullable String developerPublicKey;
    private final @Nullable String developerPublicKeySecret;
    private final @Nullable String memberToken;
    private final String apiUrl;
    private final @Nullable String httpClientName;
    private final @Nullable HttpClientBuilder httpClientBuilder;

    TrelloConfiguration(TrelloConfigurationBuilder builder) {
        this.consumerKey = builder.consumerKey;
        this.consumerSecret = builder.consumerSecret;
        this.oauthToken = builder.oauthToken;
        this.oauthTokenSecret = builder.oauthTokenSecret;
        this.developerPublicKey = builder.developerPublicKey;
        this.developerPublicKeySecret = builder.developerPublicKeySecret;
        this.memberToken = builder.memberToken;
        this.apiUrl = stripTrailingSlash(Utils.defaultIfNull(builder.apiUrl, DEFAULT_API_URL));
        this.httpClientName = builder.httpClientName;
        this.httpClientBuilder = builder.httpClientBuilder;
    }

    public static TrelloConfigurationBuilder builder() {
        return new TrelloConfigurationBuilder();
    }

    /**
     * Reads a configuration from {@code trello.*} properties, e.g. a file loaded from the
     * classpath. Blank values are treated as absent.
     *
     * @param properties the properties to read
     * @return the configuration
     */
    public static TrelloConfiguration fromProperties(Properties properties) {
        Assert.checkNotNullParam("properties", properties);
        TrelloConfigurationBuilder builder = builder();
        String value;
        if ((value = property(properties, CONSUMER_KEY)) != null) {
            builder.consumerKey(value);
        }
        if ((value = property(properties, CONSUMER_SECRET)) != null) {
            builder.consumerSecret(value);
        }
        if ((value = property(properties, OAUTH_TOKEN)) != null) {
            builder.oauthToken(value);
        }
        if ((value = property(properties, OAUTH_TOKEN_SECRET)) != null) {
            builder.oauthTokenSecret(value);
        }
        if ((value = property(properties, DEVELOPER_PUBLIC_KEY)) != null) {
            builder.developerPublicKey(value);
        }
        if ((value = property(properties, DEVELOPER_PUBLIC_KEY_SECRET)) != null) {
            builder.developerPublicKeySecret(value);
        }
        if ((value = property(properties, MEMBER_TOKEN)) != null) {
            builder.memberToken(value);
        }
        if ((value = property(properties, API_URL)) != null) {
            builder.apiUrl(value);
        }
        if ((value = property(properties, HTTP_CLIENT)) != null) {
            builder.httpClient(value);
        }
        return builder.build();
    }

    private static @Nullable String property(Properties properties, String key) {
        String value = properties.getProperty(key);
        return Utils.isBlank(value) ? null : value.trim();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public @Nullable String getConsumerKey() {
        return consumerKey;
    }

    public @Nullable String getConsumerSecret() {
        return consumerSecret;
    }

    public @Nullable String getOauthToken() {
        return oauthToken;
    }

    public @Nullable String getOauthTokenSecret() {
        return oauthTokenSecret;
    }

    public @Nullable String getDeveloperPublicKey() {
        return developerPublicKey;
    }

    public @Nullable String getDeveloperPublicKeySecret() {
        return developerPublicKeySecret;
    }

    /**
     * @return the consumer key OAuth signs with, falling back to the developer public key
     */
    public @Nullable String getOAuthConsumerKey() {
        return consumerKey != null ? consumerKey : developerPublicKey;
    }

    /**
     * @return the consumer secret OAuth signs with, falling back to the developer public key secret
     */
    public @Nullable String getOAuthConsumerSecret() {
        return consumerSecret != null ? consumerSecret : developerPublicKeySecret;
    }

    public @Nullable String getMemberToken() {
        return memberToken;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public @Nullable String getHttpClientName() {
        return httpClientName;
    }

    public @Nullable HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    /**
     * @return true when an OAuth token is configured, which selects OAuth signing
     */
    public boolean isOAuth() {
        return oauthToken != null;
    }

    /**
     * @return the token that authorizes requests, OAuth or member token, if any
     */
    public @Nullable String getAccessToken() {
        return oauthToken != null ? oauthToken : memberToken;
    }

    @Override
    public String toString() {
        // Secrets stay out of logs.
        return "TrelloConfiguration{" +
                "apiUrl='" + apiUrl + '\'' +
                ", oauth=" + isOAuth() +
                ", developerPublicKey=" + (developerPublicKey != null ? "<set>" : "<unset>") +
                ", httpClient=" + (httpClientBuilder != null ? httpClientBuilder.name() : httpClientName) +
                '}';
    }
}
