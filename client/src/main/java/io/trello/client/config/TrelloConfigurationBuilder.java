package io.trello.client.config;

import io.trello.client.http.HttpClientBuilder;
import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

public class TrelloConfigurationBuilder {

    @Nullable String consumerKey;
    @Nullable String consumerSecret;
    @Nullable String oauthToken;
    @Nullable String oauthTokenSecret;
    @Nullable String developerPublicKey;
    @Nullable String developerPublicKeySecret;
    @Nullable String memberToken;
    @Nullable String apiUrl;
    @Nullable String httpClientName;
    @Nullable HttpClientBuilder httpClientBuilder;

    TrelloConfigurationBuilder() {
    }

    public TrelloConfigurationBuilder consumerKey(String consumerKey) {
        this.consumerKey = Assert.checkNotNullParam("consumerKey", consumerKey);
        return this;
    }

    public TrelloConfigurationBuilder consumerSecret(String consumerSecret) {
        this.consumerSecret = Assert.checkNotNullParam("consumerSecret", consumerSecret);
        return this;
    }

    public TrelloConfigurationBuilder oauthToken(String oauthToken) {
        this.oauthToken = Assert.checkNotNullParam("oauthToken", oauthToken);
        return this;
    }

    public TrelloConfigurationBuilder oauthTokenSecret(String oauthTokenSecret) {
        this.oauthTokenSecret = Assert.checkNotNullParam("oauthTokenSecret", oauthTokenSecret);
        return this;
    }

    public TrelloConfigurationBuilder developerPublicKey(String developerPublicKey) {
        this.developerPublicKey = Assert.checkNotNullParam("developerPublicKey", developerPublicKey);
        return this;
    }

    /**
     * The secret shown next to the developer public key. OAuth signs with it when no
     * consumer secret is set.
     *
     * @param developerPublicKeySecret the application secret
     * @return this builder for method chaining
     */
    public TrelloConfigurationBuilder developerPublicKeySecret(String developerPublicKeySecret) {
        this.developerPublicKeySecret = Assert.checkNotNullParam("developerPublicKeySecret", developerPublicKeySecret);
        return this;
    }

    public TrelloConfigurationBuilder memberToken(String memberToken) {
        this.memberToken = Assert.checkNotNullParam("memberToken", memberToken);
        return this;
    }

    /**
     * Overrides the API host, e.g. to point the client at a stub server.
     *
     * @param apiUrl scheme, host and optional port, without the version segment
     * @return this builder for method chaining
     */
    public TrelloConfigurationBuilder apiUrl(String apiUrl) {
        this.apiUrl = Assert.checkNotBlankParam("apiUrl", apiUrl);
        return this;
    }

    /**
     * Selects an installed HTTP transport by name, e.g. {@code "jdk"} or {@code "vertx"}.
     *
     * @param httpClientName the transport name
     * @return this builder for method chaining
     */
    public TrelloConfigurationBuilder httpClient(String httpClientName) {
        this.httpClientName = Assert.checkNotBlankParam("httpClientName", httpClientName);
        return this;
    }

    /**
     * Uses the given transport as-is, bypassing discovery.
     *
     * @param httpClientBuilder the transport factory
     * @return this builder for method chaining
     */
    public TrelloConfigurationBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        return this;
    }

    public TrelloConfiguration build() {
        return new TrelloConfiguration(this);
    }
}
