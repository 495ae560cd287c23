package io.trello;

import io.trello.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Options of the authorization page a user is sent to.
 *
 * @param key the application key, or null to use the configured developer public key
 * @param name the application name shown to the user
 * @param scope comma-separated subset of {@code read}, {@code write} and {@code account}
 * @param expiration {@code 1hour}, {@code 1day}, {@code 30days} or {@code never}
 * @param responseType {@code token}
 * @param callbackMethod {@code postMessage} or {@code fragment}, if the token should be handed back
 * @param returnUrl where the token is returned to
 */
public record AuthorizationRequest(@Nullable String key, String name, String scope, String expiration,
                                   String responseType, @Nullable String callbackMethod, @Nullable String returnUrl) {

    public static final String DEFAULT_NAME = "Trello Java";
    public static final String DEFAULT_SCOPE = "read,write,account";
    public static final String DEFAULT_EXPIRATION = "never";
    public static final String DEFAULT_RESPONSE_TYPE = "token";

    public AuthorizationRequest {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotBlankParam("scope", scope);
        Assert.checkNotBlankParam("expiration", expiration);
        Assert.checkNotBlankParam("responseType", responseType);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private @Nullable String key;
        private String name = DEFAULT_NAME;
        private String scope = DEFAULT_SCOPE;
        private String expiration = DEFAULT_EXPIRATION;
        private String responseType = DEFAULT_RESPONSE_TYPE;
        private @Nullable String callbackMethod;
        private @Nullable String returnUrl;

        private Builder() {
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder expiration(String expiration) {
            this.expiration = expiration;
            return this;
        }

        public Builder responseType(String responseType) {
            this.responseType = responseType;
            return this;
        }

        public Builder callbackMethod(String callbackMethod) {
            this.callbackMethod = callbackMethod;
            return this;
        }

        public Builder returnUrl(String returnUrl) {
            this.returnUrl = returnUrl;
            return this;
        }

        public AuthorizationRequest build() {
            return new AuthorizationRequest(key, name, scope, expiration, responseType, callbackMethod, returnUrl);
        }
    }
}
