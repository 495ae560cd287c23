package io.trello.client.auth;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import io.trello.client.net.QueryStrings;

/**
 * OAuth 1.0a HMAC-SHA1 signature (RFC 5849, section 3.4).
 */
final class OAuthSignature {

    static final String METHOD = "HMAC-SHA1";

    private static final String ALGORITHM = "HmacSHA1";

    private OAuthSignature() {
    }

    /**
     * @param method the HTTP method
     * @param url the request URL without query string
     * @param params every query and {@code oauth_*} parameter, excluding {@code oauth_signature}
     * @param consumerSecret the consumer secret
     * @param tokenSecret the token secret, empty when there is none
     * @return the Base64 encoded signature
     */
    static String sign(String method, String url, Map<String, String> params, String consumerSecret, String tokenSecret) {
        String baseString = baseString(method, url, params);
        String key = QueryStrings.encode(consumerSecret) + "&" + QueryStrings.encode(tokenSecret);
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available in this JVM", e);
        }
    }

    static String baseString(String method, String url, Map<String, String> params) {
        return method.toUpperCase(Locale.ROOT)
                + "&" + QueryStrings.encode(normalizeUrl(url))
                + "&" + QueryStrings.encode(normalizeParameters(params));
    }

    static String normalizeParameters(Map<String, String> params) {
        List<String[]> encoded = new ArrayList<>();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            encoded.add(new String[] {QueryStrings.encode(entry.getKey()), QueryStrings.encode(entry.getValue())});
        }
        encoded.sort((a, b) -> a[0].equals(b[0]) ? a[1].compareTo(b[1]) : a[0].compareTo(b[0]));
        StringJoiner joiner = new StringJoiner("&");
        for (String[] pair : encoded) {
            joiner.add(pair[0] + "=" + pair[1]);
        }
        return joiner.toString();
    }

    static String normalizeUrl(String url) {
        URI uri = URI.create(url);
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || (port == 80 && "http".equals(scheme))
                || (port == 443 && "https".equals(scheme));
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return scheme + "://" + host + (defaultPort ? "" : ":" + port) + path;
    }
}
