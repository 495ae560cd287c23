package io.trello.client.auth;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OAuthSignatureTest {

    // Published example from Twitter's "Creating a signature" guide.
    private static final String URL = "https://api.twitter.com/1.1/statuses/update.json";
    private static final String CONSUMER_SECRET = "kAcSOqF21Fu85e7zjz7ZN2U4ZRhfV3WpwPAoE3Z7kBw";
    private static final String TOKEN_SECRET = "LswwdoUaIvS8ltyTt5jkRh4J50vUPVVHtR2YPi5kE";

    private static Map<String, String> params() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("status", "Hello Ladies + Gentlemen, a signed OAuth request!");
        params.put("include_entities", "true");
        params.put("oauth_consumer_key", "xvz1evFS4wEEPTGEFPHBog");
        params.put("oauth_nonce", "kYjzVBB8Y0ZFabxSWbWovY3uYSQ2pTgmZeNu2VS4cg");
        params.put("oauth_signature_method", "HMAC-SHA1");
        params.put("oauth_timestamp", "1318622958");
        params.put("oauth_token", "370773112-GmHxMAgYyLbNEtIKZeRNFsMKPR9EyMZeS9weJAEb");
        params.put("oauth_version", "1.0");
        return params;
    }

    @Test
    public void testKnownSignature() {
        assertEquals("hCtSmYh+iHYCEqBWrE7C7hYmtUk=",
                OAuthSignature.sign("POST", URL, params(), CONSUMER_SECRET, TOKEN_SECRET));
    }

    @Test
    public void testParametersAreSortedAndEncoded() {
        assertEquals("include_entities=true&oauth_consumer_key=xvz1evFS4wEEPTGEFPHBog"
                        + "&oauth_nonce=kYjzVBB8Y0ZFabxSWbWovY3uYSQ2pTgmZeNu2VS4cg&oauth_signature_method=HMAC-SHA1"
                        + "&oauth_timestamp=1318622958&oauth_token=370773112-GmHxMAgYyLbNEtIKZeRNFsMKPR9EyMZeS9weJAEb"
                        + "&oauth_version=1.0&status=Hello%20Ladies%20%2B%20Gentlemen%2C%20a%20signed%20OAuth%20request%21",
                OAuthSignature.normalizeParameters(params()));
    }

    @Test
    public void testBaseString() {
        String baseString = OAuthSignature.baseString("post", URL, Map.of("a", "1"));

        assertEquals("POST&https%3A%2F%2Fapi.twitter.com%2F1.1%2Fstatuses%2Fupdate.json&a%3D1", baseString);
    }

    @Test
    public void testUrlNormalization() {
        assertEquals("https://api.trello.com/1/boards", OAuthSignature.normalizeUrl("HTTPS://API.Trello.com:443/1/boards"));
        assertEquals("http://localhost:8080/1/boards", OAuthSignature.normalizeUrl("http://localhost:8080/1/boards"));
        assertEquals("http://example.com/", OAuthSignature.normalizeUrl("http://example.com"));
    }
}
