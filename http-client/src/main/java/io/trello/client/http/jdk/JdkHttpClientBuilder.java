package io.trello.client.http.jdk;

import io.trello.client.http.HttpClient;
import io.trello.client.http.HttpClientBuilder;

import java.time.Duration;

import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    public static final String NAME = "jdk";

    private @Nullable Duration connectTimeout;

    private @Nullable Duration requestTimeout;

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public JdkHttpClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout, requestTimeout);
    }
}
