package io.trello.client.net;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import io.trello.client.config.TrelloConfiguration;
import io.trello.client.exception.ConfigurationException;
import io.trello.client.http.HttpClientBuilder;
import io.trello.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the HTTP transport a client sends its requests through.
 * <p>
 * In order of precedence: the builder injected in the configuration, the transport named
 * in the configuration, then the first entry of {@link #PRIORITY} that is installed.
 * Installed transports are the {@link HttpClientBuilder} services visible to
 * {@link ServiceLoader}.
 */
public final class HttpClients {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClients.class);

    /**
     * Transport names, most preferred first.
     */
    public static final List<String> PRIORITY = List.of("vertx", "jdk");

    private static final Map<String, String> ARTIFACTS = Map.of(
            "vertx", "trello-java-extras-http-client-vertx",
            "jdk", "trello-java-http-client");

    private HttpClients() {
    }

    public static HttpClientBuilder resolve(TrelloConfiguration configuration) {
        Assert.checkNotNullParam("configuration", configuration);
        HttpClientBuilder injected = configuration.getHttpClientBuilder();
        if (injected != null) {
            return injected;
        }
        String name = configuration.getHttpClientName();
        if (name != null) {
            return byName(name, installed());
        }
        return firstInstalled(PRIORITY, installed());
    }

    /**
     * @param priority transport names, most preferred first
     * @param installed the transports available
     * @return the installed transport that comes first in {@code priority}
     * @throws ConfigurationException if none of them is installed
     */
    public static HttpClientBuilder firstInstalled(List<String> priority, Collection<HttpClientBuilder> installed) {
        for (String name : priority) {
            for (HttpClientBuilder candidate : installed) {
                if (name.equals(candidate.name())) {
                    LOGGER.debug("Using HTTP client '{}'", name);
                    return candidate;
                }
            }
            LOGGER.trace("HTTP client '{}' is not installed, trying next", name);
        }
        throw new ConfigurationException("Trello requires one of the HTTP clients " + priority
                + " but none is installed");
    }

    /**
     * @param name the transport name
     * @param installed the transports available
     * @return the installed transport with that name
     * @throws IllegalArgumentException if the name is not a supported transport
     * @throws ConfigurationException if the transport is supported but not installed
     */
    public static HttpClientBuilder byName(String name, Collection<HttpClientBuilder> installed) {
        Assert.checkNotNullParam("name", name);
        for (HttpClientBuilder candidate : installed) {
            if (name.equals(candidate.name())) {
                return candidate;
            }
        }
        String artifact = ARTIFACTS.get(name);
        if (artifact == null) {
            throw new IllegalArgumentException("Unsupported HTTP client: " + name);
        }
        throw new ConfigurationException("Trello tried to use the '" + name + "' HTTP client, but "
                + artifact + " is not on the classpath");
    }

    public static List<HttpClientBuilder> installed() {
        List<HttpClientBuilder> builders = new ArrayList<>();
        ServiceLoader<HttpClientBuilder> loader = ServiceLoader.load(HttpClientBuilder.class, HttpClients.class.getClassLoader());
        loader.stream().forEach(provider -> {
            try {
                builders.add(provider.get());
            } catch (ServiceConfigurationError e) {
                LOGGER.warn("Skipping HTTP client {} that failed to load", provider.type().getName(), e);
            }
        });
        return builders;
    }
}
