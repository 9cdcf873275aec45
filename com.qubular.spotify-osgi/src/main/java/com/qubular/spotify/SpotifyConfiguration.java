package com.qubular.spotify;

import com.qubular.spotify.internal.tokencache.FileTokenCache;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

public interface SpotifyConfiguration {
    String DEFAULT_ACCOUNTS_SERVER_URI = "https://accounts.spotify.com/";
    String DEFAULT_API_SERVER_URI = "https://api.spotify.com/v1/";

    default String getAccountsServerURI() {
        return DEFAULT_ACCOUNTS_SERVER_URI;
    }

    default String getApiServerURI() {
        return DEFAULT_API_SERVER_URI;
    }

    HttpClientProvider getHttpClientProvider();

    /**
     * @return the cache consulted at flow setup and written after each new token. Empty disables caching.
     */
    default Optional<TokenCache> getTokenCache() {
        return Optional.empty();
    }

    default Optional<TokenListener> getTokenListener() {
        return Optional.empty();
    }

    default Clock getClock() {
        return Clock.systemUTC();
    }

    default URI getAuthorizeEndpoint() {
        return URI.create(getAccountsServerURI()).resolve("authorize");
    }

    default URI getTokenEndpoint() {
        return URI.create(getAccountsServerURI()).resolve("api/token");
    }

    static SpotifyConfiguration defaults(Path cacheDirectory, HttpClientProvider httpClientProvider) {
        FileTokenCache tokenCache = new FileTokenCache(cacheDirectory);
        return new SpotifyConfiguration() {
            @Override
            public HttpClientProvider getHttpClientProvider() {
                return httpClientProvider;
            }

            @Override
            public Optional<TokenCache> getTokenCache() {
                return Optional.of(tokenCache);
            }
        };
    }
}
