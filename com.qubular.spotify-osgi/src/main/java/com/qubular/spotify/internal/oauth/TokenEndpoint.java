package com.qubular.spotify.internal.oauth;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.qubular.spotify.*;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.FormContentProvider;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.util.Fields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.eclipse.jetty.http.HttpStatus.OK_200;

/**
 * Posts grant requests to the accounts server's token endpoint and turns the responses into tokens.
 */
public class TokenEndpoint {
    private static final Logger logger = LoggerFactory.getLogger(TokenEndpoint.class);
    private static final Set<String> SECRET_FIELDS = Set.of("code", "refresh_token", "code_verifier", "client_secret");

    private final SpotifyConfiguration config;

    public TokenEndpoint(SpotifyConfiguration config) {
        this.config = config;
    }

    /**
     * @param basicAuthCredentials if present, sent as the <code>Basic</code> authorization header.
     */
    public AccessGrantResponse requestGrant(Fields fields, Credentials basicAuthCredentials) throws AuthenticationException, IOException {
        if (logger.isTraceEnabled()) {
            logger.trace("sending to accounts server {}:", config.getTokenEndpoint());
            fields.forEach(f -> logger.trace("{}={}", f.getName(),
                    SECRET_FIELDS.contains(f.getName()) ? Token.mask(f.getValue()) : f.getValue()));
        }
        ContentResponse response;
        try {
            Request request = config.getHttpClientProvider().getHttpClient()
                    .POST(config.getTokenEndpoint())
                    .content(new FormContentProvider(fields, UTF_8))
                    .accept("application/json");
            if (basicAuthCredentials != null) {
                request.header(HttpHeader.AUTHORIZATION, basicAuthorization(basicAuthCredentials));
            }
            response = request.send();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted requesting access token", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Unable to reach accounts server", e);
        }

        String content = response.getContentAsString();
        ErrorResponse errorResponse = decodeError(content);
        if (errorResponse != null && errorResponse.error != null) {
            logger.warn("Accounts server returned {}: {}", response.getStatus(), errorResponse.error);
            throw new AuthProviderException(errorResponse.error, errorResponse.errorDescription, response.getStatus());
        }
        if (response.getStatus() != OK_200) {
            logger.warn("Accounts server returned status {}", response.getStatus());
            throw new IOException("Accounts server returned status " + response.getStatus());
        }

        AccessGrantResponse grant;
        try {
            grant = gson().fromJson(content, AccessGrantResponse.class);
        } catch (JsonParseException e) {
            throw new ResponseDecodeException("Unable to decode token response", e);
        }
        if (grant == null || grant.accessToken == null || grant.accessToken.isEmpty()) {
            throw new ResponseDecodeException("Token response has no access_token");
        }
        if (grant.expiresIn == null || grant.expiresIn <= 0) {
            throw new ResponseDecodeException("Token response has no valid expires_in");
        }
        logger.debug("Got access token, expiry in {}", grant.expiresIn);
        return grant;
    }

    /**
     * Builds a token from a grant to an authorization or client credentials request.
     *
     * @param requestedScopes granted scopes when the response does not list them.
     */
    public static Token toToken(AccessGrantResponse grant, Set<String> requestedScopes, Instant now) {
        Set<String> scopes = grant.scope == null ? requestedScopes : Scopes.parse(grant.scope);
        return new Token(grant.accessToken,
                grant.tokenType == null ? "Bearer" : grant.tokenType,
                scopes,
                grant.refreshToken,
                now.plusSeconds(grant.expiresIn));
    }

    /**
     * Applies a grant to a refresh request onto the token it replaces.
     */
    public static Token toRefreshedToken(Token previous, AccessGrantResponse grant, Instant now) {
        return previous.refreshed(grant.accessToken,
                grant.tokenType == null ? previous.getTokenType() : grant.tokenType,
                grant.refreshToken,
                now.plusSeconds(grant.expiresIn));
    }

    static String basicAuthorization(Credentials credentials) {
        String secret = credentials.getClientSecret()
                .orElseThrow(() -> new IllegalStateException("Basic authorization needs a client secret"));
        return "Basic " + Base64.getEncoder()
                .encodeToString((credentials.getClientId() + ":" + secret).getBytes(UTF_8));
    }

    private ErrorResponse decodeError(String content) {
        if (content == null || content.isBlank() || !content.trim().startsWith("{")) {
            return null;
        }
        try {
            return gson().fromJson(content, ErrorResponse.class);
        } catch (JsonParseException e) {
            return null;
        }
    }

    private static Gson gson() {
        return new GsonBuilder().setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .create();
    }
}
