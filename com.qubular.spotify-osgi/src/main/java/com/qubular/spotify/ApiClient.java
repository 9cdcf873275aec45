package com.qubular.spotify;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.eclipse.jetty.client.api.ContentResponse;
import org.eclipse.jetty.client.api.Request;
import org.eclipse.jetty.client.util.StringContentProvider;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.net.URI;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Issues Web API calls with a bearer token from an {@link AuthFlow}, and classifies the responses.
 * <p>
 * Before each call the flow's token is checked. A token lacking the required scopes is replaced by a new exchange
 * for non-interactive flows, and rejected with {@link ReauthenticationRequiredException} for interactive ones.
 * An expired token gets exactly one refresh attempt.
 */
public class ApiClient {
    private static final Logger logger = LoggerFactory.getLogger(ApiClient.class);
    public static final int RATE_LIMIT_EXCEEDED = 429;

    private final AuthFlow flow;
    private final SpotifyConfiguration config;
    private final Gson gson;

    public ApiClient(AuthFlow flow, SpotifyConfiguration config) {
        this.flow = flow;
        this.config = config;
        this.gson = apiGson();
    }

    public AuthFlow getFlow() {
        return flow;
    }

    public <T> ApiResponse<T> execute(ApiRequest request, Class<T> responseType) throws AuthenticationException, IOException {
        return execute(request, (Type) responseType);
    }

    public <T> ApiResponse<T> execute(ApiRequest request, TypeToken<T> responseType) throws AuthenticationException, IOException {
        return execute(request, responseType.getType());
    }

    /**
     * @param responseType the type of the JSON body, or <code>Void.class</code> to discard it.
     */
    public <T> ApiResponse<T> execute(ApiRequest request, Type responseType) throws AuthenticationException, IOException {
        Token token = validToken(request.getRequiredScopes());
        URI endpoint = URI.create(config.getApiServerURI()).resolve(request.getTarget());
        logger.debug("Querying {} {}", request.getMethod(), endpoint);

        ContentResponse response;
        try {
            Request httpRequest = config.getHttpClientProvider().getHttpClient()
                    .newRequest(endpoint)
                    .method(request.getMethod())
                    .header(HttpHeader.AUTHORIZATION, "Bearer " + token.getAccessToken())
                    .accept("application/json");
            if (request.getBody() != null) {
                httpRequest.content(new StringContentProvider("application/json", gson.toJson(request.getBody()), UTF_8));
            }
            response = httpRequest.send();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted calling " + endpoint, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Unable to call " + endpoint, e);
        }

        int status = response.getStatus();
        if (status == HttpStatus.NO_CONTENT_204) {
            return ApiResponse.noContent();
        } else if (HttpStatus.isSuccess(status)) {
            return ApiResponse.of(status, decode(response.getContentAsString(), responseType));
        }
        throw classify(request, response);
    }

    private Token validToken(Set<String> requestScopes) throws AuthenticationException, IOException {
        Set<String> required = new LinkedHashSet<>(flow.getScopes());
        required.addAll(requestScopes);

        Token token = flow.getToken();
        if (token.isEmpty() || !token.hasScopes(required)) {
            if (flow.isInteractive()) {
                throw new ReauthenticationRequiredException(token.isEmpty() ?
                        "Not authorized, " + flow.getId() + " flow has no token" :
                        "Token was not granted scopes " + required);
            }
            logger.debug("Token does not cover {}, requesting a new one", required);
            flow.refresh(token);
            token = flow.getToken();
            if (!token.hasScopes(required)) {
                throw new AuthenticationException("Token was not granted scopes " + required);
            }
        }

        Instant now = config.getClock().instant();
        if (!token.isValid(now)) {
            logger.debug("Token expired at {}, refreshing", token.getExpiresAt());
            try {
                flow.refresh(token);
            } catch (AuthenticationException e) {
                logger.warn("Unable to refresh {} token: {}", flow.getId(), e.getMessage());
                throw new ReauthenticationRequiredException("Unable to refresh expired token", e);
            }
            token = flow.getToken();
            if (!token.isValid(config.getClock().instant())) {
                throw new ReauthenticationRequiredException("Refreshed token is already expired");
            }
        }
        return token;
    }

    @SuppressWarnings("unchecked")
    <T> T decode(String content, Type responseType) throws ResponseDecodeException {
        if (responseType == Void.class) {
            return null;
        }
        if (content == null || content.isBlank() || content.trim().equals("null")) {
            content = isCollection(responseType) ? "[]" : "{}";
        }
        try {
            return (T) gson.fromJson(content, responseType);
        } catch (JsonParseException e) {
            throw new ResponseDecodeException("Unable to decode response as " + responseType.getTypeName(), e);
        }
    }

    private static boolean isCollection(Type type) {
        return Collection.class.isAssignableFrom(TypeToken.get(type).getRawType()) ||
                TypeToken.get(type).getRawType().isArray();
    }

    private SpotifyServiceException classify(ApiRequest request, ContentResponse response) {
        int status = response.getStatus();
        SpotifyError.ErrorType errorType;
        switch (status) {
            case HttpStatus.UNAUTHORIZED_401:
                errorType = SpotifyError.ErrorType.INVALID_TOKEN;
                break;
            case HttpStatus.FORBIDDEN_403:
                errorType = SpotifyError.ErrorType.UNAUTHORIZED;
                break;
            case HttpStatus.NOT_FOUND_404:
                errorType = request.isPlayerEndpoint() ?
                        SpotifyError.ErrorType.NO_TARGET : SpotifyError.ErrorType.NOT_FOUND;
                break;
            case RATE_LIMIT_EXCEEDED:
                errorType = SpotifyError.ErrorType.RATE_LIMITED;
                break;
            case HttpStatus.BAD_REQUEST_400:
                errorType = SpotifyError.ErrorType.BAD_REQUEST;
                break;
            default:
                errorType = SpotifyError.ErrorType.UNKNOWN;
        }

        Long retryAfter = retryAfter(response);
        ErrorEnvelope envelope = null;
        try {
            envelope = gson.fromJson(response.getContentAsString(), ErrorEnvelope.class);
        } catch (JsonParseException e) {
            logger.debug("Error response is not an error envelope: {}", e.getMessage());
        }
        SpotifyError error;
        if (envelope != null && envelope.error != null) {
            error = new SpotifyError(envelope.error.getStatus() == 0 ? status : envelope.error.getStatus(),
                    envelope.error.getMessage(), envelope.error.getReason(), retryAfter);
        } else {
            error = new SpotifyError(status, response.getReason(), null, retryAfter);
        }

        if (errorType == SpotifyError.ErrorType.RATE_LIMITED) {
            logger.warn("Rate limited calling {}, retry after {}s", request, retryAfter);
        } else {
            logger.debug("{} returned {}", request, error);
        }
        return new SpotifyServiceException(errorType, error);
    }

    private static Long retryAfter(ContentResponse response) {
        String header = response.getHeaders().get(HttpHeader.RETRY_AFTER);
        if (header == null) {
            return null;
        }
        try {
            return Long.valueOf(header.trim());
        } catch (NumberFormatException e) {
            logger.debug("Ignoring Retry-After {}", header);
            return null;
        }
    }

    static Gson apiGson() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .create();
    }

    private static class ErrorEnvelope {
        SpotifyError error;
    }
}
