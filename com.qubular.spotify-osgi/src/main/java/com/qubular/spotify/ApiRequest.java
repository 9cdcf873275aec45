package com.qubular.spotify;

import org.eclipse.jetty.http.HttpMethod;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An authenticated call to the Web API. Targets may be absolute, or relative to the configured API server.
 */
public final class ApiRequest {
    private final HttpMethod method;
    private final URI target;
    private final Set<String> requiredScopes;
    private final boolean playerEndpoint;
    private final Object body;

    private ApiRequest(HttpMethod method, URI target, Set<String> requiredScopes, boolean playerEndpoint, Object body) {
        this.method = method;
        this.target = target;
        this.requiredScopes = requiredScopes;
        this.playerEndpoint = playerEndpoint;
        this.body = body;
    }

    public static ApiRequest get(String target) {
        return of(HttpMethod.GET, URI.create(target));
    }

    public static ApiRequest put(String target) {
        return of(HttpMethod.PUT, URI.create(target));
    }

    public static ApiRequest post(String target) {
        return of(HttpMethod.POST, URI.create(target));
    }

    public static ApiRequest delete(String target) {
        return of(HttpMethod.DELETE, URI.create(target));
    }

    public static ApiRequest of(HttpMethod method, URI target) {
        return new ApiRequest(method, target, Collections.emptySet(), false, null);
    }

    /**
     * @return a copy that requires the token to have been granted the given scopes.
     */
    public ApiRequest withScopes(String... scopes) {
        Set<String> combined = new LinkedHashSet<>(requiredScopes);
        combined.addAll(Scopes.of(scopes));
        return new ApiRequest(method, target, Collections.unmodifiableSet(combined), playerEndpoint, body);
    }

    /**
     * @return a copy marked as a player call, for which 404 means there is no active device.
     */
    public ApiRequest player() {
        return new ApiRequest(method, target, requiredScopes, true, body);
    }

    /**
     * @param body serialized as the JSON request body.
     */
    public ApiRequest withBody(Object body) {
        return new ApiRequest(method, target, requiredScopes, playerEndpoint, body);
    }

    public ApiRequest withQueryParam(String name, String value) {
        return withTarget(URIHelper.withQueryParam(target, name, value));
    }

    public ApiRequest withTarget(URI newTarget) {
        return new ApiRequest(method, newTarget, requiredScopes, playerEndpoint, body);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public URI getTarget() {
        return target;
    }

    public Set<String> getRequiredScopes() {
        return requiredScopes;
    }

    public boolean isPlayerEndpoint() {
        return playerEndpoint;
    }

    public Object getBody() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + target;
    }
}
