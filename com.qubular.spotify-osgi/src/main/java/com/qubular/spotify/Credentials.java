package com.qubular.spotify;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Static client identity. Carries either a client secret or a PKCE pair, never both.
 */
public final class Credentials {
    public static final String ENV_CLIENT_ID = "CLIENT_ID";
    public static final String ENV_CLIENT_SECRET = "CLIENT_SECRET";

    private final String clientId;
    private final String clientSecret;
    private final PkceChallenge pkce;

    private Credentials(String clientId, String clientSecret, PkceChallenge pkce) {
        if (clientId == null || clientId.isEmpty()) {
            throw new IllegalArgumentException("Client id is required");
        }
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.pkce = pkce;
    }

    public static Credentials withSecret(String clientId, String clientSecret) {
        if (clientSecret == null || clientSecret.isEmpty()) {
            throw new IllegalArgumentException("Client secret is required");
        }
        return new Credentials(clientId, clientSecret, null);
    }

    public static Credentials withPkce(String clientId) {
        return withPkce(clientId, PkceChallenge.generate());
    }

    public static Credentials withPkce(String clientId, PkceChallenge pkce) {
        return new Credentials(clientId, null, Objects.requireNonNull(pkce, "pkce"));
    }

    public static Credentials fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    public static Credentials fromEnvironment(Function<String, String> env) {
        return withSecret(require(env, ENV_CLIENT_ID), require(env, ENV_CLIENT_SECRET));
    }

    public static Credentials pkceFromEnvironment() {
        return pkceFromEnvironment(System::getenv);
    }

    public static Credentials pkceFromEnvironment(Function<String, String> env) {
        return withPkce(require(env, ENV_CLIENT_ID));
    }

    static String require(Function<String, String> env, String name) {
        String value = env.apply(name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Environment variable " + name + " is not set");
        }
        return value;
    }

    public String getClientId() {
        return clientId;
    }

    public Optional<String> getClientSecret() {
        return Optional.ofNullable(clientSecret);
    }

    public Optional<PkceChallenge> getPkce() {
        return Optional.ofNullable(pkce);
    }

    @Override
    public String toString() {
        return "Credentials{" +
                "clientId='" + clientId + '\'' +
                ", clientSecret='" + Token.mask(clientSecret) + '\'' +
                ", pkce=" + pkce +
                '}';
    }
}
