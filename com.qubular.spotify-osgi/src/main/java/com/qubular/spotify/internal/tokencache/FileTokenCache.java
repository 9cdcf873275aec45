package com.qubular.spotify.internal.tokencache;

import com.google.gson.*;
import com.qubular.spotify.Token;
import com.qubular.spotify.TokenCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Stores each flow's token in its own file, <code>spotify.&lt;flow id&gt;.token</code>, as base64 encoded JSON.
 */
public class FileTokenCache implements TokenCache {
    public static final int CACHE_VERSION = 1;
    private static final Logger logger = LoggerFactory.getLogger(FileTokenCache.class);

    private final Path directory;

    public FileTokenCache(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path pathFor(String flowId) {
        return directory.resolve("spotify." + flowId + ".token");
    }

    @Override
    public Optional<Token> load(String flowId) {
        Path path = pathFor(flowId);
        try {
            String encoded = Files.readString(path, UTF_8).trim();
            String json = new String(Base64.getDecoder().decode(encoded), UTF_8);
            CacheEntry entry = gson().fromJson(json, CacheEntry.class);
            if (entry == null || entry.version != CACHE_VERSION) {
                logger.warn("Ignoring cached token {}, unsupported version {}", path,
                        entry == null ? null : entry.version);
                return Optional.empty();
            }
            if (entry.accessToken == null || entry.tokenType == null || entry.expires == null) {
                logger.warn("Ignoring incomplete cached token {}", path);
                return Optional.empty();
            }
            Token token = new Token(entry.accessToken, entry.tokenType,
                    entry.scopes == null ? new LinkedHashSet<>() : new LinkedHashSet<>(entry.scopes),
                    entry.refreshToken, entry.expires);
            logger.debug("Loaded cached {} token expiring {}", flowId, token.getExpiresAt());
            return Optional.of(token);
        } catch (NoSuchFileException e) {
            logger.debug("No cached token at {}", path);
        } catch (IOException e) {
            logger.warn("Unable to read cached token {}", path, e);
        } catch (IllegalArgumentException | JsonParseException | DateTimeParseException e) {
            logger.warn("Ignoring corrupt cached token {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public void save(String flowId, Token token) throws IOException {
        CacheEntry entry = new CacheEntry();
        entry.version = CACHE_VERSION;
        entry.accessToken = token.getAccessToken();
        entry.tokenType = token.getTokenType();
        entry.scopes = List.copyOf(token.getScopes());
        entry.refreshToken = token.getRefreshToken().orElse(null);
        entry.expires = token.getExpiresAt();
        String encoded = Base64.getEncoder().encodeToString(gson().toJson(entry).getBytes(UTF_8));

        Files.createDirectories(directory);
        Path path = pathFor(flowId);
        Path tmp = Files.createTempFile(directory, "spotify." + flowId, ".tmp");
        try {
            Files.writeString(tmp, encoded, UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.debug("Cached {} token at {}", flowId, path);
    }

    private Gson gson() {
        return new GsonBuilder()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .registerTypeAdapter(Instant.class, new InstantAdapter())
                .create();
    }

    private static class CacheEntry {
        int version;
        String accessToken;
        String tokenType;
        List<String> scopes;
        String refreshToken;
        Instant expires;
    }

    private static class InstantAdapter implements JsonDeserializer<Instant>, JsonSerializer<Instant> {
        @Override
        public Instant deserialize(JsonElement jsonElement, Type type, JsonDeserializationContext jsonDeserializationContext) throws JsonParseException {
            if (!jsonElement.isJsonPrimitive()) {
                throw new JsonParseException("Expected an ISO-8601 instant, got " + jsonElement);
            }
            return Instant.parse(jsonElement.getAsString());
        }

        @Override
        public JsonElement serialize(Instant instant, Type type, JsonSerializationContext jsonSerializationContext) {
            return jsonSerializationContext.serialize(instant.toString());
        }
    }
}
