package com.qubular.spotify;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Scope names understood by the accounts server.
 */
public final class Scopes {
    public static final String UGC_IMAGE_UPLOAD = "ugc-image-upload";
    public static final String USER_READ_PLAYBACK_STATE = "user-read-playback-state";
    public static final String USER_MODIFY_PLAYBACK_STATE = "user-modify-playback-state";
    public static final String USER_READ_CURRENTLY_PLAYING = "user-read-currently-playing";
    public static final String APP_REMOTE_CONTROL = "app-remote-control";
    public static final String STREAMING = "streaming";
    public static final String PLAYLIST_READ_PRIVATE = "playlist-read-private";
    public static final String PLAYLIST_READ_COLLABORATIVE = "playlist-read-collaborative";
    public static final String PLAYLIST_MODIFY_PRIVATE = "playlist-modify-private";
    public static final String PLAYLIST_MODIFY_PUBLIC = "playlist-modify-public";
    public static final String USER_FOLLOW_MODIFY = "user-follow-modify";
    public static final String USER_FOLLOW_READ = "user-follow-read";
    public static final String USER_READ_PLAYBACK_POSITION = "user-read-playback-position";
    public static final String USER_TOP_READ = "user-top-read";
    public static final String USER_READ_RECENTLY_PLAYED = "user-read-recently-played";
    public static final String USER_LIBRARY_MODIFY = "user-library-modify";
    public static final String USER_LIBRARY_READ = "user-library-read";
    public static final String USER_READ_EMAIL = "user-read-email";
    public static final String USER_READ_PRIVATE = "user-read-private";

    private Scopes() {
    }

    public static Set<String> of(String... scopes) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(scopes)));
    }

    /**
     * Parses a space separated scope list as returned by the token endpoint.
     */
    public static Set<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return Collections.emptySet();
        }
        return of(scope.trim().split("\\s+"));
    }
}
