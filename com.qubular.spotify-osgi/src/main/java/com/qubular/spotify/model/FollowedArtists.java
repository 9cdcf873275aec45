package com.qubular.spotify.model;

/**
 * Envelope of the followed artists endpoint, <code>{"artists": {...}}</code>.
 */
public class FollowedArtists {
    private CursorPaging<Artist> artists;

    /** For Gson */
    FollowedArtists() {
    }

    public FollowedArtists(CursorPaging<Artist> artists) {
        this.artists = artists;
    }

    public CursorPaging<Artist> getArtists() {
        return artists;
    }
}
