package com.qubular.spotify.model;

import java.util.List;

public class Track {
    private String id;
    private String name;
    private String uri;
    private long durationMs;
    private boolean explicit;
    private Album album;
    private List<Artist> artists;

    /** For Gson */
    Track() {
    }

    public Track(String id, String name, String uri, long durationMs, boolean explicit, Album album, List<Artist> artists) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.durationMs = durationMs;
        this.explicit = explicit;
        this.album = album;
        this.artists = artists;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getUri() {
        return uri;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public boolean isExplicit() {
        return explicit;
    }

    public Album getAlbum() {
        return album;
    }

    public List<Artist> getArtists() {
        return artists;
    }
}
