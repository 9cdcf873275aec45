package com.qubular.spotify.model;

import java.util.List;

public class Album {
    private String id;
    private String name;
    private String uri;
    private String albumType;
    private String releaseDate;
    private List<Artist> artists;

    /** For Gson */
    Album() {
    }

    public Album(String id, String name, String uri, String albumType, String releaseDate, List<Artist> artists) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.albumType = albumType;
        this.releaseDate = releaseDate;
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

    public String getAlbumType() {
        return albumType;
    }

    public String getReleaseDate() {
        return releaseDate;
    }

    public List<Artist> getArtists() {
        return artists;
    }
}
