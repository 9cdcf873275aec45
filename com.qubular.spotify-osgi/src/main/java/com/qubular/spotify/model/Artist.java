package com.qubular.spotify.model;

import java.util.List;

public class Artist {
    private String id;
    private String name;
    private String uri;
    private List<String> genres;
    private Integer popularity;

    /** For Gson */
    Artist() {
    }

    public Artist(String id, String name, String uri, List<String> genres, Integer popularity) {
        this.id = id;
        this.name = name;
        this.uri = uri;
        this.genres = genres;
        this.popularity = popularity;
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

    public List<String> getGenres() {
        return genres;
    }

    public Integer getPopularity() {
        return popularity;
    }
}
