package com.qubular.spotify.model;

public class Profile {
    private String id;
    private String displayName;
    private String email;
    private String country;
    private String product;
    private String uri;
    private Followers followers;

    /** For Gson */
    Profile() {
    }

    public Profile(String id, String displayName, String email, String country, String product, String uri, int followers) {
        this.id = id;
        this.displayName = displayName;
        this.email = email;
        this.country = country;
        this.product = product;
        this.uri = uri;
        this.followers = new Followers();
        this.followers.total = followers;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getEmail() {
        return email;
    }

    public String getCountry() {
        return country;
    }

    public String getProduct() {
        return product;
    }

    public String getUri() {
        return uri;
    }

    public int getFollowers() {
        return followers == null ? 0 : followers.total;
    }

    private static class Followers {
        int total;
    }
}
