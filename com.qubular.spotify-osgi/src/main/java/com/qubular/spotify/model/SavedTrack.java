package com.qubular.spotify.model;

public class SavedTrack {
    private String addedAt;
    private Track track;

    /** For Gson */
    SavedTrack() {
    }

    public SavedTrack(String addedAt, Track track) {
        this.addedAt = addedAt;
        this.track = track;
    }

    public String getAddedAt() {
        return addedAt;
    }

    public Track getTrack() {
        return track;
    }
}
