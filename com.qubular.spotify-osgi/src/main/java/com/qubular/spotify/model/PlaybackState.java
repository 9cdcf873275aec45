package com.qubular.spotify.model;

public class PlaybackState {
    private Device device;
    private String repeatState;
    private boolean shuffleState;
    private Long progressMs;
    private boolean isPlaying;
    private String currentlyPlayingType;
    private Track item;

    /** For Gson */
    PlaybackState() {
    }

    public PlaybackState(Device device, String repeatState, boolean shuffleState, Long progressMs, boolean isPlaying,
                         String currentlyPlayingType, Track item) {
        this.device = device;
        this.repeatState = repeatState;
        this.shuffleState = shuffleState;
        this.progressMs = progressMs;
        this.isPlaying = isPlaying;
        this.currentlyPlayingType = currentlyPlayingType;
        this.item = item;
    }

    public Device getDevice() {
        return device;
    }

    public String getRepeatState() {
        return repeatState;
    }

    public boolean isShuffleState() {
        return shuffleState;
    }

    public Long getProgressMs() {
        return progressMs;
    }

    public boolean isPlaying() {
        return isPlaying;
    }

    public String getCurrentlyPlayingType() {
        return currentlyPlayingType;
    }

    /**
     * @return the playing track, or null when an episode or an advert is playing.
     */
    public Track getItem() {
        return item;
    }
}
