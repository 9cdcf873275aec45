package com.qubular.spotify.model;

public class Device {
    private String id;
    private boolean isActive;
    private boolean isPrivateSession;
    private boolean isRestricted;
    private String name;
    private String type;
    private Integer volumePercent;

    /** For Gson */
    Device() {
    }

    public Device(String id, boolean isActive, boolean isPrivateSession, boolean isRestricted, String name, String type, Integer volumePercent) {
        this.id = id;
        this.isActive = isActive;
        this.isPrivateSession = isPrivateSession;
        this.isRestricted = isRestricted;
        this.name = name;
        this.type = type;
        this.volumePercent = volumePercent;
    }

    public String getId() {
        return id;
    }

    public boolean isActive() {
        return isActive;
    }

    public boolean isPrivateSession() {
        return isPrivateSession;
    }

    public boolean isRestricted() {
        return isRestricted;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /**
     * @return the volume, or null if the device does not report one.
     */
    public Integer getVolumePercent() {
        return volumePercent;
    }
}
