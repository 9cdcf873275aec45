package com.qubular.spotify;

import com.qubular.spotify.model.*;
import com.qubular.spotify.paging.Pager;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface SpotifyService {
    Profile getCurrentUserProfile() throws AuthenticationException, IOException;

    /**
     * @param limit page size, 1 to 50.
     */
    Pager<Paging<SavedTrack>> getSavedTracks(int limit);

    void removeSavedTracks(List<String> trackIds) throws AuthenticationException, IOException;

    Pager<FollowedArtists> getFollowedArtists(int limit);

    List<Device> getAvailableDevices() throws AuthenticationException, IOException;

    /**
     * @return the playback state, empty if nothing is playing on any device.
     */
    Optional<PlaybackState> getPlaybackState() throws AuthenticationException, IOException;

    /**
     * @throws SpotifyServiceException with {@link SpotifyError.ErrorType#NO_TARGET} if the device is not available.
     */
    void transferPlayback(String deviceId, boolean play) throws AuthenticationException, IOException;

    /**
     * @param deviceId the device to play on, or null for the active device.
     * @throws SpotifyServiceException with {@link SpotifyError.ErrorType#NO_TARGET} if there is no active device.
     */
    void startPlayback(String deviceId, List<String> uris) throws AuthenticationException, IOException;
}
