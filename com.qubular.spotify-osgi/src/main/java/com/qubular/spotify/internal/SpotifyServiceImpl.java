package com.qubular.spotify.internal;

import com.google.gson.reflect.TypeToken;
import com.qubular.spotify.*;
import com.qubular.spotify.model.*;
import com.qubular.spotify.paging.LinkExtractors;
import com.qubular.spotify.paging.Pager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.qubular.spotify.Scopes.*;

public class SpotifyServiceImpl implements SpotifyService {
    private static final Logger logger = LoggerFactory.getLogger(SpotifyServiceImpl.class);
    public static final int MAX_PAGE_SIZE = 50;

    private final ApiClient apiClient;

    public SpotifyServiceImpl(AuthFlow flow, SpotifyConfiguration config) {
        this(new ApiClient(flow, config));
    }

    public SpotifyServiceImpl(ApiClient apiClient) {
        this.apiClient = apiClient;
        logger.info("Created Spotify API service using {} flow", apiClient.getFlow().getId());
    }

    private static class DevicesResponse {
        List<Device> devices;
    }

    @Override
    public Profile getCurrentUserProfile() throws AuthenticationException, IOException {
        logger.trace("Fetching current user profile.");
        return apiClient.execute(ApiRequest.get("me").withScopes(USER_READ_PRIVATE), Profile.class)
                .getBody()
                .orElseThrow(() -> new ResponseDecodeException("No profile in response"));
    }

    @Override
    public Pager<Paging<SavedTrack>> getSavedTracks(int limit) {
        ApiRequest request = ApiRequest.get("me/tracks")
                .withQueryParam("limit", Integer.toString(pageSize(limit)))
                .withQueryParam("offset", "0")
                .withScopes(USER_LIBRARY_READ);
        return new Pager<>(apiClient, request, new TypeToken<Paging<SavedTrack>>() {}, LinkExtractors.offset());
    }

    @Override
    public void removeSavedTracks(List<String> trackIds) throws AuthenticationException, IOException {
        logger.trace("Removing {} saved tracks.", trackIds.size());
        apiClient.execute(ApiRequest.delete("me/tracks")
                        .withBody(Collections.singletonMap("ids", trackIds))
                        .withScopes(USER_LIBRARY_MODIFY),
                Void.class);
    }

    @Override
    public Pager<FollowedArtists> getFollowedArtists(int limit) {
        ApiRequest request = ApiRequest.get("me/following")
                .withQueryParam("type", "artist")
                .withQueryParam("limit", Integer.toString(pageSize(limit)))
                .withScopes(USER_FOLLOW_READ);
        return new Pager<>(apiClient, request, new TypeToken<FollowedArtists>() {},
                LinkExtractors.cursor(FollowedArtists::getArtists));
    }

    @Override
    public List<Device> getAvailableDevices() throws AuthenticationException, IOException {
        logger.trace("Fetching available devices.");
        ApiResponse<DevicesResponse> response = apiClient.execute(ApiRequest.get("me/player/devices")
                        .withScopes(USER_READ_PLAYBACK_STATE)
                        .player(),
                DevicesResponse.class);
        return response.getBody()
                .map(r -> r.devices)
                .orElse(Collections.emptyList());
    }

    @Override
    public Optional<PlaybackState> getPlaybackState() throws AuthenticationException, IOException {
        logger.trace("Fetching playback state.");
        return apiClient.execute(ApiRequest.get("me/player")
                        .withScopes(USER_READ_PLAYBACK_STATE)
                        .player(),
                PlaybackState.class)
                .getBody();
    }

    @Override
    public void transferPlayback(String deviceId, boolean play) throws AuthenticationException, IOException {
        logger.debug("Transferring playback to {}", deviceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("device_ids", List.of(deviceId));
        body.put("play", play);
        apiClient.execute(ApiRequest.put("me/player")
                        .withBody(body)
                        .withScopes(USER_MODIFY_PLAYBACK_STATE)
                        .player(),
                Void.class);
    }

    @Override
    public void startPlayback(String deviceId, List<String> uris) throws AuthenticationException, IOException {
        logger.debug("Starting playback of {} items on {}", uris.size(), deviceId == null ? "active device" : deviceId);
        ApiRequest request = ApiRequest.put("me/player/play");
        if (deviceId != null) {
            request = request.withQueryParam("device_id", deviceId);
        }
        apiClient.execute(request.withBody(Collections.singletonMap("uris", uris))
                        .withScopes(USER_MODIFY_PLAYBACK_STATE)
                        .player(),
                Void.class);
    }

    private static int pageSize(int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE + ", got " + limit);
        }
        return limit;
    }
}
