/*
 * MIT License
 *
 * Copyright (c) 2026 Radio Recorder Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package de.corelogics.radiorec.client.radiko;

import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.AuthSession;
import de.corelogics.radiorec.model.StreamReference;
import de.corelogics.radiorec.time.Timestamps;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a station and a mode into a playable {@link StreamReference}.
 * <p>
 * Every call builds a fresh reference, nothing is cached: the token inside expires.
 */
@Log4j2
@RequiredArgsConstructor
public class RadikoStreamResolver {
    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    public StreamReference resolve(
        @NonNull String station,
        @NonNull StreamMode mode,
        TimeWindow window,
        @NonNull AuthSession session) throws StreamResolutionHttpException, StreamResolutionFormatException {
        switch (mode) {
            case LIVE:
                return resolveLive(station, session);
            case TIME_FREE:
                if (null == window) {
                    throw new StreamResolutionFormatException("Time-free playback of " + station + " needs a time window");
                }
                return resolveTimeFree(station, window, session);
            default:
                throw new IllegalArgumentException("Unknown mode " + mode);
        }
    }

    public StreamReference resolveLive(@NonNull String station, @NonNull AuthSession session)
        throws StreamResolutionHttpException, StreamResolutionFormatException {
        val playlistUrl = livePlaylistUrl(station);
        log.debug("Fetching live playlist {}", playlistUrl);
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder())
            .url(playlistUrl)
            .header(RadikoAuthenticator.HEADER_AUTH_TOKEN, session.token())
            .get()
            .build();
        final String playlist;
        try (val response = httpClient.newCall(request).execute()) {
            playlist = HttpUtils.successfulBody(response);
        } catch (IOException e) {
            throw new StreamResolutionHttpException("Could not fetch live playlist of " + station + ": " + e.getMessage(), e);
        }
        val streamUrl = findSubPlaylist(playlist, mainConfiguration.livePlaylistMarkers())
            .map(line -> toAbsolute(playlistUrl, line))
            .orElseThrow(() -> new StreamResolutionFormatException(
                "Live playlist of " + station + " contains no line marked with any of "
                    + mainConfiguration.livePlaylistMarkers()));
        log.info("Resolved live stream of {} to {}", station, streamUrl);
        return authenticated(streamUrl, session);
    }

    public StreamReference resolveTimeFree(
        @NonNull String station,
        @NonNull TimeWindow window,
        @NonNull AuthSession session) throws StreamResolutionFormatException {
        if (!Timestamps.isCanonical(window.from()) || !Timestamps.isCanonical(window.to())) {
            throw new StreamResolutionFormatException(
                "Time window " + window.from() + "-" + window.to() + " is not in yyyyMMddHHmmss format");
        }
        // both ends carry a date, a window crossing midnight is still ascending
        if (window.from().compareTo(window.to()) >= 0) {
            throw new StreamResolutionFormatException(
                "Time window " + window.from() + "-" + window.to() + " does not end after its start");
        }
        val streamUrl = mainConfiguration.radikoBaseUrl() + "/v2/api/ts/playlist.m3u8"
            + "?station_id=" + station
            + "&l=15"
            + "&ft=" + window.from()
            + "&to=" + window.to();
        log.info("Resolved time-free stream of {} to {}", station, streamUrl);
        return authenticated(streamUrl, session);
    }

    String livePlaylistUrl(String station) {
        return mainConfiguration.radikoStreamBaseUrl() + "/" + station + "/_definst_/simul-stream.stream/playlist.m3u8";
    }

    /**
     * First line that is neither blank nor a comment and contains one of the markers.
     */
    static Optional<String> findSubPlaylist(String playlist, List<String> markers) {
        return playlist.lines()
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("#"))
            .filter(line -> markers.stream().anyMatch(line::contains))
            .findFirst();
    }

    static String toAbsolute(String playlistUrl, String line) {
        if (line.startsWith("http://") || line.startsWith("https://")) {
            return line;
        }
        return baseDir(playlistUrl) + "/" + line;
    }

    static String baseDir(String url) {
        var withoutQuery = url;
        val queryStart = withoutQuery.indexOf('?');
        if (queryStart >= 0) {
            withoutQuery = withoutQuery.substring(0, queryStart);
        }
        return withoutQuery.substring(0, withoutQuery.lastIndexOf('/'));
    }

    private static StreamReference authenticated(String streamUrl, AuthSession session)
        throws StreamResolutionFormatException {
        try {
            return new StreamReference(
                URI.create(streamUrl),
                Map.of(RadikoAuthenticator.HEADER_AUTH_TOKEN, session.token()));
        } catch (IllegalArgumentException e) {
            throw new StreamResolutionFormatException("Not a valid stream url: " + streamUrl);
        }
    }
}
