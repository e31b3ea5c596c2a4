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

package de.corelogics.radiorec.config;

import java.time.Duration;
import java.util.List;

public class MainConfiguration {
    private final TypedConfigurationAccessor configAccessor;

    MainConfiguration(TypedConfigurationAccessor configAccessor) {
        this.configAccessor = configAccessor;
    }

    public String radikoBaseUrl() {
        return configAccessor.get("RADIKO_BASE_URL", "https://radiko.jp");
    }

    public String radikoStreamBaseUrl() {
        return configAccessor.get("RADIKO_STREAM_BASE_URL", "https://f-radiko.smartstream.ne.jp");
    }

    public String radikoAreaId() {
        return configAccessor.get("RADIKO_AREA_ID", "JP13");
    }

    public String nhkOndemandBaseUrl() {
        return configAccessor.get("NHK_ONDEMAND_BASE_URL", "https://www.nhk.or.jp/radioondemand/json");
    }

    public String nhkConfigUrl() {
        return configAccessor.get("NHK_CONFIG_URL", "https://www.nhk.or.jp/radio/config/config_web.xml");
    }

    public String nhkArea() {
        return configAccessor.get("NHK_AREA", "tokyo");
    }

    public String ffmpegPath() {
        return configAccessor.get("FFMPEG_PATH", "ffmpeg");
    }

    public String ffmpegLogLevel() {
        return configAccessor.get("FFMPEG_LOGLEVEL", "warning");
    }

    public int captureSafetyMarginSeconds() {
        return configAccessor.get("CAPTURE_SAFETY_MARGIN_SECONDS", 5);
    }

    public int captureWatchdogGraceSeconds() {
        return configAccessor.get("CAPTURE_WATCHDOG_GRACE_SECONDS", 60);
    }

    public Duration httpTimeout() {
        return Duration.ofSeconds(configAccessor.get("HTTP_TIMEOUT_SECONDS", 20));
    }

    public String userAgent() {
        return configAccessor.get(
            "USER_AGENT",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 Chrome/117.0.0.0 Safari/537.36");
    }

    public int retryMaxAttempts() {
        return configAccessor.get("RETRY_MAX_ATTEMPTS", 1);
    }

    public Duration retryBackoff() {
        return Duration.ofMillis(configAccessor.get("RETRY_BACKOFF_MILLIS", 2000L));
    }

    public List<String> livePlaylistMarkers() {
        return configAccessor.getList("LIVE_PLAYLIST_MARKERS", "chunklist");
    }

    public String outputDirectory() {
        return configAccessor.get("OUTPUT_DIRECTORY", ".");
    }

    public String getBuildVersion() {
        var version = configAccessor.get("BUILD_VERSION", "E-SNAPSHOT");
        if (version.equalsIgnoreCase("${project.version}")) {
            // no filtering is applied when using RUN in a IDE
            return "E-SNAPSHOT";
        }
        return version;
    }
}
