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

package de.corelogics.radiorec.model;

import de.corelogics.radiorec.time.Timestamps;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * One broadcast program, regardless of the service it was listed by.
 * <p>
 * Start and end are canonical {@code yyyyMMddHHmmss} strings whenever the upstream data allowed it.
 * The only state change after construction is {@link #resolveStreamUrl(String)}.
 */
@Getter
@EqualsAndHashCode
public class Program {
    public static final String DEFAULT_AREA = "JP13";

    private static final long MINUTES_PER_DAY = 24 * 60;

    @NonNull
    private final String title;
    @NonNull
    private final String station;
    @NonNull
    private final String startTime;
    @NonNull
    private final String endTime;
    @NonNull
    private final ProgramSource source;
    private final String area;

    @Getter(AccessLevel.NONE)
    private final Integer durationMinutesOverride;

    @Getter(AccessLevel.NONE)
    private final String performer;
    @Getter(AccessLevel.NONE)
    private final String description;
    @Getter(AccessLevel.NONE)
    private final String subtitle;
    @Getter(AccessLevel.NONE)
    private final String imageUrl;
    @Getter(AccessLevel.NONE)
    private final String info;
    @Getter(AccessLevel.NONE)
    private final String url;

    // NHK re-query identifiers and raw availability texts
    @Getter(AccessLevel.NONE)
    private final String seriesSiteId;
    @Getter(AccessLevel.NONE)
    private final String cornerSiteId;
    @Getter(AccessLevel.NONE)
    private final String onairDate;
    @Getter(AccessLevel.NONE)
    private final String closedAt;

    @Getter(AccessLevel.NONE)
    @EqualsAndHashCode.Exclude
    private String streamUrl;

    @Builder
    private Program(
        @NonNull String title,
        @NonNull String station,
        @NonNull String startTime,
        @NonNull String endTime,
        @NonNull ProgramSource source,
        String area,
        Integer durationMinutes,
        String performer,
        String description,
        String subtitle,
        String imageUrl,
        String info,
        String url,
        String seriesSiteId,
        String cornerSiteId,
        String onairDate,
        String closedAt,
        String streamUrl) {
        this.title = title;
        this.station = station;
        this.startTime = startTime;
        this.endTime = endTime;
        this.source = source;
        this.area = blankToNull(area) == null ? DEFAULT_AREA : area;
        this.durationMinutesOverride = durationMinutes;
        this.performer = blankToNull(performer);
        this.description = blankToNull(description);
        this.subtitle = blankToNull(subtitle);
        this.imageUrl = blankToNull(imageUrl);
        this.info = blankToNull(info);
        this.url = blankToNull(url);
        this.seriesSiteId = blankToNull(seriesSiteId);
        this.cornerSiteId = blankToNull(cornerSiteId);
        this.onairDate = blankToNull(onairDate);
        this.closedAt = blankToNull(closedAt);
        this.streamUrl = blankToNull(streamUrl);
    }

    public Optional<String> getPerformer() {
        return Optional.ofNullable(performer);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getSubtitle() {
        return Optional.ofNullable(subtitle);
    }

    public Optional<String> getImageUrl() {
        return Optional.ofNullable(imageUrl);
    }

    public Optional<String> getInfo() {
        return Optional.ofNullable(info);
    }

    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    public Optional<String> getSeriesSiteId() {
        return Optional.ofNullable(seriesSiteId);
    }

    public Optional<String> getCornerSiteId() {
        return Optional.ofNullable(cornerSiteId);
    }

    public Optional<String> getOnairDate() {
        return Optional.ofNullable(onairDate);
    }

    public Optional<String> getClosedAt() {
        return Optional.ofNullable(closedAt);
    }

    public Optional<String> getStreamUrl() {
        return Optional.ofNullable(streamUrl);
    }

    public boolean isRecordable() {
        return null != streamUrl && !streamUrl.isBlank();
    }

    public boolean isRadiko() {
        return source == ProgramSource.RADIKO;
    }

    public boolean isNhk() {
        return source == ProgramSource.NHK;
    }

    /**
     * Back-fills the stream url once it has been resolved.
     *
     * @throws IllegalStateException if a stream url is already present
     */
    public synchronized void resolveStreamUrl(@NonNull String resolvedStreamUrl) {
        if (isRecordable()) {
            throw new IllegalStateException("Stream url of " + this + " was already resolved");
        }
        this.streamUrl = blankToNull(resolvedStreamUrl);
    }

    public Optional<LocalDateTime> getStartDateTime() {
        return Timestamps.parse(startTime);
    }

    public Optional<LocalDateTime> getEndDateTime() {
        return Timestamps.parse(endTime);
    }

    /**
     * Duration in minutes. An explicit duration wins. Otherwise {@code end - start}, where an end before
     * the start is taken as crossing midnight. 0 if the times are not canonical.
     */
    public int getDurationMinutes() {
        if (null != durationMinutesOverride) {
            return durationMinutesOverride;
        }
        var start = getStartDateTime();
        var end = getEndDateTime();
        if (start.isEmpty() || end.isEmpty()) {
            return 0;
        }
        var minutes = ChronoUnit.MINUTES.between(start.get(), end.get());
        return (int) (minutes < 0 ? Math.floorMod(minutes, MINUTES_PER_DAY) : minutes);
    }

    public int getDurationSeconds() {
        return getDurationMinutes() * 60;
    }

    @Override
    public String toString() {
        return "[" + station + "] " + title + " (" + clock(startTime) + "-" + clock(endTime) + ")";
    }

    private static String clock(String timestamp) {
        if (timestamp.length() >= 12) {
            return timestamp.substring(8, 10) + ":" + timestamp.substring(10, 12);
        }
        return timestamp;
    }

    private static String blankToNull(String value) {
        return null == value || value.isBlank() ? null : value;
    }
}
