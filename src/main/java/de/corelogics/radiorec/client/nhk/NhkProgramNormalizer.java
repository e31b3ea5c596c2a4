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

package de.corelogics.radiorec.client.nhk;

import com.fasterxml.jackson.databind.JsonNode;
import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.ProgramSource;
import de.corelogics.radiorec.time.TimeNormalizer;
import de.corelogics.radiorec.time.Timestamps;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps the JSON answers of NHK radio on-demand to {@link Program}s.
 * <p>
 * The shape of the answer is decided first ({@link #classify(JsonNode)}). Anything but a JSON object
 * is rejected, an object of unknown shape yields no programs. Every leaf is optional.
 * <p>
 * Corners are series-level entries without a stream, episodes carry their {@code stream_url}. NHK
 * publishes no end time, so end equals start.
 */
@Log4j2
@RequiredArgsConstructor
public class NhkProgramNormalizer {
    static final String DEFAULT_STATION = "NHK";

    @NonNull
    private final TimeNormalizer timeNormalizer;

    public NhkListingKind classify(JsonNode root) throws NormalizationException {
        if (null == root || !root.isObject()) {
            throw new NormalizationException(
                "Expected a JSON object at top level, got " + (null == root ? "nothing" : root.getNodeType()));
        }
        if (root.has("episodes")) {
            return NhkListingKind.SERIES_DETAIL;
        }
        if (root.has("corners")) {
            return root.has("onair_date") ? NhkListingKind.BY_DATE : NhkListingKind.NEW_ARRIVALS;
        }
        log.warn("NHK listing has neither corners nor episodes, keys are {}", fieldNames(root));
        return NhkListingKind.UNRECOGNIZED;
    }

    public List<Program> normalize(JsonNode root) throws NormalizationException {
        val kind = classify(root);
        log.debug("Normalizing NHK listing of kind {}", kind);
        switch (kind) {
            case SERIES_DETAIL:
                return fromSeries(root);
            case BY_DATE:
                return fromCorners(root.path("corners"), text(root, "onair_date"));
            case NEW_ARRIVALS:
                return fromCorners(root.path("corners"), "");
            case UNRECOGNIZED:
                return List.of();
            default:
                throw new IllegalStateException("Unhandled listing kind " + kind);
        }
    }

    List<Program> fromCorners(JsonNode corners, String listingDate) {
        val programs = new ArrayList<Program>();
        for (val corner : corners) {
            if (corner.isObject()) {
                programs.add(fromCorner(corner, listingDate));
            } else {
                log.debug("Skipping corner entry of type {}", corner.getNodeType());
            }
        }
        return programs;
    }

    /**
     * A series-level program. It has no stream, {@link NhkOndemandClient#enrich(Program)} loads the episodes.
     */
    Program fromCorner(JsonNode corner, String listingDate) {
        var start = startTime(text(corner, "onair_date"), text(corner, "started_at"));
        if (!Timestamps.isCanonical(start) && !listingDate.isEmpty()) {
            start = timeNormalizer.normalize(listingDate, ProgramSource.NHK);
        }
        return Program.builder()
            .title(joinTitle(text(corner, "title"), text(corner, "corner_name")))
            .station(station(text(corner, "radio_broadcast")))
            .source(ProgramSource.NHK)
            .startTime(start)
            .endTime(start)
            .description(firstNonEmpty(text(corner, "series_description"), text(corner, "description")))
            .imageUrl(text(corner, "thumbnail_url"))
            .url(text(corner, "series_url"))
            .seriesSiteId(text(corner, "series_site_id"))
            .cornerSiteId(text(corner, "corner_site_id"))
            .onairDate(text(corner, "onair_date"))
            .build();
    }

    List<Program> fromSeries(JsonNode series) {
        val programs = new ArrayList<Program>();
        for (val episode : series.path("episodes")) {
            if (episode.isObject()) {
                programs.add(fromEpisode(series, episode));
            } else {
                log.debug("Skipping episode entry of type {}", episode.getNodeType());
            }
        }
        return programs;
    }

    /**
     * One episode, merged with its series.
     */
    Program fromEpisode(JsonNode series, JsonNode episode) {
        val onairDate = text(episode, "onair_date");
        val start = startTime(onairDate, text(episode, "started_at"));
        return Program.builder()
            .title(joinTitle(text(series, "title"), text(episode, "program_title"), text(episode, "program_sub_title")))
            .station(station(text(series, "radio_broadcast")))
            .source(ProgramSource.NHK)
            .startTime(start)
            .endTime(start)
            .subtitle(text(episode, "program_sub_title"))
            .performer(text(episode, "act"))
            .description(firstNonEmpty(text(episode, "program_desc"), text(series, "series_description")))
            .info(text(series, "schedule"))
            .imageUrl(firstNonEmpty(text(episode, "thumbnail_url"), text(series, "thumbnail_url")))
            .url(text(series, "series_url"))
            .seriesSiteId(text(series, "series_site_id"))
            .cornerSiteId(text(series, "corner_site_id"))
            .onairDate(onairDate)
            .closedAt(text(episode, "closed_at"))
            .streamUrl(text(episode, "stream_url"))
            .build();
    }

    private String startTime(String onairDate, String startedAt) {
        val fromOnairDate = timeNormalizer.normalize(onairDate, ProgramSource.NHK);
        if (Timestamps.isCanonical(fromOnairDate) || startedAt.isEmpty()) {
            return fromOnairDate;
        }
        return timeNormalizer.normalize(startedAt, ProgramSource.NHK);
    }

    /**
     * Non-empty parts, joined by a single space.
     */
    static String joinTitle(String... parts) {
        return Arrays.stream(parts)
            .filter(Objects::nonNull)
            .map(String::strip)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.joining(" "));
    }

    /**
     * {@code radio_broadcast} may list several channels, e.g. {@code "R1,FM"}. The first one names the station.
     */
    static String station(String radioBroadcast) {
        val first = radioBroadcast.split(",", -1)[0].strip();
        switch (first) {
            case "R1":
                return "NHK1";
            case "R2":
                return "NHK2";
            case "FM":
                return "FM";
            default:
                return DEFAULT_STATION;
        }
    }

    private static String text(JsonNode node, String field) {
        val value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText("") : "";
    }

    private static String firstNonEmpty(String... values) {
        return Stream.of(values).filter(v -> !v.isEmpty()).findFirst().orElse("");
    }

    private static List<String> fieldNames(JsonNode node) {
        val names = new ArrayList<String>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
