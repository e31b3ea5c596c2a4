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


package de.corelogics.radiorec.service.recording;

import de.corelogics.radiorec.client.RecorderException;
import de.corelogics.radiorec.client.radiko.RadikoProgramClient;
import de.corelogics.radiorec.client.radiko.RadikoStationClient;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.Station;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Searches the radiko listings of one broadcast day by program title.
 * <p>
 * Without a station every station of the configured area is searched. A station whose listing fails is
 * skipped then, a single requested station fails the search.
 */
@Log4j2
public class RadikoProgramFinder {
    private final MainConfiguration mainConfiguration;
    private final RadikoStationClient radikoStationClient;
    private final RadikoProgramClient radikoProgramClient;
    private final Clock clock;

    public RadikoProgramFinder(
        @NonNull MainConfiguration mainConfiguration,
        @NonNull RadikoStationClient radikoStationClient,
        @NonNull RadikoProgramClient radikoProgramClient) {
        this(mainConfiguration, radikoStationClient, radikoProgramClient, Clock.systemDefaultZone());
    }

    RadikoProgramFinder(
        @NonNull MainConfiguration mainConfiguration,
        @NonNull RadikoStationClient radikoStationClient,
        @NonNull RadikoProgramClient radikoProgramClient,
        @NonNull Clock clock) {
        this.mainConfiguration = mainConfiguration;
        this.radikoStationClient = radikoStationClient;
        this.radikoProgramClient = radikoProgramClient;
        this.clock = clock;
    }

    /**
     * @param keyword case-insensitive regular expression searched in the titles
     * @param station station id, {@code null} for all stations of the configured area
     * @param date    {@code yyyyMMdd} of the broadcast day, {@code null} for the current one
     * @throws java.util.regex.PatternSyntaxException if the keyword is not a valid regular expression
     */
    public List<Program> find(@NonNull String keyword, String station, String date) throws RecorderException {
        val matches = TitleMatcher.titleMatches(keyword);
        val broadcastDate = null == date ? RadikoProgramClient.broadcastDate(LocalDateTime.now(clock)) : date;
        val found = new ArrayList<Program>();
        if (null != station) {
            radikoProgramClient.getPrograms(station, broadcastDate).stream().filter(matches).forEach(found::add);
        } else {
            for (val stationId : stationIds()) {
                try {
                    radikoProgramClient.getPrograms(stationId, broadcastDate).stream().filter(matches).forEach(found::add);
                } catch (RecorderException e) {
                    log.warn("Skipping programs of {} on {}: {}", stationId, broadcastDate, e.diagnostic());
                }
            }
        }
        log.info("Found {} radiko programs for '{}' on {}", found.size(), keyword, broadcastDate);
        return found;
    }

    private List<String> stationIds() throws RecorderException {
        return radikoStationClient.getStations(mainConfiguration.radikoAreaId()).stream()
            .map(Station::id)
            .collect(Collectors.toList());
    }
}
