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
import de.corelogics.radiorec.client.nhk.NhkOndemandClient;
import de.corelogics.radiorec.model.Program;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds recordable NHK on-demand episodes whose series title matches a keyword.
 */
@Log4j2
@RequiredArgsConstructor
public class NhkEpisodeFinder {
    @NonNull
    private final NhkOndemandClient nhkOndemandClient;

    /**
     * @param keyword case-insensitive regular expression searched in the series titles
     * @param date {@code yyyyMMdd} to search the listing of that day, {@code null} for the new arrivals
     */
    public List<Program> find(@NonNull String keyword, String date) throws RecorderException {
        val matches = TitleMatcher.titleMatches(keyword);
        val corners = null == date
            ? nhkOndemandClient.getNewArrivals()
            : nhkOndemandClient.getCornersByDate(date);
        val episodes = new ArrayList<Program>();
        for (val corner : corners) {
            if (!matches.test(corner)) {
                continue;
            }
            for (val episode : nhkOndemandClient.enrich(corner)) {
                if (episode.isRecordable()) {
                    episodes.add(episode);
                } else {
                    log.debug("Skipping {}, it has no stream", episode);
                }
            }
        }
        log.info("Found {} recordable episodes for '{}'", episodes.size(), keyword);
        return episodes;
    }
}
