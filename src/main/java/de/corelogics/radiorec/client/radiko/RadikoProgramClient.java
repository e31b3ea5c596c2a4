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

import de.corelogics.radiorec.client.ListingHttpException;
import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.time.Timestamps;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

@Log4j2
@RequiredArgsConstructor
public class RadikoProgramClient {
    // radiko's broadcast day runs from 05:00 to 05:00
    private static final int BROADCAST_DAY_START_HOUR = 5;

    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    @NonNull
    private final RadikoProgramParser parser;

    /**
     * @param date {@code yyyyMMdd} of the broadcast day
     */
    public List<Program> getPrograms(@NonNull String station, @NonNull String date)
        throws ListingHttpException, NormalizationException {
        val url = mainConfiguration.radikoBaseUrl() + "/v3/program/station/date/" + date + "/" + station + ".xml";
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder()).url(url).get().build();
        final String xml;
        try (val response = httpClient.newCall(request).execute()) {
            xml = HttpUtils.successfulBody(response);
        } catch (IOException e) {
            throw new ListingHttpException("Could not load programs of " + station + " on " + date + ": " + e.getMessage(), e);
        }
        return parser.parsePrograms(xml, station, mainConfiguration.radikoAreaId());
    }

    /**
     * The program starting at {@code ft}, or else the one running at {@code ft}.
     */
    public Optional<Program> findProgram(@NonNull String station, @NonNull String ft)
        throws ListingHttpException, NormalizationException {
        val startTime = Timestamps.parse(ft);
        if (startTime.isEmpty()) {
            log.debug("{} is not canonical, not looking up a program", ft);
            return Optional.empty();
        }
        val programs = getPrograms(station, broadcastDate(startTime.get()));
        val exact = programs.stream().filter(p -> ft.equals(p.getStartTime())).findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return programs.stream()
            .filter(p -> p.getStartTime().compareTo(ft) <= 0 && p.getEndTime().compareTo(ft) > 0)
            .findFirst();
    }

    /**
     * {@code yyyyMMdd} of the broadcast day {@code time} belongs to.
     */
    public static String broadcastDate(@NonNull LocalDateTime time) {
        return time.minusHours(BROADCAST_DAY_START_HOUR).format(DateTimeFormatter.BASIC_ISO_DATE);
    }
}
