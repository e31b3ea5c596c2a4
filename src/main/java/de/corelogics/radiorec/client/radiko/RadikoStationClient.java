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
import de.corelogics.radiorec.model.Station;
import de.corelogics.radiorec.util.XmlUtils;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Log4j2
@RequiredArgsConstructor
public class RadikoStationClient {
    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    public List<Station> getStations(@NonNull String area) throws ListingHttpException, NormalizationException {
        val url = mainConfiguration.radikoBaseUrl() + "/v3/station/list/" + area + ".xml";
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder()).url(url).get().build();
        final String xml;
        try (val response = httpClient.newCall(request).execute()) {
            xml = HttpUtils.successfulBody(response);
        } catch (IOException e) {
            throw new ListingHttpException("Could not load station list of area " + area + ": " + e.getMessage(), e);
        }
        val root = XmlUtils.parse(xml, "radiko").getDocumentElement();
        val stations = XmlUtils.elements(root, "station").stream()
            .map(s -> XmlUtils.childText(s, "id").map(id -> new Station(id, XmlUtils.childText(s, "name").orElse(id))))
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
        log.debug("Area {} has {} stations", area, stations.size());
        return stations;
    }

    public boolean isStationAvailable(@NonNull String station, @NonNull String area)
        throws ListingHttpException, NormalizationException {
        return getStations(area).stream().anyMatch(s -> s.id().equals(station));
    }
}
