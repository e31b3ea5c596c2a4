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

import de.corelogics.radiorec.client.ListingHttpException;
import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.StreamReference;
import de.corelogics.radiorec.util.HttpUtils;
import de.corelogics.radiorec.util.XmlUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;

/**
 * Looks up the live HLS url of an NHK channel in {@code config_web.xml}.
 * <p>
 * The file holds one {@code <data>} block per area, each naming its {@code <area>} and the urls of all channels.
 */
@Log4j2
@RequiredArgsConstructor
public class NhkLiveStreamClient {
    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    public StreamReference getLiveStream(@NonNull NhkChannel channel, @NonNull String area)
        throws ListingHttpException, NormalizationException {
        val url = mainConfiguration.nhkConfigUrl();
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder()).url(url).get().build();
        final String xml;
        try (val response = httpClient.newCall(request).execute()) {
            xml = HttpUtils.successfulBody(response);
        } catch (IOException e) {
            throw new ListingHttpException("Could not load NHK stream configuration: " + e.getMessage(), e);
        }
        val root = XmlUtils.parse(xml, "NHK").getDocumentElement();
        val streamUrl = XmlUtils.elements(root, "data").stream()
            .filter(data -> XmlUtils.childText(data, "area").filter(area::equals).isPresent())
            .findFirst()
            .flatMap(data -> XmlUtils.childText(data, channel.getHlsElement()))
            .orElseThrow(() -> new NormalizationException(
                "NHK stream configuration has no " + channel.getHlsElement() + " for area " + area));
        log.info("Live stream of {} in {} is {}", channel, area, streamUrl);
        return StreamReference.unauthenticated(streamUrl);
    }
}
