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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.corelogics.radiorec.client.ListingHttpException;
import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.List;

/**
 * Reads the NHK radio on-demand listings. No authentication is needed, episodes carry their stream url.
 */
@Log4j2
@RequiredArgsConstructor
public class NhkOndemandClient {
    static final String DEFAULT_CORNER_SITE_ID = "01";

    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    @NonNull
    private final ObjectMapper objectMapper;

    @NonNull
    private final NhkProgramNormalizer normalizer;

    public List<Program> getNewArrivals() throws ListingHttpException, NormalizationException {
        return normalizer.normalize(fetchJson("/new_arrivals.json"));
    }

    /**
     * @param date {@code yyyyMMdd}
     */
    public List<Program> getCornersByDate(@NonNull String date) throws ListingHttpException, NormalizationException {
        return normalizer.normalize(fetchJson("/corners-" + date + ".json"));
    }

    public List<Program> getSeries(@NonNull String siteId, String cornerSiteId)
        throws ListingHttpException, NormalizationException {
        return normalizer.normalize(fetchJson("/" + siteId + "-" + padCornerSiteId(cornerSiteId) + ".json"));
    }

    /**
     * Loads the episodes behind a corner-level program. Programs that are already recordable, or that
     * cannot be re-queried, are returned as they are.
     */
    public List<Program> enrich(@NonNull Program program) throws ListingHttpException, NormalizationException {
        if (program.isRecordable()) {
            return List.of(program);
        }
        val siteId = program.getSeriesSiteId();
        if (siteId.isEmpty()) {
            log.debug("{} has no series site id, cannot load its episodes", program);
            return List.of(program);
        }
        val episodes = getSeries(siteId.get(), program.getCornerSiteId().orElse(DEFAULT_CORNER_SITE_ID));
        log.debug("Loaded {} episodes for {}", episodes.size(), program);
        return episodes;
    }

    static String padCornerSiteId(String cornerSiteId) {
        if (null == cornerSiteId || cornerSiteId.isBlank()) {
            return DEFAULT_CORNER_SITE_ID;
        }
        val trimmed = cornerSiteId.strip();
        return trimmed.length() == 1 && Character.isDigit(trimmed.charAt(0)) ? "0" + trimmed : trimmed;
    }

    JsonNode fetchJson(String path) throws ListingHttpException, NormalizationException {
        val url = mainConfiguration.nhkOndemandBaseUrl() + path;
        val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder()).url(url).get().build();
        final String body;
        try (val response = httpClient.newCall(request).execute()) {
            body = HttpUtils.successfulBody(response);
        } catch (IOException e) {
            throw new ListingHttpException("Could not load " + url + ": " + e.getMessage(), e);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new NormalizationException("Illegal JSON from " + url, e);
        }
    }
}
