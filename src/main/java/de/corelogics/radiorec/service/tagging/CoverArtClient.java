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

package de.corelogics.radiorec.service.tagging;

import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.io.IOException;
import java.util.Optional;

/**
 * Best effort download of program images. Failures are logged and yield nothing.
 */
@Log4j2
@RequiredArgsConstructor
public class CoverArtClient {
    static final String DEFAULT_MIME_TYPE = "image/jpeg";

    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final OkHttpClient httpClient;

    public Optional<CoverArt> fetch(String imageUrl) {
        if (null == imageUrl || imageUrl.isBlank()) {
            return Optional.empty();
        }
        try {
            val request = HttpUtils.enhanceRequest(mainConfiguration, new Request.Builder()).url(imageUrl).get().build();
            try (val response = httpClient.newCall(request).execute()) {
                val body = response.body();
                if (!response.isSuccessful() || null == body) {
                    log.warn("Cover art {} answered with status {}, skipping it", imageUrl, response.code());
                    return Optional.empty();
                }
                val data = body.bytes();
                if (data.length == 0) {
                    log.warn("Cover art {} is empty, skipping it", imageUrl);
                    return Optional.empty();
                }
                val contentType = body.contentType();
                val mimeType = null == contentType ? DEFAULT_MIME_TYPE : contentType.type() + "/" + contentType.subtype();
                return Optional.of(new CoverArt(data, mimeType));
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not fetch cover art {}, skipping it: {}", imageUrl, e.getMessage());
            return Optional.empty();
        }
    }
}
