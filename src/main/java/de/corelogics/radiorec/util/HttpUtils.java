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

package de.corelogics.radiorec.util;

import de.corelogics.radiorec.config.MainConfiguration;
import lombok.experimental.UtilityClass;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@UtilityClass
public class HttpUtils {
    public static final String HEADER_USER_AGENT = "User-Agent";

    public static Request.Builder enhanceRequest(MainConfiguration mainConfiguration, Request.Builder request) {
        request.header(HEADER_USER_AGENT, mainConfiguration.userAgent());
        return request;
    }

    public static OkHttpClient createClient(MainConfiguration mainConfiguration) {
        var timeout = mainConfiguration.httpTimeout();
        return new OkHttpClient.Builder()
            .connectTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .callTimeout(timeout.multipliedBy(2).toMillis(), TimeUnit.MILLISECONDS)
            .build();
    }

    /**
     * Reads the body of a successful response as string.
     *
     * @throws IOException if the response is not a 2xx, or has no body
     */
    public static String successfulBody(Response response) throws IOException {
        if (!response.isSuccessful()) {
            throw new IOException("Unexpected status code " + response.code() + " for " + response.request().url());
        }
        var body = response.body();
        if (null == body) {
            throw new IOException("No body, status code was " + response.code());
        }
        return body.string();
    }
}
