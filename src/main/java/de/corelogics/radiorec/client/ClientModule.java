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

package de.corelogics.radiorec.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.corelogics.radiorec.client.nhk.NhkLiveStreamClient;
import de.corelogics.radiorec.client.nhk.NhkOndemandClient;
import de.corelogics.radiorec.client.nhk.NhkProgramNormalizer;
import de.corelogics.radiorec.client.radiko.RadikoAuthenticator;
import de.corelogics.radiorec.client.radiko.RadikoProgramClient;
import de.corelogics.radiorec.client.radiko.RadikoProgramParser;
import de.corelogics.radiorec.client.radiko.RadikoStationClient;
import de.corelogics.radiorec.client.radiko.RadikoStreamResolver;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.time.TimeNormalizer;
import de.corelogics.radiorec.util.HttpUtils;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;

@RequiredArgsConstructor
public class ClientModule {
    private final MainConfiguration mainConfiguration;

    @Getter(lazy = true)
    private final OkHttpClient httpClient = HttpUtils.createClient(mainConfiguration);

    @Getter(lazy = true)
    private final TimeNormalizer timeNormalizer = new TimeNormalizer();

    @Getter(lazy = true)
    private final RetryPolicy retryPolicy =
        new RetryPolicy(mainConfiguration.retryMaxAttempts(), mainConfiguration.retryBackoff());

    @Getter(lazy = true)
    private final RadikoAuthenticator radikoAuthenticator = new RadikoAuthenticator(mainConfiguration, getHttpClient());

    @Getter(lazy = true)
    private final RadikoStreamResolver radikoStreamResolver = new RadikoStreamResolver(mainConfiguration, getHttpClient());

    @Getter(lazy = true)
    private final RadikoStationClient radikoStationClient = new RadikoStationClient(mainConfiguration, getHttpClient());

    @Getter(lazy = true)
    private final RadikoProgramClient radikoProgramClient =
        new RadikoProgramClient(mainConfiguration, getHttpClient(), new RadikoProgramParser());

    @Getter(lazy = true)
    private final NhkOndemandClient nhkOndemandClient =
        new NhkOndemandClient(
            mainConfiguration,
            getHttpClient(),
            new ObjectMapper(),
            new NhkProgramNormalizer(getTimeNormalizer()));

    @Getter(lazy = true)
    private final NhkLiveStreamClient nhkLiveStreamClient = new NhkLiveStreamClient(mainConfiguration, getHttpClient());
}
