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

import de.corelogics.radiorec.client.ClientModule;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.service.capture.CaptureOrchestrator;
import de.corelogics.radiorec.service.capture.ProcessLauncher;
import de.corelogics.radiorec.service.tagging.CoverArtClient;
import de.corelogics.radiorec.service.tagging.MetadataTagger;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class RecordingModule {
    private final MainConfiguration mainConfiguration;
    private final ClientModule clientModule;

    @Getter(lazy = true)
    private final CaptureOrchestrator captureOrchestrator =
        new CaptureOrchestrator(mainConfiguration, ProcessLauncher.processBuilder());

    @Getter(lazy = true)
    private final MetadataTagger metadataTagger =
        new MetadataTagger(new CoverArtClient(mainConfiguration, clientModule.getHttpClient()));

    @Getter(lazy = true)
    private final RecordingService recordingService =
        RecordingService.builder()
            .mainConfiguration(mainConfiguration)
            .radikoAuthenticator(clientModule.getRadikoAuthenticator())
            .radikoStreamResolver(clientModule.getRadikoStreamResolver())
            .radikoStationClient(clientModule.getRadikoStationClient())
            .radikoProgramClient(clientModule.getRadikoProgramClient())
            .nhkLiveStreamClient(clientModule.getNhkLiveStreamClient())
            .captureOrchestrator(getCaptureOrchestrator())
            .metadataTagger(getMetadataTagger())
            .retryPolicy(clientModule.getRetryPolicy())
            .build();

    @Getter(lazy = true)
    private final NhkEpisodeFinder nhkEpisodeFinder = new NhkEpisodeFinder(clientModule.getNhkOndemandClient());

    @Getter(lazy = true)
    private final RadikoProgramFinder radikoProgramFinder = new RadikoProgramFinder(
        mainConfiguration,
        clientModule.getRadikoStationClient(),
        clientModule.getRadikoProgramClient());
}
