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

import de.corelogics.radiorec.client.ListingHttpException;
import de.corelogics.radiorec.client.RetryPolicy;
import de.corelogics.radiorec.client.nhk.NhkChannel;
import de.corelogics.radiorec.client.nhk.NhkLiveStreamClient;
import de.corelogics.radiorec.client.radiko.AuthPhase1FailedException;
import de.corelogics.radiorec.client.radiko.RadikoAuthenticator;
import de.corelogics.radiorec.client.radiko.RadikoProgramClient;
import de.corelogics.radiorec.client.radiko.RadikoStationClient;
import de.corelogics.radiorec.client.radiko.RadikoStreamResolver;
import de.corelogics.radiorec.client.radiko.StreamResolutionFormatException;
import de.corelogics.radiorec.client.radiko.TimeWindow;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.AuthSession;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.ProgramSource;
import de.corelogics.radiorec.model.StreamReference;
import de.corelogics.radiorec.service.capture.CaptureFailedException;
import de.corelogics.radiorec.service.capture.CaptureOrchestrator;
import de.corelogics.radiorec.service.capture.CaptureResult;
import de.corelogics.radiorec.service.capture.CaptureState;
import de.corelogics.radiorec.service.tagging.MetadataTagger;
import de.corelogics.radiorec.service.tagging.TaggingFailedException;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.SoftAssertions.assertSoftly;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecordingServiceTest {
    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");
    private static final AuthSession SESSION = new AuthSession("token-123", "JP13");
    private static final StreamReference TIME_FREE_STREAM = new StreamReference(
        URI.create("https://radiko.test/v2/api/ts/playlist.m3u8?station_id=TBS&l=15&ft=20260125093000&to=20260125100000"),
        Map.of("X-Radiko-AuthToken", "token-123"));

    @Mock
    private MainConfiguration mainConfiguration;
    @Mock
    private RadikoAuthenticator radikoAuthenticator;
    @Mock
    private RadikoStreamResolver radikoStreamResolver;
    @Mock
    private RadikoStationClient radikoStationClient;
    @Mock
    private RadikoProgramClient radikoProgramClient;
    @Mock
    private NhkLiveStreamClient nhkLiveStreamClient;
    @Mock
    private CaptureOrchestrator captureOrchestrator;
    @Mock
    private MetadataTagger metadataTagger;

    @TempDir
    Path outputDir;

    private RecordingService sut;

    @BeforeEach
    void createSut() {
        lenient().when(mainConfiguration.radikoAreaId()).thenReturn("JP13");
        lenient().when(mainConfiguration.nhkArea()).thenReturn("tokyo");
        sut = serviceWith(RetryPolicy.once());
    }

    private RecordingService serviceWith(RetryPolicy retryPolicy) {
        return RecordingService.builder()
            .mainConfiguration(mainConfiguration)
            .radikoAuthenticator(radikoAuthenticator)
            .radikoStreamResolver(radikoStreamResolver)
            .radikoStationClient(radikoStationClient)
            .radikoProgramClient(radikoProgramClient)
            .nhkLiveStreamClient(nhkLiveStreamClient)
            .captureOrchestrator(captureOrchestrator)
            .metadataTagger(metadataTagger)
            .retryPolicy(retryPolicy)
            .clock(Clock.fixed(LocalDateTime.of(2026, 1, 25, 9, 30, 42).atZone(TOKYO).toInstant(), TOKYO))
            .build();
    }

    private static Program sundayTalk() {
        return Program.builder()
            .title("Sunday Talk")
            .station("TBS")
            .startTime("20260125093000")
            .endTime("20260125100000")
            .source(ProgramSource.RADIKO)
            .performer("Host B")
            .build();
    }

    private static CaptureResult captured(Path file) {
        return new CaptureResult(CaptureState.SUCCEEDED, file, 0, "", Duration.ofMinutes(30));
    }

    @Nested
    class WhenRecordingTimeFreeTest {
        private Path expectedFile;

        @BeforeEach
        void setupHappyPath() throws Exception {
            expectedFile = outputDir.resolve("TBS_2026-01-25-09_30.mp4");
            lenient().when(radikoStationClient.isStationAvailable("TBS", "JP13")).thenReturn(true);
            lenient().when(radikoAuthenticator.authorize()).thenReturn(SESSION);
            lenient().when(radikoStreamResolver.resolveTimeFree(eq("TBS"), any(TimeWindow.class), eq(SESSION)))
                .thenReturn(TIME_FREE_STREAM);
            lenient().when(radikoProgramClient.findProgram("TBS", "20260125093000")).thenReturn(Optional.of(sundayTalk()));
            lenient().when(captureOrchestrator.capture(any(), any(), anyInt())).thenReturn(captured(expectedFile));
        }

        @Test
        void givenEverythingWorks_thenCaptureWindowAndTagWithListedProgram() throws Exception {
            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertSoftly(a -> {
                a.assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.SUCCEEDED);
                a.assertThat(outcome.getFile()).contains(expectedFile);
                a.assertThat(outcome.getDiagnostic()).isEmpty();
            });
            var programCaptor = ArgumentCaptor.forClass(Program.class);
            InOrder inOrder = inOrder(radikoAuthenticator, radikoStreamResolver, captureOrchestrator, metadataTagger);
            inOrder.verify(radikoAuthenticator).authorize();
            inOrder.verify(radikoStreamResolver).resolveTimeFree(
                "TBS", new TimeWindow("20260125093000", "20260125100000"), SESSION);
            inOrder.verify(captureOrchestrator).capture(TIME_FREE_STREAM, expectedFile, 1800);
            inOrder.verify(metadataTagger).tag(eq(expectedFile), programCaptor.capture());
            assertThat(programCaptor.getValue()).satisfies(p -> {
                assertThat(p.getTitle()).isEqualTo("Sunday Talk");
                assertThat(p.getStreamUrl()).contains(TIME_FREE_STREAM.url().toString());
            });
        }

        @Test
        void givenCaptureFails_thenFailWithoutTagging() throws Exception {
            when(captureOrchestrator.capture(any(), any(), anyInt()))
                .thenThrow(new CaptureFailedException("ffmpeg exited with code 1", 1, "403 Forbidden"));

            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertSoftly(a -> {
                a.assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.FAILED);
                a.assertThat(outcome.getFile()).isEmpty();
                a.assertThat(outcome.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).startsWith("CaptureFailed: "));
            });
            verifyNoInteractions(metadataTagger);
        }

        @Test
        void givenTaggingFails_thenKeepFileWithoutMetadata() throws Exception {
            doThrow(new TaggingFailedException("Could not tag", new IOException("broken atom")))
                .when(metadataTagger).tag(any(), any());

            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertSoftly(a -> {
                a.assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.SUCCEEDED_WITHOUT_METADATA);
                a.assertThat(outcome.isSuccessful()).isTrue();
                a.assertThat(outcome.getFile()).contains(expectedFile);
                a.assertThat(outcome.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).startsWith("TaggingFailed: "));
            });
        }

        @Test
        void givenAuthorizationFails_thenFailWithoutCapture() throws Exception {
            when(radikoAuthenticator.authorize()).thenThrow(new AuthPhase1FailedException("auth1 answered with status 403"));

            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertThat(outcome.getDiagnostic()).contains("AuthPhase1Failed: auth1 answered with status 403");
            verifyNoInteractions(radikoStreamResolver, captureOrchestrator, metadataTagger);
        }

        @Test
        void givenRetryPolicy_whenAuthorizationFailsOnce_thenRetry() throws Exception {
            when(radikoAuthenticator.authorize())
                .thenThrow(new AuthPhase1FailedException("auth1 answered with status 503"))
                .thenReturn(SESSION);

            var outcome = serviceWith(new RetryPolicy(2, Duration.ZERO))
                .recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.SUCCEEDED);
            verify(radikoAuthenticator, times(2)).authorize();
        }

        @Test
        void givenProgramLookupFails_thenTagWithMinimalProgram() throws Exception {
            when(radikoProgramClient.findProgram("TBS", "20260125093000"))
                .thenThrow(new ListingHttpException("Could not load programs"));

            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.SUCCEEDED);
            var programCaptor = ArgumentCaptor.forClass(Program.class);
            verify(metadataTagger).tag(eq(expectedFile), programCaptor.capture());
            assertSoftly(a -> {
                a.assertThat(programCaptor.getValue().getTitle()).isEqualTo("TBS 2026-01-25-09_30");
                a.assertThat(programCaptor.getValue().getStation()).isEqualTo("TBS");
                a.assertThat(programCaptor.getValue().getDurationMinutes()).isEqualTo(30);
            });
        }

        @Test
        void givenStationNotInArea_thenFailWithoutAuthorization() throws Exception {
            when(radikoStationClient.isStationAvailable("TBS", "JP13")).thenReturn(false);

            var outcome = sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir);

            assertThat(outcome.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).startsWith("StationUnavailable: "));
            verifyNoInteractions(radikoAuthenticator, captureOrchestrator);
        }

        @Test
        void givenStationListUnreachable_thenRecordAnyway() throws Exception {
            when(radikoStationClient.isStationAvailable("TBS", "JP13"))
                .thenThrow(new ListingHttpException("Could not load station list"));

            assertThat(sut.recordTimeFree("TBS", "20260125093000", "20260125100000", outputDir).isSuccessful()).isTrue();
        }

        @Test
        void givenMalformedStart_thenFailWithoutCapture() throws Exception {
            var window = new TimeWindow("2026-01-25", "20260125100000");
            when(radikoStreamResolver.resolveTimeFree("TBS", window, SESSION))
                .thenThrow(new StreamResolutionFormatException("Time window is not in yyyyMMddHHmmss format"));

            var outcome = sut.recordTimeFree("TBS", "2026-01-25", "20260125100000", outputDir);

            assertThat(outcome.getDiagnostic())
                .hasValueSatisfying(d -> assertThat(d).startsWith("StreamResolutionFormatError: "));
            verify(captureOrchestrator, never()).capture(any(), any(), anyInt());
        }

        @Test
        void givenReversedWindow_thenFailWithoutCapture() throws Exception {
            var withRealResolver = RecordingService.builder()
                .mainConfiguration(mainConfiguration)
                .radikoAuthenticator(radikoAuthenticator)
                .radikoStreamResolver(new RadikoStreamResolver(mainConfiguration, new OkHttpClient()))
                .radikoStationClient(radikoStationClient)
                .radikoProgramClient(radikoProgramClient)
                .nhkLiveStreamClient(nhkLiveStreamClient)
                .captureOrchestrator(captureOrchestrator)
                .metadataTagger(metadataTagger)
                .build();

            var outcome = withRealResolver.recordTimeFree("TBS", "20260125100000", "20260125093000", outputDir);

            assertSoftly(a -> {
                a.assertThat(outcome.isSuccessful()).isFalse();
                a.assertThat(outcome.getDiagnostic())
                    .hasValueSatisfying(d -> assertThat(d).startsWith("StreamResolutionFormatError: "));
            });
            verifyNoInteractions(captureOrchestrator, metadataTagger);
        }
    }

    @Test
    void whenRecordingLive_thenStartNowAndCaptureRequestedMinutes() throws Exception {
        var liveStream = new StreamReference(URI.create("https://stream.test/TBS/chunklist.m3u8"), Map.of("X-Radiko-AuthToken", "t"));
        var expectedFile = outputDir.resolve("TBS_2026-01-25-09_30.mp4");
        when(radikoStationClient.isStationAvailable("TBS", "JP13")).thenReturn(true);
        when(radikoAuthenticator.authorize()).thenReturn(SESSION);
        when(radikoStreamResolver.resolveLive("TBS", SESSION)).thenReturn(liveStream);
        when(radikoProgramClient.findProgram("TBS", "20260125093000")).thenReturn(Optional.empty());
        when(captureOrchestrator.capture(liveStream, expectedFile, 3600)).thenReturn(captured(expectedFile));

        var outcome = sut.recordLive("TBS", 60, outputDir);

        assertThat(outcome.getFile()).contains(expectedFile);
        verify(metadataTagger).tag(eq(expectedFile), any(Program.class));
    }

    @Nested
    class WhenRecordingNhkTest {
        private Program.ProgramBuilder episode() {
            return Program.builder()
                .title("Radio English Lesson 1")
                .station("NHK2")
                .startTime("20260118233000")
                .endTime("20260118233000")
                .source(ProgramSource.NHK);
        }

        @Test
        void givenRecordableEpisode_thenCaptureUntilStreamEnds() throws Exception {
            var expectedFile = outputDir.resolve("NHK2_2026-01-18-23_30.mp4");
            var program = episode().streamUrl("https://vod.test/1/index.m3u8").build();
            when(captureOrchestrator.capture(any(), any(), anyInt())).thenReturn(captured(expectedFile));

            var outcome = sut.recordNhkEpisode(program, outputDir);

            assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.SUCCEEDED);
            verify(captureOrchestrator).capture(
                StreamReference.unauthenticated("https://vod.test/1/index.m3u8"), expectedFile, 0);
            verify(metadataTagger).tag(expectedFile, program);
            verifyNoInteractions(radikoAuthenticator);
        }

        @Test
        void givenEpisodeWithoutStream_thenFailAsInvalidProgram() {
            var outcome = sut.recordNhkEpisode(episode().build(), outputDir);

            assertThat(outcome.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).startsWith("InvalidProgram: "));
            verifyNoInteractions(captureOrchestrator, metadataTagger);
        }

        @Test
        void givenRadikoProgram_thenFailAsInvalidProgram() {
            var outcome = sut.recordNhkEpisode(sundayTalk(), outputDir);

            assertThat(outcome.getStatus()).isEqualTo(RecordingStatus.FAILED);
            verifyNoInteractions(captureOrchestrator);
        }

        @Test
        void givenLiveChannel_thenLookUpStreamOfConfiguredArea() throws Exception {
            var stream = StreamReference.unauthenticated("https://nhk.test/tokyo/r1/master.m3u8");
            var expectedFile = outputDir.resolve("NHK1_2026-01-25-09_30.mp4");
            when(nhkLiveStreamClient.getLiveStream(NhkChannel.NHK1, "tokyo")).thenReturn(stream);
            when(captureOrchestrator.capture(stream, expectedFile, 1800)).thenReturn(captured(expectedFile));

            var outcome = sut.recordNhkLive(NhkChannel.NHK1, 30, outputDir);

            assertThat(outcome.getFile()).contains(expectedFile);
            verifyNoInteractions(radikoAuthenticator, radikoStationClient);
        }

        @Test
        void givenLiveConfigUnreachable_thenFail() throws Exception {
            when(nhkLiveStreamClient.getLiveStream(NhkChannel.FM, "tokyo"))
                .thenThrow(new ListingHttpException("Could not load NHK stream configuration"));

            var outcome = sut.recordNhkLive(NhkChannel.FM, 30, outputDir);

            assertThat(outcome.getDiagnostic()).hasValueSatisfying(d -> assertThat(d).startsWith("ListingHttpError: "));
            verifyNoInteractions(captureOrchestrator);
        }
    }
}
