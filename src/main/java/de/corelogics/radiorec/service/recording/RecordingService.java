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
import de.corelogics.radiorec.client.RetryPolicy;
import de.corelogics.radiorec.client.nhk.NhkChannel;
import de.corelogics.radiorec.client.nhk.NhkLiveStreamClient;
import de.corelogics.radiorec.client.radiko.RadikoAuthenticator;
import de.corelogics.radiorec.client.radiko.RadikoProgramClient;
import de.corelogics.radiorec.client.radiko.RadikoStationClient;
import de.corelogics.radiorec.client.radiko.RadikoStreamResolver;
import de.corelogics.radiorec.client.radiko.StationUnavailableException;
import de.corelogics.radiorec.client.radiko.TimeWindow;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.AuthSession;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.ProgramSource;
import de.corelogics.radiorec.model.StreamReference;
import de.corelogics.radiorec.service.capture.CaptureOrchestrator;
import de.corelogics.radiorec.service.tagging.MetadataTagger;
import de.corelogics.radiorec.service.tagging.TaggingFailedException;
import de.corelogics.radiorec.time.Timestamps;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * One recording, start to end: authorize (radiko only), resolve the stream, look up the program,
 * capture, tag. Every step completes before the next one starts.
 * <p>
 * Failures before the capture abort the run without starting ffmpeg. A failed capture is never tagged.
 * A failed tagging keeps the file. Program lookup is best effort, a minimal program is made up if it fails.
 */
@Log4j2
public class RecordingService {
    private final MainConfiguration mainConfiguration;
    private final RadikoAuthenticator radikoAuthenticator;
    private final RadikoStreamResolver radikoStreamResolver;
    private final RadikoStationClient radikoStationClient;
    private final RadikoProgramClient radikoProgramClient;
    private final NhkLiveStreamClient nhkLiveStreamClient;
    private final CaptureOrchestrator captureOrchestrator;
    private final MetadataTagger metadataTagger;
    private final RetryPolicy retryPolicy;
    private final OutputFileNamer outputFileNamer;
    private final Clock clock;

    @Builder
    RecordingService(
        @NonNull MainConfiguration mainConfiguration,
        @NonNull RadikoAuthenticator radikoAuthenticator,
        @NonNull RadikoStreamResolver radikoStreamResolver,
        @NonNull RadikoStationClient radikoStationClient,
        @NonNull RadikoProgramClient radikoProgramClient,
        @NonNull NhkLiveStreamClient nhkLiveStreamClient,
        @NonNull CaptureOrchestrator captureOrchestrator,
        @NonNull MetadataTagger metadataTagger,
        RetryPolicy retryPolicy,
        OutputFileNamer outputFileNamer,
        Clock clock) {
        this.mainConfiguration = mainConfiguration;
        this.radikoAuthenticator = radikoAuthenticator;
        this.radikoStreamResolver = radikoStreamResolver;
        this.radikoStationClient = radikoStationClient;
        this.radikoProgramClient = radikoProgramClient;
        this.nhkLiveStreamClient = nhkLiveStreamClient;
        this.captureOrchestrator = captureOrchestrator;
        this.metadataTagger = metadataTagger;
        this.retryPolicy = null == retryPolicy ? RetryPolicy.once() : retryPolicy;
        this.outputFileNamer = null == outputFileNamer ? new OutputFileNamer() : outputFileNamer;
        this.clock = null == clock ? Clock.systemDefaultZone() : clock;
    }

    /**
     * Records a past radiko broadcast.
     *
     * @param ft start, {@code yyyyMMddHHmmss}
     * @param to end, {@code yyyyMMddHHmmss}
     */
    public RecordingOutcome recordTimeFree(@NonNull String station, @NonNull String ft, @NonNull String to, @NonNull Path outputDir) {
        log.info("Recording {} from {} to {} (time-free)", station, ft, to);
        try {
            ensureStationAvailable(station);
            val session = authorize();
            val stream = radikoStreamResolver.resolveTimeFree(station, new TimeWindow(ft, to), session);
            val window = minimalProgram(station, ft, to, ProgramSource.RADIKO);
            val program = lookupRadikoProgram(station, ft).orElse(window);
            return captureAndTag(
                stream,
                program,
                outputDir.resolve(outputFileNamer.fileName(station, ft)),
                window.getDurationSeconds());
        } catch (IOException e) {
            return failed(e);
        }
    }

    public RecordingOutcome recordLive(@NonNull String station, int durationMinutes, @NonNull Path outputDir) {
        val start = now();
        val ft = Timestamps.format(start);
        val to = Timestamps.format(start.plusMinutes(durationMinutes));
        log.info("Recording {} live for {} minutes", station, durationMinutes);
        try {
            ensureStationAvailable(station);
            val session = authorize();
            val stream = radikoStreamResolver.resolveLive(station, session);
            val program = lookupRadikoProgram(station, ft).orElseGet(() -> minimalProgram(station, ft, to, ProgramSource.RADIKO));
            return captureAndTag(
                stream,
                program,
                outputDir.resolve(outputFileNamer.fileName(station, start)),
                durationMinutes * 60);
        } catch (IOException e) {
            return failed(e);
        }
    }

    /**
     * Records an on-demand episode. Its stream url comes with the listing, the episode plays until its end.
     */
    public RecordingOutcome recordNhkEpisode(@NonNull Program program, @NonNull Path outputDir) {
        log.info("Recording NHK episode {}", program);
        if (!program.isNhk()) {
            return RecordingOutcome.failed("InvalidProgram: " + program + " is not an NHK program");
        }
        if (!program.isRecordable()) {
            return RecordingOutcome.failed("InvalidProgram: " + program + " has no stream url");
        }
        val start = program.getStartDateTime().orElseGet(this::now);
        try {
            return captureAndTag(
                StreamReference.unauthenticated(program.getStreamUrl().orElseThrow()),
                program,
                outputDir.resolve(outputFileNamer.fileName(program.getStation(), start)),
                program.getDurationSeconds());
        } catch (IOException e) {
            return failed(e);
        } catch (IllegalArgumentException e) {
            return RecordingOutcome.failed("InvalidProgram: stream url of " + program + " is malformed");
        }
    }

    public RecordingOutcome recordNhkLive(@NonNull NhkChannel channel, int durationMinutes, @NonNull Path outputDir) {
        val start = now();
        log.info("Recording {} live for {} minutes", channel, durationMinutes);
        try {
            val stream = nhkLiveStreamClient.getLiveStream(channel, mainConfiguration.nhkArea());
            val program = minimalProgram(
                channel.name(),
                Timestamps.format(start),
                Timestamps.format(start.plusMinutes(durationMinutes)),
                ProgramSource.NHK);
            return captureAndTag(
                stream,
                program,
                outputDir.resolve(outputFileNamer.fileName(channel.name(), start)),
                durationMinutes * 60);
        } catch (IOException e) {
            return failed(e);
        }
    }

    private void ensureStationAvailable(String station) throws StationUnavailableException {
        val area = mainConfiguration.radikoAreaId();
        final boolean available;
        try {
            available = radikoStationClient.isStationAvailable(station, area);
        } catch (RecorderException e) {
            log.warn("Could not check whether {} is available in {}, trying anyway: {}", station, area, e.diagnostic());
            return;
        }
        if (!available) {
            throw new StationUnavailableException("Station " + station + " is not available in area " + area);
        }
    }

    private AuthSession authorize() throws IOException {
        return retryPolicy.execute("radiko authorization", radikoAuthenticator::authorize);
    }

    private Optional<Program> lookupRadikoProgram(String station, String ft) {
        try {
            val program = radikoProgramClient.findProgram(station, ft);
            if (program.isEmpty()) {
                log.warn("No program information for {} at {}", station, ft);
            }
            return program;
        } catch (RecorderException e) {
            log.warn("Program information for {} at {} not available: {}", station, ft, e.diagnostic());
            return Optional.empty();
        }
    }

    private RecordingOutcome captureAndTag(StreamReference stream, Program program, Path outputFile, int durationSeconds)
        throws IOException {
        FileUtils.forceMkdir(outputFile.toAbsolutePath().getParent().toFile());
        if (!program.isRecordable()) {
            program.resolveStreamUrl(stream.url().toString());
        }
        captureOrchestrator.capture(stream, outputFile, durationSeconds);
        try {
            metadataTagger.tag(outputFile, program);
        } catch (TaggingFailedException e) {
            log.warn("Recorded {}, but its metadata is incomplete: {}", outputFile, e.diagnostic());
            return RecordingOutcome.succeededWithoutMetadata(outputFile, e.diagnostic());
        }
        log.info("Recorded {}", outputFile);
        return RecordingOutcome.succeeded(outputFile);
    }

    private static Program minimalProgram(String station, String start, String end, ProgramSource source) {
        return Program.builder()
            .title(station + " " + Timestamps.parse(start).map(Timestamps::formatForFileName).orElse(start))
            .station(station)
            .startTime(start)
            .endTime(end)
            .source(source)
            .build();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MINUTES);
    }

    private static RecordingOutcome failed(IOException e) {
        val diagnostic = e instanceof RecorderException
            ? ((RecorderException) e).diagnostic()
            : "IOError: " + e.getMessage();
        log.error("Recording failed: {}", diagnostic, e);
        return RecordingOutcome.failed(diagnostic);
    }
}
