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

package de.corelogics.radiorec.service.capture;

import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.StreamReference;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs ffmpeg against a resolved stream and waits for it.
 * <p>
 * ffmpeg stops itself after the requested duration plus a safety margin. If it is still running a grace
 * period later, it is destroyed and the capture fails. A non-zero exit is a failure. The tool's output
 * is drained on its own thread, logged and kept, but never interpreted. There is no retry.
 */
@Log4j2
@RequiredArgsConstructor
public class CaptureOrchestrator {
    private static final long OUTPUT_DRAIN_JOIN_MILLIS = 5_000;

    @NonNull
    private final MainConfiguration mainConfiguration;

    @NonNull
    private final ProcessLauncher processLauncher;

    /**
     * @param durationSeconds recording length. {@code <= 0} records until the input ends.
     * @throws CaptureFailedException if ffmpeg cannot be started, exits non-zero, or is stopped
     */
    public CaptureResult capture(@NonNull StreamReference stream, @NonNull Path outputPath, int durationSeconds)
        throws CaptureFailedException {
        val command = FfmpegCommand.builder()
            .executable(mainConfiguration.ffmpegPath())
            .logLevel(mainConfiguration.ffmpegLogLevel())
            .userAgent(mainConfiguration.userAgent())
            .stream(stream)
            .output(outputPath)
            .durationSeconds(durationSeconds)
            .safetyMarginSeconds(mainConfiguration.captureSafetyMarginSeconds())
            .build();
        val run = new CaptureRun(outputPath);
        log.info("Capturing {} into {}", stream.url(), outputPath);
        log.debug("Running {}", command::toLoggableString);

        final Process process;
        try {
            process = processLauncher.launch(command.toArguments());
        } catch (IOException e) {
            run.moveTo(CaptureState.FAILED);
            throw new CaptureFailedException("Could not start " + mainConfiguration.ffmpegPath() + ": " + e.getMessage(), e);
        }
        run.moveTo(CaptureState.RUNNING);
        val started = Instant.now();
        val output = new StringBuilder();
        val drainer = startOutputDrainer(process, output);

        try {
            val exited = waitForExit(process, durationSeconds);
            if (!exited) {
                process.destroyForcibly();
                run.moveTo(CaptureState.FAILED);
                throw new CaptureFailedException(
                    "Capture into " + outputPath + " did not stop in time and was killed",
                    CaptureFailedException.NO_EXIT_CODE,
                    collect(drainer, output));
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            run.moveTo(CaptureState.FAILED);
            throw new CaptureFailedException(
                "Interrupted while capturing into " + outputPath,
                CaptureFailedException.NO_EXIT_CODE,
                collect(drainer, output));
        }

        val exitCode = process.exitValue();
        val collectedOutput = collect(drainer, output);
        val elapsed = Duration.between(started, Instant.now());
        if (exitCode != 0) {
            run.moveTo(CaptureState.FAILED);
            log.warn("ffmpeg exited with {} after {}, output was:\n{}", exitCode, elapsed, collectedOutput);
            throw new CaptureFailedException(
                "ffmpeg exited with code " + exitCode + " while capturing into " + outputPath,
                exitCode,
                collectedOutput);
        }
        run.moveTo(CaptureState.SUCCEEDED);
        log.info("Captured {} in {}", outputPath, elapsed);
        return new CaptureResult(run.getState(), outputPath, exitCode, collectedOutput, elapsed);
    }

    private boolean waitForExit(Process process, int durationSeconds) throws InterruptedException {
        if (durationSeconds <= 0) {
            process.waitFor();
            return true;
        }
        val deadlineSeconds = (long) durationSeconds
            + mainConfiguration.captureSafetyMarginSeconds()
            + mainConfiguration.captureWatchdogGraceSeconds();
        return process.waitFor(deadlineSeconds, TimeUnit.SECONDS);
    }

    private Thread startOutputDrainer(Process process, StringBuilder output) {
        val drainer = new Thread(() -> {
            try (val reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while (null != (line = reader.readLine())) {
                    log.debug("ffmpeg: {}", line);
                    synchronized (output) {
                        output.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.debug("Output of ffmpeg closed: {}", e.getMessage());
            }
        });
        drainer.setName("capture-output");
        drainer.setDaemon(true);
        drainer.start();
        return drainer;
    }

    private String collect(Thread drainer, StringBuilder output) {
        try {
            drainer.join(OUTPUT_DRAIN_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        synchronized (output) {
            return output.toString();
        }
    }

    /**
     * State of one capture. Only forward transitions are allowed.
     */
    static class CaptureRun {
        private final Path outputPath;
        private final AtomicReference<CaptureState> state = new AtomicReference<>(CaptureState.NOT_STARTED);

        CaptureRun(Path outputPath) {
            this.outputPath = outputPath;
        }

        CaptureState getState() {
            return state.get();
        }

        void moveTo(CaptureState next) {
            val current = state.get();
            if (!current.canMoveTo(next) || !state.compareAndSet(current, next)) {
                throw new IllegalStateException("Capture into " + outputPath + " cannot move from " + current + " to " + next);
            }
            log.debug("Capture into {} is {}", outputPath, next);
        }
    }
}
