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

import de.corelogics.radiorec.model.StreamReference;
import lombok.Builder;
import lombok.NonNull;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

/**
 * The ffmpeg command line for one capture: reconnect on transient errors, copy the audio without re-encoding.
 */
@Builder
class FfmpegCommand {
    @NonNull
    private final String executable;
    @NonNull
    private final String logLevel;
    @NonNull
    private final String userAgent;
    @NonNull
    private final StreamReference stream;
    @NonNull
    private final Path output;
    private final int durationSeconds;
    private final int safetyMarginSeconds;

    List<String> toArguments() {
        var args = new ArrayList<String>();
        args.add(executable);
        args.addAll(List.of("-loglevel", logLevel, "-y", "-nostdin"));
        args.addAll(List.of(
            "-reconnect", "1",
            "-reconnect_at_eof", "0",
            "-reconnect_streamed", "1",
            "-reconnect_delay_max", "600"));
        args.addAll(List.of("-user_agent", userAgent));
        if (!stream.headers().isEmpty()) {
            args.addAll(List.of("-headers", headerBlock()));
        }
        args.addAll(List.of("-i", stream.url().toString()));
        if (durationSeconds > 0) {
            args.addAll(List.of("-t", Integer.toString(durationSeconds + safetyMarginSeconds)));
        }
        args.addAll(List.of("-vn", "-acodec", "copy", output.toString()));
        return args;
    }

    /**
     * ffmpeg expects all headers in one argument, each line terminated by CRLF.
     */
    String headerBlock() {
        var block = new StringBuilder();
        new TreeMap<>(stream.headers()).forEach((name, value) -> block.append(name).append(": ").append(value).append("\r\n"));
        return block.toString();
    }

    /**
     * The command line with header values masked, for logging.
     */
    String toLoggableString() {
        var args = toArguments();
        var headerIndex = args.indexOf("-headers");
        if (headerIndex >= 0) {
            args.set(headerIndex + 1, "<" + stream.headers().size() + " headers>");
        }
        return String.join(" ", args);
    }
}
