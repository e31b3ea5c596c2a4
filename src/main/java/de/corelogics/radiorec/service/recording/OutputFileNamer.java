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

import de.corelogics.radiorec.time.Timestamps;
import lombok.NonNull;

import java.time.LocalDateTime;

/**
 * {@code <station>_<yyyy-MM-dd-HH_mm>.mp4}
 */
public class OutputFileNamer {
    public static final String EXTENSION = ".mp4";

    public String fileName(@NonNull String station, @NonNull String startTime) {
        return fileName(station, Timestamps.parse(startTime)
            .orElseThrow(() -> new IllegalArgumentException("Start time " + startTime + " is not yyyyMMddHHmmss")));
    }

    public String fileName(@NonNull String station, @NonNull LocalDateTime startTime) {
        return safe(station) + "_" + Timestamps.formatForFileName(startTime) + EXTENSION;
    }

    static String safe(String station) {
        return station.strip().replaceAll("[\\\\/:*?\"<>|\\s]", "_");
    }
}
