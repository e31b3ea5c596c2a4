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

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.nio.file.Path;
import java.util.Optional;

/**
 * What a recording run produced. Failed runs carry no file, every run except a clean success carries a
 * labelled diagnostic.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class RecordingOutcome {
    @NonNull
    private final RecordingStatus status;

    @Getter(AccessLevel.NONE)
    private final Path file;

    @Getter(AccessLevel.NONE)
    private final String diagnostic;

    public static RecordingOutcome succeeded(@NonNull Path file) {
        return new RecordingOutcome(RecordingStatus.SUCCEEDED, file, null);
    }

    public static RecordingOutcome succeededWithoutMetadata(@NonNull Path file, @NonNull String diagnostic) {
        return new RecordingOutcome(RecordingStatus.SUCCEEDED_WITHOUT_METADATA, file, diagnostic);
    }

    public static RecordingOutcome failed(@NonNull String diagnostic) {
        return new RecordingOutcome(RecordingStatus.FAILED, null, diagnostic);
    }

    public Optional<Path> getFile() {
        return Optional.ofNullable(file);
    }

    public Optional<String> getDiagnostic() {
        return Optional.ofNullable(diagnostic);
    }

    public boolean isSuccessful() {
        return status.isSuccessful();
    }
}
