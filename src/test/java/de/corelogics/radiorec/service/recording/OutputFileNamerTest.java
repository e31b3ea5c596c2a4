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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class OutputFileNamerTest {
    private final OutputFileNamer sut = new OutputFileNamer();

    @ParameterizedTest
    @CsvSource({
        "TBS,20260125093000,TBS_2026-01-25-09_30.mp4",
        "NHK2,20260118233059,NHK2_2026-01-18-23_30.mp4",
        "'FM / Tokyo',20260101000000,FM___Tokyo_2026-01-01-00_00.mp4"})
    void givenCanonicalStart_thenBuildStationAndMinute(String station, String start, String expected) {
        assertThat(sut.fileName(station, start)).isEqualTo(expected);
    }

    @Test
    void givenDateTime_thenUseSameFormat() {
        assertThat(sut.fileName("QRR", LocalDateTime.of(2026, 3, 4, 5, 6, 7))).isEqualTo("QRR_2026-03-04-05_06.mp4");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "2026-01-25", "202601250930"})
    void givenNonCanonicalStart_thenReject(String start) {
        assertThatIllegalArgumentException().isThrownBy(() -> sut.fileName("TBS", start));
    }
}
