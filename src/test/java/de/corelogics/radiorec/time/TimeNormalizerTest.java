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

package de.corelogics.radiorec.time;

import de.corelogics.radiorec.model.ProgramSource;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Year;

import static org.assertj.core.api.Assertions.assertThat;

class TimeNormalizerTest {
    private final TimeNormalizer sut = new TimeNormalizer(() -> Year.of(2026));

    @Nested
    class GivenNhkNaturalLanguageTest {
        @Test
        void givenAfternoon_thenAddTwelveHours() {
            assertThat(sut.normalize("1月18日(日)午後11:30放送", ProgramSource.NHK))
                .endsWith("233000")
                .isEqualTo("20260118233000");
        }

        @Test
        void givenMorning_thenKeepHour() {
            assertThat(sut.normalize("1月18日(日)午前9:00放送", ProgramSource.NHK))
                .endsWith("090000")
                .isEqualTo("20260118090000");
        }

        @ParameterizedTest
        @CsvSource({
            "1月18日(日)午後12:10放送,20260118121000",
            "1月18日(日)午前12:10放送,20260118001000",
            "2025年12月31日(水)午後11:00放送,20251231230000",
            "2026年1月25日(日)午後11:50配信終了,20260125235000",
            "1月18日（日）午後3:05放送,20260118150500",
            "2026-01-18(日)午後11:30放送,20260118233000",
            "2026年1月18日,20260118000000",
            "12月31日,20261231000000"})
        void givenVariants_thenNormalize(String raw, String expected) {
            assertThat(sut.normalize(raw, ProgramSource.NHK)).isEqualTo(expected);
        }

        @Test
        void givenNoYear_thenUseInjectedYear() {
            assertThat(new TimeNormalizer(() -> Year.of(2030)).normalize("3月1日(金)午前5:00放送", ProgramSource.NHK))
                .isEqualTo("20300301050000");
        }

        @Test
        void givenRadikoSource_thenNaturalLanguageIsNotUnderstood() {
            assertThat(sut.normalize("1月18日(日)午後11:30放送", ProgramSource.RADIKO)).isEqualTo("1月18日(日)午後11:30放送");
        }
    }

    @Nested
    class GivenMachineReadableTest {
        @ParameterizedTest
        @CsvSource({
            "20260125093000,20260125093000",
            "20260125,20260125000000",
            "2026-01-25 09:30,20260125093000",
            "2026-01-25T09:30:15,20260125093015",
            "2026-01-25T09:30:00+09:00,20260125093000",
            "2026-01-25,20260125000000",
            "' 20260125093000 ',20260125093000"})
        void givenFormat_thenNormalize(String raw, String expected) {
            assertThat(sut.normalize(raw, ProgramSource.RADIKO)).isEqualTo(expected);
            assertThat(sut.normalize(raw, ProgramSource.NHK)).isEqualTo(expected);
        }
    }

    @Nested
    class GivenUnknownTest {
        @ParameterizedTest
        @ValueSource(strings = {"", "tomorrow", "2026013", "20261345093000", "2月30日(月)午前9:00放送", "1月18日(日)午後13:30放送"})
        void thenReturnInputUnchanged(String raw) {
            assertThat(sut.normalize(raw, ProgramSource.NHK)).isEqualTo(raw);
        }

        @Test
        void givenNull_thenReturnNull() {
            assertThat(sut.normalize(null, ProgramSource.NHK)).isNull();
        }
    }

    @Nested
    class WhenConvertingHoursTest {
        @ParameterizedTest
        @CsvSource({"午前,0,0", "午前,9,9", "午前,12,0", "午後,1,13", "午後,11,23", "午後,12,12"})
        void thenApplyMeridiem(String meridiem, String hour, int expected) {
            assertThat(TimeNormalizer.hour24(meridiem, hour)).isEqualTo(expected);
        }
    }
}
