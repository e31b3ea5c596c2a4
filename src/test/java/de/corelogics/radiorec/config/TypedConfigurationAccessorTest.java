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

package de.corelogics.radiorec.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.SoftAssertions.assertSoftly;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TypedConfigurationAccessorTest {
    @InjectMocks
    private TypedConfigurationAccessor sut;

    @Mock
    private StringPropertySource propSource;

    @AfterEach
    void assertNoUnwantedInvocations() {
        verifyNoMoreInteractions(propSource);
    }

    @Nested
    class WhenGettingStringPropertyTest {
        @ParameterizedTest
        @ValueSource(strings = {"a", "prop-ä", "sd:d"})
        void givenValueExists_thenReturnValueAndCache(String key) {
            var expectedValue = "value:" + key;
            when(propSource.getConfigValue(key)).thenReturn(Optional.of(expectedValue));

            assertSoftly(a -> {
                a.assertThat(sut.get(key, null)).describedAs("First get").isEqualTo(expectedValue);
                a.assertThat(sut.get(key, null)).describedAs("Second get").isEqualTo(expectedValue);
            });
            verify(propSource, times(1)).getConfigValue(key);
        }

        @Test
        void givenValueWithSurroundingBlanks_thenReturnTrimmedValue() {
            when(propSource.getConfigValue("FFMPEG_PATH")).thenReturn(Optional.of("  /usr/bin/ffmpeg "));

            assertThat(sut.get("FFMPEG_PATH", "ffmpeg")).isEqualTo("/usr/bin/ffmpeg");
            verify(propSource).getConfigValue("FFMPEG_PATH");
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "prop-ä", "sd:d"})
        void givenValueDoesntExist_thenReturnDefaultValueAndCache(String key) {
            when(propSource.getConfigValue(any())).thenReturn(Optional.empty());

            assertSoftly(a -> {
                a.assertThat(sut.get(key, "default:" + key)).describedAs("First get").isEqualTo("default:" + key);
                a.assertThat(sut.get(key, "default:" + key)).describedAs("Second get").isEqualTo("default:" + key);
                a.assertThat(sut.get(key, null)).describedAs("Third get").isNull();
            });
            verify(propSource, times(1)).getConfigValue(key);
        }
    }

    @Nested
    class WhenGettingIntPropertyTest {
        @ParameterizedTest
        @ValueSource(strings = {"a", "prop-ä", "sd:d"})
        void givenValueExists_thenReturnValueAndCache(String key) {
            var expectedValue = key.hashCode();
            when(propSource.getConfigValue(key)).thenReturn(Optional.of(Integer.toString(expectedValue)));

            assertSoftly(a -> {
                a.assertThat(sut.get(key, 0)).describedAs("First get").isEqualTo(expectedValue);
                a.assertThat(sut.get(key, 0)).describedAs("Second get").isEqualTo(expectedValue);
            });
            verify(propSource, times(1)).getConfigValue(key);
        }

        @ParameterizedTest
        @ValueSource(strings = {"a", "prop-ä", "sd:d"})
        void givenValueDoesntExist_thenReturnDefaultValueAndCache(String key) {
            when(propSource.getConfigValue(any())).thenReturn(Optional.empty());

            assertSoftly(a -> {
                a.assertThat(sut.get(key, 100)).describedAs("First get").isEqualTo(100);
                a.assertThat(sut.get(key, 200)).describedAs("Second get").isEqualTo(200);
            });
            verify(propSource, times(1)).getConfigValue(key);
        }
    }

    @Nested
    class WhenGettingLongPropertyTest {
        @Test
        void givenValueExists_thenReturnValue() {
            when(propSource.getConfigValue("RETRY_BACKOFF_MILLIS")).thenReturn(Optional.of("12345678901"));

            assertThat(sut.get("RETRY_BACKOFF_MILLIS", 2000L)).isEqualTo(12345678901L);
            verify(propSource).getConfigValue("RETRY_BACKOFF_MILLIS");
        }

        @Test
        void givenValueDoesntExist_thenReturnDefaultValue() {
            when(propSource.getConfigValue("RETRY_BACKOFF_MILLIS")).thenReturn(Optional.empty());

            assertThat(sut.get("RETRY_BACKOFF_MILLIS", 2000L)).isEqualTo(2000L);
            verify(propSource).getConfigValue("RETRY_BACKOFF_MILLIS");
        }
    }

    @Nested
    class WhenGettingListPropertyTest {
        @Test
        void givenCommaSeparatedValue_thenReturnTrimmedNonEmptyParts() {
            when(propSource.getConfigValue("LIVE_PLAYLIST_MARKERS")).thenReturn(Optional.of("chunklist, ,media_ ,"));

            assertThat(sut.getList("LIVE_PLAYLIST_MARKERS", "chunklist")).containsExactly("chunklist", "media_");
            verify(propSource).getConfigValue("LIVE_PLAYLIST_MARKERS");
        }

        @Test
        void givenValueDoesntExist_thenSplitDefault() {
            when(propSource.getConfigValue("LIVE_PLAYLIST_MARKERS")).thenReturn(Optional.empty());

            assertThat(sut.getList("LIVE_PLAYLIST_MARKERS", "chunklist,playlist_")).containsExactly("chunklist", "playlist_");
            verify(propSource).getConfigValue("LIVE_PLAYLIST_MARKERS");
        }
    }
}
