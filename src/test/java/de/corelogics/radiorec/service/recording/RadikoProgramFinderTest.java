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
import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.client.radiko.RadikoProgramClient;
import de.corelogics.radiorec.client.radiko.RadikoStationClient;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.ProgramSource;
import de.corelogics.radiorec.model.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RadikoProgramFinderTest {
    private static final ZoneId TOKYO = ZoneId.of("Asia/Tokyo");

    @Mock
    private MainConfiguration mainConfiguration;
    @Mock
    private RadikoStationClient radikoStationClient;
    @Mock
    private RadikoProgramClient radikoProgramClient;

    private RadikoProgramFinder sut;

    @BeforeEach
    void createSut() {
        lenient().when(mainConfiguration.radikoAreaId()).thenReturn("JP13");
        // 03:00 still belongs to the broadcast day of the 25th
        var clock = Clock.fixed(LocalDateTime.of(2026, 1, 26, 3, 0).atZone(TOKYO).toInstant(), TOKYO);
        sut = new RadikoProgramFinder(mainConfiguration, radikoStationClient, radikoProgramClient, clock);
    }

    private static Program radiko(String station, String title, String start) {
        return Program.builder()
            .title(title)
            .station(station)
            .startTime(start)
            .endTime(start.substring(0, 10) + "5500")
            .source(ProgramSource.RADIKO)
            .build();
    }

    @Nested
    class GivenAllStationsTest {
        private final Program morningTalk = radiko("TBS", "Morning Talk", "20260125060000");
        private final Program baseball = radiko("TBS", "Baseball Night", "20260125180000");
        private final Program jazzTalk = radiko("QRR", "JAZZ TALK", "20260125220000");

        @BeforeEach
        void setupStations() throws Exception {
            lenient().when(radikoStationClient.getStations("JP13"))
                .thenReturn(List.of(new Station("TBS", "TBS Radio"), new Station("QRR", "Bunka Hoso"), new Station("LFR", "Nippon Hoso")));
        }

        @Test
        void whenFinding_thenSearchEveryStationOfTheArea() throws Exception {
            when(radikoProgramClient.getPrograms("TBS", "20260125")).thenReturn(List.of(morningTalk, baseball));
            when(radikoProgramClient.getPrograms("QRR", "20260125")).thenReturn(List.of(jazzTalk));
            when(radikoProgramClient.getPrograms("LFR", "20260125")).thenReturn(List.of());

            assertThat(sut.find("talk", null, null)).containsExactly(morningTalk, jazzTalk);
        }

        @Test
        void givenOneStationFails_whenFinding_thenSkipIt() throws Exception {
            when(radikoProgramClient.getPrograms("TBS", "20260124")).thenReturn(List.of(morningTalk));
            when(radikoProgramClient.getPrograms("QRR", "20260124"))
                .thenThrow(new ListingHttpException("Could not load programs of QRR on 20260124"));
            when(radikoProgramClient.getPrograms("LFR", "20260124"))
                .thenThrow(new NormalizationException("Program list is not valid XML"));

            assertThat(sut.find("talk", null, "20260124")).containsExactly(morningTalk);
        }

        @Test
        void givenRegularExpression_whenFinding_thenMatchTitlesAgainstIt() throws Exception {
            when(radikoProgramClient.getPrograms(any(), any())).thenReturn(List.of(morningTalk, baseball, jazzTalk));

            assertThat(sut.find("^(morning|baseball)\\b", null, null)).containsExactly(
                morningTalk, baseball, morningTalk, baseball, morningTalk, baseball);
        }

        @Test
        void givenStationListUnreachable_whenFinding_thenFail() throws Exception {
            when(radikoStationClient.getStations("JP13")).thenThrow(new ListingHttpException("Could not load station list"));

            assertThatExceptionOfType(ListingHttpException.class).isThrownBy(() -> sut.find("talk", null, null));
            verifyNoInteractions(radikoProgramClient);
        }
    }

    @Test
    void givenStation_whenFinding_thenSearchOnlyItsListing() throws Exception {
        var sundayTalk = radiko("TBS", "Sunday Talk", "20260125093000");
        when(radikoProgramClient.getPrograms("TBS", "20260125"))
            .thenReturn(List.of(sundayTalk, radiko("TBS", "News", "20260125100000")));

        assertThat(sut.find("TALK", "TBS", null)).containsExactly(sundayTalk);
        verifyNoInteractions(radikoStationClient);
    }

    @Test
    void givenStationListingFails_whenFinding_thenPropagate() throws Exception {
        when(radikoProgramClient.getPrograms("TBS", "20260125")).thenThrow(new ListingHttpException("Could not load programs of TBS"));

        assertThatExceptionOfType(ListingHttpException.class).isThrownBy(() -> sut.find("talk", "TBS", null));
    }

    @Test
    void givenInvalidRegularExpression_whenFinding_thenFailBeforeLoading() throws Exception {
        assertThatExceptionOfType(PatternSyntaxException.class).isThrownBy(() -> sut.find("(talk", null, null));
        verify(radikoStationClient, never()).getStations(any());
        verifyNoInteractions(radikoProgramClient);
    }
}
