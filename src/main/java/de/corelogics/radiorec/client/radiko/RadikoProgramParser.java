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

package de.corelogics.radiorec.client.radiko;

import de.corelogics.radiorec.client.NormalizationException;
import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.model.ProgramSource;
import de.corelogics.radiorec.util.XmlUtils;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maps radiko program XML to {@link Program}s.
 * <p>
 * All children of {@code <prog>} are optional. {@code ft} and {@code to} are already canonical.
 */
@Log4j2
public class RadikoProgramParser {
    public List<Program> parsePrograms(@NonNull String xml, @NonNull String station, String area)
        throws NormalizationException {
        val root = XmlUtils.parse(xml, "radiko").getDocumentElement();
        val stationElements = XmlUtils.elements(root, "station").stream()
            .filter(e -> station.equals(e.getAttribute("id")))
            .collect(Collectors.toList());
        // the weekly and date listings wrap programs in <station id>, others don't
        val progs = stationElements.isEmpty()
            ? XmlUtils.elements(root, "prog")
            : stationElements.stream().flatMap(s -> XmlUtils.elements(s, "prog").stream()).collect(Collectors.toList());
        val programs = progs.stream()
            .map(p -> fromProgramElement(p, station, area))
            .collect(Collectors.toList());
        log.debug("Parsed {} programs of {}", programs.size(), station);
        return programs;
    }

    public Program fromProgramElement(@NonNull Element prog, @NonNull String station, String area) {
        return Program.builder()
            .title(XmlUtils.childText(prog, "title").orElse(""))
            .station(station)
            .area(area)
            .source(ProgramSource.RADIKO)
            .startTime(prog.getAttribute("ft"))
            .endTime(prog.getAttribute("to"))
            .durationMinutes(durationMinutes(prog).orElse(null))
            .performer(XmlUtils.childText(prog, "pfm").orElse(null))
            .description(XmlUtils.childText(prog, "desc").orElse(null))
            .info(XmlUtils.childText(prog, "info").orElse(null))
            .imageUrl(XmlUtils.childText(prog, "img").orElse(null))
            .url(XmlUtils.childText(prog, "url").orElse(null))
            .build();
    }

    // dur is given in seconds, a missing or zero dur leaves the duration to ft and to
    private static Optional<Integer> durationMinutes(Element prog) {
        val dur = prog.getAttribute("dur").strip();
        if (dur.isEmpty()) {
            return Optional.empty();
        }
        try {
            val seconds = Integer.parseInt(dur);
            return seconds > 0 ? Optional.of(seconds / 60) : Optional.empty();
        } catch (NumberFormatException e) {
            log.debug("Ignoring duration '{}' of program at {}", dur, prog.getAttribute("ft"));
            return Optional.empty();
        }
    }
}
