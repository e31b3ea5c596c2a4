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
import lombok.extern.log4j.Log4j2;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;

/**
 * Converts the date and time texts of both services into canonical {@code yyyyMMddHHmmss} timestamps.
 * <p>
 * Each service has an ordered table of patterns, the first matching pattern wins. Texts without a
 * year get the current year. Texts no pattern understands are returned unchanged.
 */
@Log4j2
public class TimeNormalizer {
    private static final String AM = "午前";
    private static final String PM = "午後";

    private static final String WEEKDAY = "\\s*(?:[(（][^)）]*[)）])?\\s*";
    private static final String MERIDIEM_TIME = "(午前|午後)\\s*(\\d{1,2})[:：](\\d{2})";
    private static final String BROADCAST_SUFFIX = "(?:放送|配信終了)?";

    static final TimestampPattern DIGITS_14 = TimestampPattern.of(
        "digits-14",
        "(\\d{14})",
        (m, y) -> Timestamps.parse(m.group(1)).orElse(null));

    static final TimestampPattern DIGITS_8 = TimestampPattern.of(
        "digits-8",
        "(\\d{4})(\\d{2})(\\d{2})",
        (m, y) -> date(m, 1).atStartOfDay());

    static final TimestampPattern ISO_DATE_TIME = TimestampPattern.of(
        "iso-date-time",
        "(\\d{4})-(\\d{1,2})-(\\d{1,2})[ T](\\d{1,2}):(\\d{2})(?::(\\d{2}))?(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?",
        (m, y) -> date(m, 1).atTime(
            Integer.parseInt(m.group(4)),
            Integer.parseInt(m.group(5)),
            null == m.group(6) ? 0 : Integer.parseInt(m.group(6))));

    static final TimestampPattern ISO_DATE = TimestampPattern.of(
        "iso-date",
        "(\\d{4})-(\\d{1,2})-(\\d{1,2})",
        (m, y) -> date(m, 1).atStartOfDay());

    static final TimestampPattern ISO_DATE_JAPANESE_TIME = TimestampPattern.of(
        "iso-date-japanese-time",
        "(\\d{4})-(\\d{1,2})-(\\d{1,2})" + WEEKDAY + MERIDIEM_TIME + BROADCAST_SUFFIX,
        (m, y) -> date(m, 1).atTime(hour24(m.group(4), m.group(5)), Integer.parseInt(m.group(6))));

    static final TimestampPattern JAPANESE_DATE_TIME = TimestampPattern.of(
        "japanese-date-time",
        "(?:(\\d{4})年)?(\\d{1,2})月(\\d{1,2})日" + WEEKDAY + MERIDIEM_TIME + BROADCAST_SUFFIX,
        (m, y) -> japaneseDate(m, y).atTime(hour24(m.group(4), m.group(5)), Integer.parseInt(m.group(6))));

    static final TimestampPattern JAPANESE_DATE = TimestampPattern.of(
        "japanese-date",
        "(?:(\\d{4})年)?(\\d{1,2})月(\\d{1,2})日" + WEEKDAY + BROADCAST_SUFFIX,
        (m, y) -> japaneseDate(m, y).atStartOfDay());

    private static final List<TimestampPattern> MACHINE_READABLE = List.of(
        DIGITS_14, DIGITS_8, ISO_DATE_TIME, ISO_DATE);

    private final Map<ProgramSource, List<TimestampPattern>> patternsBySource = new EnumMap<>(ProgramSource.class);
    private final Supplier<Year> currentYearProvider;

    public TimeNormalizer() {
        this(Year::now);
    }

    public TimeNormalizer(Supplier<Year> currentYearProvider) {
        this.currentYearProvider = currentYearProvider;
        patternsBySource.put(ProgramSource.RADIKO, MACHINE_READABLE);
        patternsBySource.put(ProgramSource.NHK, List.of(
            DIGITS_14, DIGITS_8, ISO_DATE_TIME, ISO_DATE,
            ISO_DATE_JAPANESE_TIME, JAPANESE_DATE_TIME, JAPANESE_DATE));
    }

    public String normalize(String rawText, ProgramSource source) {
        if (null == rawText) {
            return null;
        }
        var text = rawText.strip();
        for (var pattern : patternsBySource.get(source)) {
            var parsed = pattern.apply(text, currentYearProvider);
            if (parsed.isPresent()) {
                log.trace("'{}' matched pattern {}", text, pattern.name());
                return Timestamps.format(parsed.get());
            }
        }
        log.debug("No {} time pattern matches '{}', keeping it as is", source, rawText);
        return rawText;
    }

    public LocalDateTime normalizeToDateTime(String rawText, ProgramSource source) {
        return Timestamps.parse(normalize(rawText, source)).orElse(null);
    }

    static int hour24(String meridiem, String hourText) {
        var hour = Integer.parseInt(hourText);
        if (PM.equals(meridiem) && hour != 12) {
            return hour + 12;
        }
        if (AM.equals(meridiem) && hour == 12) {
            return 0;
        }
        return hour;
    }

    private static LocalDate date(Matcher m, int firstGroup) {
        return LocalDate.of(
            Integer.parseInt(m.group(firstGroup)),
            Integer.parseInt(m.group(firstGroup + 1)),
            Integer.parseInt(m.group(firstGroup + 2)));
    }

    private static LocalDate japaneseDate(Matcher m, Supplier<Year> currentYear) {
        var year = null == m.group(1) ? currentYear.get().getValue() : Integer.parseInt(m.group(1));
        return LocalDate.of(year, Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }
}
