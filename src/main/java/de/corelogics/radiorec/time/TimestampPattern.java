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

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One row of the normalizer table: a regular expression and how to turn its groups into a date-time.
 */
record TimestampPattern(String name, Pattern pattern, Extractor extractor) {
    @FunctionalInterface
    interface Extractor {
        LocalDateTime extract(Matcher matcher, Supplier<Year> currentYear);
    }

    static TimestampPattern of(String name, String regex, Extractor extractor) {
        return new TimestampPattern(name, Pattern.compile(regex), extractor);
    }

    Optional<LocalDateTime> apply(String text, Supplier<Year> currentYear) {
        var matcher = pattern.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(extractor.extract(matcher, currentYear));
        } catch (DateTimeException | NumberFormatException e) {
            // matched the shape, but not a real calendar date
            return Optional.empty();
        }
    }
}
