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

package de.corelogics.radiorec.service.tagging;

import de.corelogics.radiorec.model.Program;
import de.corelogics.radiorec.time.Timestamps;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import lombok.val;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.exceptions.CannotReadException;
import org.jaudiotagger.audio.exceptions.CannotWriteException;
import org.jaudiotagger.audio.exceptions.InvalidAudioFrameException;
import org.jaudiotagger.audio.exceptions.ReadOnlyFileException;
import org.jaudiotagger.tag.FieldDataInvalidException;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.TagException;
import org.jaudiotagger.tag.images.ArtworkFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes program metadata into the tags of a recorded file.
 * <p>
 * Cover art is optional: if it cannot be fetched, the file is tagged without it.
 */
@Log4j2
@RequiredArgsConstructor
public class MetadataTagger {
    static final String GENRE = "Radio";
    static final String COMMENT_SEPARATOR = " / ";

    @NonNull
    private final CoverArtClient coverArtClient;

    public void tag(@NonNull Path file, @NonNull Program program) throws TaggingFailedException {
        tag(file, program, null);
    }

    /**
     * @param trackNumber written as track if not {@code null}
     */
    public void tag(@NonNull Path file, @NonNull Program program, Integer trackNumber) throws TaggingFailedException {
        try {
            val audioFile = AudioFileIO.read(file.toFile());
            val tag = audioFile.getTagOrCreateAndSetDefault();
            for (val entry : tagValues(program, trackNumber).entrySet()) {
                tag.setField(entry.getKey(), entry.getValue());
            }
            addCoverArt(tag, program);
            audioFile.commit();
            log.info("Tagged {} as {}", file, program);
        } catch (CannotReadException | IOException | TagException | ReadOnlyFileException
                 | InvalidAudioFrameException | CannotWriteException e) {
            throw new TaggingFailedException("Could not tag " + file + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // jaudiotagger reports some broken containers as runtime exceptions
            throw new TaggingFailedException("Could not tag " + file + ": " + e, e);
        }
    }

    /**
     * The text tags written for a program, absent values left out.
     */
    static Map<FieldKey, String> tagValues(Program program, Integer trackNumber) {
        val values = new EnumMap<FieldKey, String>(FieldKey.class);
        values.put(FieldKey.TITLE, program.getTitle());
        values.put(FieldKey.ALBUM, program.getStation());
        program.getPerformer().ifPresent(performer -> {
            values.put(FieldKey.ARTIST, performer);
            values.put(FieldKey.ALBUM_ARTIST, performer);
        });
        val comment = comment(program);
        if (!comment.isEmpty()) {
            values.put(FieldKey.COMMENT, comment);
        }
        values.put(FieldKey.GENRE, GENRE);
        if (null != trackNumber) {
            values.put(FieldKey.TRACK, Integer.toString(trackNumber));
        }
        values.put(FieldKey.DISC_NO, "1");
        values.put(FieldKey.DISC_TOTAL, "1");
        program.getStartDateTime()
            .map(start -> start.format(DateTimeFormatter.ISO_LOCAL_DATE))
            .ifPresent(date -> values.put(FieldKey.YEAR, date));
        return values;
    }

    static String comment(Program program) {
        return Stream.of(program.getDescription(), program.getInfo())
            .flatMap(Optional::stream)
            .collect(Collectors.joining(COMMENT_SEPARATOR));
    }

    private void addCoverArt(Tag tag, Program program) {
        program.getImageUrl()
            .flatMap(coverArtClient::fetch)
            .ifPresent(coverArt -> {
                try {
                    val artwork = ArtworkFactory.getNew();
                    artwork.setBinaryData(coverArt.data());
                    artwork.setMimeType(coverArt.mimeType());
                    tag.deleteArtworkField();
                    tag.setField(artwork);
                } catch (FieldDataInvalidException | RuntimeException e) {
                    log.warn("Could not embed cover art {} of {}, skipping it: {}", coverArt, program, e.getMessage());
                }
            });
    }
}
