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

package de.corelogics.radiorec;

import de.corelogics.radiorec.client.ClientModule;
import de.corelogics.radiorec.client.RecorderException;
import de.corelogics.radiorec.client.nhk.NhkChannel;
import de.corelogics.radiorec.config.ConfigurationModule;
import de.corelogics.radiorec.config.MainConfiguration;
import de.corelogics.radiorec.service.recording.NhkEpisodeFinder;
import de.corelogics.radiorec.service.recording.RadikoProgramFinder;
import de.corelogics.radiorec.service.recording.RecordingModule;
import de.corelogics.radiorec.service.recording.RecordingOutcome;
import de.corelogics.radiorec.service.recording.RecordingService;
import lombok.extern.log4j.Log4j2;
import lombok.val;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Entry point. Turns positional arguments into one recording and its outcome into the exit code.
 */
@Log4j2
public class Main {
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private static final Pattern BROADCAST_DATE = Pattern.compile("\\d{8}");

    private static final String USAGE = String.join("\n",
        "Usage:",
        "  timefree <station> <yyyyMMddHHmmss from> <yyyyMMddHHmmss to>",
        "  live <station> <minutes>",
        "  nhk-live <NHK1|NHK2|FM> <minutes>",
        "  nhk-find <keyword> [yyyyMMdd]",
        "  radiko-find <keyword> [station] [yyyyMMdd]",
        "Keywords are case-insensitive regular expressions matched against program titles.");

    private final MainConfiguration mainConfiguration;
    private final RecordingService recordingService;
    private final NhkEpisodeFinder nhkEpisodeFinder;
    private final RadikoProgramFinder radikoProgramFinder;

    public Main() throws IOException {
        val configModule = new ConfigurationModule();
        val clientModule = new ClientModule(configModule.getMainConfiguration());
        val recordingModule = new RecordingModule(configModule.getMainConfiguration(), clientModule);
        this.mainConfiguration = configModule.getMainConfiguration();
        this.recordingService = recordingModule.getRecordingService();
        this.nhkEpisodeFinder = recordingModule.getNhkEpisodeFinder();
        this.radikoProgramFinder = recordingModule.getRadikoProgramFinder();
    }

    Main(
        MainConfiguration mainConfiguration,
        RecordingService recordingService,
        NhkEpisodeFinder nhkEpisodeFinder,
        RadikoProgramFinder radikoProgramFinder) {
        this.mainConfiguration = mainConfiguration;
        this.recordingService = recordingService;
        this.nhkEpisodeFinder = nhkEpisodeFinder;
        this.radikoProgramFinder = radikoProgramFinder;
    }

    public static void main(String[] args) throws IOException {
        System.setProperty("java.util.logging.manager", "org.apache.logging.log4j.jul.LogManager");
        val main = new Main();
        log.info("Radio Recorder {}", main.mainConfiguration.getBuildVersion());
        System.exit(main.run(args));
    }

    int run(String... args) {
        if (args.length == 0) {
            return usage("No command given");
        }
        val outputDir = Path.of(mainConfiguration.outputDirectory());
        switch (args[0]) {
            case "timefree":
                if (args.length != 4) {
                    return usage("timefree needs a station, a start and an end");
                }
                return exitCode(recordingService.recordTimeFree(args[1], args[2], args[3], outputDir));
            case "live":
                if (args.length != 3) {
                    return usage("live needs a station and a duration");
                }
                return parseMinutes(args[2])
                    .map(minutes -> exitCode(recordingService.recordLive(args[1], minutes, outputDir)))
                    .orElseGet(() -> usage("Not a positive number of minutes: " + args[2]));
            case "nhk-live":
                if (args.length != 3) {
                    return usage("nhk-live needs a channel and a duration");
                }
                val channel = NhkChannel.fromName(args[1]);
                if (channel.isEmpty()) {
                    return usage("Unknown NHK channel " + args[1]);
                }
                return parseMinutes(args[2])
                    .map(minutes -> exitCode(recordingService.recordNhkLive(channel.get(), minutes, outputDir)))
                    .orElseGet(() -> usage("Not a positive number of minutes: " + args[2]));
            case "nhk-find":
                if (args.length < 2 || args.length > 3) {
                    return usage("nhk-find needs a keyword and optionally a date");
                }
                return recordNhkEpisodes(args[1], args.length == 3 ? args[2] : null, outputDir);
            case "radiko-find":
                if (args.length < 2 || args.length > 4) {
                    return usage("radiko-find needs a keyword and optionally a station and a date");
                }
                return listRadikoPrograms(args);
            default:
                return usage("Unknown command " + args[0]);
        }
    }

    private int recordNhkEpisodes(String keyword, String date, Path outputDir) {
        try {
            val episodes = nhkEpisodeFinder.find(keyword, date);
            if (episodes.isEmpty()) {
                log.error("No recordable NHK episode matches '{}'", keyword);
                return EXIT_FAILURE;
            }
            var exitCode = EXIT_SUCCESS;
            for (val episode : episodes) {
                if (exitCode(recordingService.recordNhkEpisode(episode, outputDir)) != EXIT_SUCCESS) {
                    exitCode = EXIT_FAILURE;
                }
            }
            return exitCode;
        } catch (RecorderException e) {
            log.error("Could not search NHK episodes: {}", e.diagnostic());
            return EXIT_FAILURE;
        } catch (PatternSyntaxException e) {
            return usage("Not a valid keyword: " + e.getDescription());
        }
    }

    /**
     * Logs every match as the timefree command that records it.
     */
    private int listRadikoPrograms(String... args) {
        String station = null;
        String date = null;
        for (var i = 2; i < args.length; i++) {
            if (null == date && BROADCAST_DATE.matcher(args[i]).matches()) {
                date = args[i];
            } else if (null == station && null == date) {
                station = args[i];
            } else {
                return usage("radiko-find takes the station before the date");
            }
        }
        try {
            val programs = radikoProgramFinder.find(args[1], station, date);
            if (programs.isEmpty()) {
                log.info("No radiko program matches '{}'", args[1]);
            }
            for (val program : programs) {
                log.info("timefree {} {} {}    {}", program.getStation(), program.getStartTime(), program.getEndTime(), program);
            }
            return EXIT_SUCCESS;
        } catch (RecorderException e) {
            log.error("Could not search radiko programs: {}", e.diagnostic());
            return EXIT_FAILURE;
        } catch (PatternSyntaxException e) {
            return usage("Not a valid keyword: " + e.getDescription());
        }
    }

    private static int exitCode(RecordingOutcome outcome) {
        if (outcome.isSuccessful()) {
            outcome.getDiagnostic().ifPresent(d -> log.warn("{}: {}", outcome.getStatus(), d));
            log.info("Done: {}", outcome.getFile().map(Path::toString).orElse("-"));
            return EXIT_SUCCESS;
        }
        log.error("Failed: {}", outcome.getDiagnostic().orElse("unknown error"));
        return EXIT_FAILURE;
    }

    private static Optional<Integer> parseMinutes(String text) {
        try {
            val minutes = Integer.parseInt(text.strip());
            return minutes > 0 ? Optional.of(minutes) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static int usage(String problem) {
        log.error("{}\n{}", problem, USAGE);
        return EXIT_FAILURE;
    }
}
