package com.phillippitts.serverwarden.service.logs;

import com.phillippitts.serverwarden.domain.LogEvent;
import com.phillippitts.serverwarden.domain.PerformanceSample;
import com.phillippitts.serverwarden.domain.StatusKind;
import com.phillippitts.serverwarden.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw server console lines into typed lifecycle events.
 *
 * <p>Markers and timestamp prefix follow the Project Zomboid {@code server-console.txt} format that
 * the default configuration points at.
 *
 * <p>Recognized markers (case-insensitive substring match, checked in this order):
 * <ul>
 *   <li>global stats line ({@code GlobalStats: fps=.. players=..}) - ONLINE with a performance sample</li>
 *   <li>"server interrupted" / shutdown markers - SHUTTING_DOWN</li>
 *   <li>process exit markers - OFFLINE</li>
 *   <li>{@code *** SERVER STARTED ***} - ONLINE</li>
 *   <li>world loading markers - LOADING</li>
 *   <li>process start markers ({@code versionNumber=}, "starting server") - STARTING</li>
 * </ul>
 *
 * <p>Timestamps are taken from a leading {@code [dd-MM-yy HH:mm:ss.SSS]} or
 * {@code yyyy-MM-dd HH:mm:ss} prefix when present and well-formed; otherwise the wall clock is used.
 * Lines matching nothing yield {@link Optional#empty()}. The parser never throws: empty, partial or
 * noisy lines are skipped.
 *
 * <p>Thread-safe: stateless apart from the injected clock.
 */
@Component
public class LogEventParser {

    private static final Logger LOG = LogManager.getLogger(LogEventParser.class);

    private static final int PREVIEW_CHARS = 120;

    private static final Pattern BRACKET_TIMESTAMP =
            Pattern.compile("^\\[(\\d{2}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}(?:\\.\\d{1,3})?)]");
    private static final Pattern ISO_TIMESTAMP =
            Pattern.compile("^\\[?(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2})");
    private static final DateTimeFormatter BRACKET_FORMAT =
            DateTimeFormatter.ofPattern("dd-MM-yy HH:mm:ss[.SSS][.SS][.S]");
    private static final DateTimeFormatter ISO_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd['T'][' ']HH:mm:ss");

    private static final Pattern STAT_PAIR =
            Pattern.compile("([A-Za-z]+)\\s*[=:]\\s*(-?\\d+(?:\\.\\d+)?)");

    private static final String GLOBAL_STATS_MARKER = "globalstats";
    private static final List<String> SHUTDOWN_MARKERS =
            List.of("server interrupted", "shutting down", "server shutdown", "shutdown requested");
    private static final List<String> EXIT_MARKERS =
            List.of("process exited", "server exited", "server terminated", "server stopped");
    private static final List<String> ONLINE_MARKERS =
            List.of("*** server started ***", "server started");
    private static final List<String> LOADING_MARKERS =
            List.of("loading world", "loading map", "initializing world", "world loading");
    private static final List<String> STARTING_MARKERS =
            List.of("versionnumber=", "starting server", "server is starting");

    private final Clock clock;

    public LogEventParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Parses one log line.
     *
     * @param line raw line (may be null, empty, partial or contain undecodable bytes)
     * @return the lifecycle event the line indicates, or empty when it indicates none
     */
    public Optional<LogEvent> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            String clean = LogSanitizer.stripNoise(line).trim();
            if (clean.isEmpty()) {
                return Optional.empty();
            }
            StatusKind kind = classify(clean);
            if (kind == null) {
                return Optional.empty();
            }
            Instant timestamp = extractTimestamp(clean);
            PerformanceSample sample = isGlobalStats(clean) ? parseStats(clean) : null;
            return Optional.of(new LogEvent(timestamp, kind, sample));
        } catch (RuntimeException e) {
            LOG.debug("Skipping unparseable log line '{}': {}",
                    LogSanitizer.preview(line, PREVIEW_CHARS), e.toString());
            return Optional.empty();
        }
    }

    private static StatusKind classify(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        if (isGlobalStats(line)) {
            return StatusKind.ONLINE;
        }
        if (containsAny(lower, SHUTDOWN_MARKERS)) {
            return StatusKind.SHUTTING_DOWN;
        }
        if (containsAny(lower, EXIT_MARKERS)) {
            return StatusKind.OFFLINE;
        }
        if (containsAny(lower, ONLINE_MARKERS)) {
            return StatusKind.ONLINE;
        }
        if (containsAny(lower, LOADING_MARKERS)) {
            return StatusKind.LOADING;
        }
        if (containsAny(lower, STARTING_MARKERS)) {
            return StatusKind.STARTING;
        }
        return null;
    }

    private static boolean isGlobalStats(String line) {
        return line.toLowerCase(Locale.ROOT).replace(" ", "").contains(GLOBAL_STATS_MARKER);
    }

    private static boolean containsAny(String lower, List<String> markers) {
        for (String marker : markers) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /** Best effort; falls back to the wall clock when the prefix is absent or malformed. */
    Instant extractTimestamp(String line) {
        try {
            Matcher bracket = BRACKET_TIMESTAMP.matcher(line);
            if (bracket.find()) {
                return LocalDateTime.parse(bracket.group(1), BRACKET_FORMAT)
                        .atZone(clock.getZone()).toInstant();
            }
            Matcher iso = ISO_TIMESTAMP.matcher(line);
            if (iso.find()) {
                return LocalDateTime.parse(iso.group(1), ISO_FORMAT)
                        .atZone(clock.getZone()).toInstant();
            }
        } catch (DateTimeParseException e) {
            LOG.trace("Malformed timestamp prefix, using wall clock: {}", e.getMessage());
        }
        return clock.instant();
    }

    /**
     * Extracts a performance sample from a global stats line; null when no frame rate is present.
     */
    static PerformanceSample parseStats(String line) {
        Map<String, Double> values = new HashMap<>();
        Matcher m = STAT_PAIR.matcher(line);
        while (m.find()) {
            values.put(m.group(1).toLowerCase(Locale.ROOT), Double.parseDouble(m.group(2)));
        }
        Double avg = firstOf(values, "fps", "avgfps");
        if (avg == null) {
            return null;
        }
        double min = orDefault(firstOf(values, "minfps", "min"), avg);
        double max = orDefault(firstOf(values, "maxfps", "max"), avg);
        double frameTime = orDefault(firstOf(values, "frametime", "frametimems"),
                avg > 0 ? 1000.0 / avg : 0.0);
        int players = (int) orDefault(firstOf(values, "players", "playercount"), 0.0);
        PerformanceSample.EntityCounts counts = new PerformanceSample.EntityCounts(
                (int) orDefault(values.get("characters"), 0.0),
                (int) orDefault(values.get("zombies"), 0.0),
                (int) orDefault(values.get("vehicles"), 0.0));
        return new PerformanceSample(avg, min, max, frameTime, Math.max(0, players), counts);
    }

    private static Double firstOf(Map<String, Double> values, String... keys) {
        for (String key : keys) {
            Double v = values.get(key);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }
}
