package de.entwicklertraining.api.resilient.retry;

import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Parses the {@code Retry-After} response header into a wait duration.
 * <p>
 * Recognized forms, tried in this order:
 * <ol>
 *   <li>delta seconds, e.g. {@code 120}; {@code 0} becomes one second so the client never spins</li>
 *   <li>IMF-fixdate, e.g. {@code Sun, 06 Nov 1994 08:49:37 GMT}</li>
 *   <li>RFC 2822, e.g. {@code Tue, 3 Jun 2008 11:05:30 +0200}, including the obsolete zone
 *       names {@code UT}, {@code EST} or {@code PDT}</li>
 *   <li>RFC 3339, e.g. {@code 2008-06-03T11:05:30Z}; the separator may be {@code T}, {@code t}
 *       or a space</li>
 * </ol>
 * Delta seconds too large to be represented in milliseconds saturate at {@link #MAXIMUM_WAIT};
 * configured caps then bound the actual sleep.
 * A date that already lies in the past still yields one second: the server asked for a delay,
 * and clock skew must not turn that into an immediate retry.
 * Absent, negative or unparseable values yield an empty result.
 */
public final class RetryAfterParser {

    /** Name of the header this parser reads. */
    public static final String HEADER = "Retry-After";

    static final Duration MINIMUM_WAIT = Duration.ofSeconds(1);

    /** The longest wait this parser reports, so that callers can always convert it to millis. */
    public static final Duration MAXIMUM_WAIT = Duration.ofMillis(Long.MAX_VALUE);

    private static final long MAXIMUM_SECONDS = MAXIMUM_WAIT.getSeconds();

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d+");

    private static final DateTimeFormatter IMF_FIXDATE =
            DateTimeFormatter.ofPattern("EEE, dd MMM yyyy HH:mm:ss 'GMT'", Locale.US).withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter RFC_3339 = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendPattern("[ ]['T']")
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .appendOffsetId()
            .toFormatter(Locale.ROOT);

    // RFC 2822 section 4.3; military single-letter zones other than Z are ambiguous and rejected
    private static final Map<String, String> OBSOLETE_ZONES = Map.ofEntries(
            Map.entry("UT", "+0000"),
            Map.entry("Z", "+0000"),
            Map.entry("EST", "-0500"),
            Map.entry("EDT", "-0400"),
            Map.entry("CST", "-0600"),
            Map.entry("CDT", "-0500"),
            Map.entry("MST", "-0700"),
            Map.entry("MDT", "-0600"),
            Map.entry("PST", "-0800"),
            Map.entry("PDT", "-0700"));

    private final Clock clock;

    /**
     * Creates a parser measuring dates against the system UTC clock.
     */
    public RetryAfterParser() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a parser measuring dates against the given clock.
     *
     * @param clock The clock that defines "now"
     */
    public RetryAfterParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Reads the first {@code Retry-After} value from the headers.
     *
     * @param headers The response headers
     * @return The requested wait, or empty if the header is absent or unparseable
     */
    public Optional<Duration> parse(HttpHeaders headers) {
        return headers.firstValue(HEADER).flatMap(this::parse);
    }

    /**
     * Parses a raw header value.
     *
     * @param value The header value, may be null
     * @return The requested wait, or empty if the value is unparseable
     */
    public Optional<Duration> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            long seconds;
            try {
                seconds = Long.parseLong(trimmed);
            } catch (NumberFormatException overflow) {
                // only digits, so the value is valid and merely beyond a long
                return Optional.of(MAXIMUM_WAIT);
            }
            if (seconds == 0) {
                return Optional.of(MINIMUM_WAIT);
            }
            return Optional.of(seconds >= MAXIMUM_SECONDS ? MAXIMUM_WAIT : Duration.ofSeconds(seconds));
        }

        return parseDate(trimmed).map(this::untilInstant);
    }

    private Optional<Instant> parseDate(String value) {
        return tryParse(() -> ZonedDateTime.parse(value, IMF_FIXDATE).toInstant())
                .or(() -> tryParse(() -> ZonedDateTime.parse(withNumericZone(value), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()))
                .or(() -> tryParse(() -> OffsetDateTime.parse(value, RFC_3339).toInstant()));
    }

    private static String withNumericZone(String value) {
        int lastSpace = value.lastIndexOf(' ');
        if (lastSpace < 0) {
            return value;
        }
        String zone = OBSOLETE_ZONES.get(value.substring(lastSpace + 1).toUpperCase(Locale.ROOT));
        return zone == null ? value : value.substring(0, lastSpace + 1) + zone;
    }

    private static Optional<Instant> tryParse(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private Duration untilInstant(Instant target) {
        Instant now = clock.instant();
        if (!target.isAfter(now)) {
            return MINIMUM_WAIT;
        }
        long seconds = Duration.between(now, target).getSeconds();
        return Duration.ofSeconds(Math.max(1L, seconds));
    }
}
