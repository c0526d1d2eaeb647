package io.github.gitstore.yaml;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The implicit YAML 1.1 timestamp type ({@code tag:yaml.org,2002:timestamp}).
 *
 * <p>Jackson hands every timestamp scalar over as a plain string; this class recognizes such scalars and turns them
 * into {@link Instant}s. A timestamp without a zone is taken to be UTC, a bare date is midnight UTC.
 */
public final class TimestampType {
    private static final Pattern DATE_ONLY = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})$");

    private static final Pattern DATE_TIME = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})"
            + "(?:[Tt]|[ \\t]+)(\\d{1,2}):(\\d{2}):(\\d{2})"
            + "(?:\\.(\\d*))?"
            + "(?:[ \\t]*(Z|([-+])(\\d{1,2})(?::?(\\d{2}))?))?$");

    private TimestampType() {}

    public static boolean matches(String scalar) {
        return DATE_ONLY.matcher(scalar).matches() || DATE_TIME.matcher(scalar).matches();
    }

    /** Parses {@code scalar} as a YAML timestamp, or returns empty if it is not one. */
    public static Optional<Instant> parse(String scalar) {
        var dateOnly = DATE_ONLY.matcher(scalar);
        if (dateOnly.matches()) {
            try {
                var date = LocalDate.of(
                        Integer.parseInt(dateOnly.group(1)),
                        Integer.parseInt(dateOnly.group(2)),
                        Integer.parseInt(dateOnly.group(3)));
                return Optional.of(date.atStartOfDay().toInstant(ZoneOffset.UTC));
            } catch (java.time.DateTimeException e) {
                return Optional.empty();
            }
        }
        var m = DATE_TIME.matcher(scalar);
        if (!m.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(toInstant(m));
        } catch (java.time.DateTimeException e) {
            return Optional.empty();
        }
    }

    /** Canonical text form, as written to YAML files. */
    public static String format(Instant instant) {
        return instant.toString();
    }

    private static Instant toInstant(Matcher m) {
        int nanos = 0;
        var fraction = m.group(7);
        if (fraction != null && !fraction.isEmpty()) {
            var digits = fraction.length() > 9 ? fraction.substring(0, 9) : fraction;
            nanos = Integer.parseInt(digits) * (int) Math.pow(10, 9 - digits.length());
        }
        var local = LocalDateTime.of(
                Integer.parseInt(m.group(1)),
                Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)),
                Integer.parseInt(m.group(4)),
                Integer.parseInt(m.group(5)),
                Integer.parseInt(m.group(6)),
                nanos);

        var offset = ZoneOffset.UTC;
        if (m.group(9) != null) {
            int hours = Integer.parseInt(m.group(10));
            int minutes = m.group(11) != null ? Integer.parseInt(m.group(11)) : 0;
            offset = "-".equals(m.group(9))
                    ? ZoneOffset.ofHoursMinutes(-hours, -minutes)
                    : ZoneOffset.ofHoursMinutes(hours, minutes);
        }
        return local.toInstant(offset);
    }
}
