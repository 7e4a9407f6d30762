package io.github.drompincen.mockjira.runtime.query;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A date operand: either an absolute instant or an offset from "now" that is resolved when the
 * query is evaluated.
 */
public record DateLiteral(String raw, Instant absolute, Duration relativeOffset) {

    private static final Pattern RELATIVE = Pattern.compile("([+-]?)(\\d+)([mhdw])");
    private static final DateTimeFormatter SLASHED = DateTimeFormatter.ofPattern("yyyy/MM/dd");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter SLASHED_DATE_TIME = DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm");

    private static final List<Function<String, Instant>> ABSOLUTE_FORMATS = List.of(
            t -> LocalDate.parse(t).atStartOfDay().toInstant(ZoneOffset.UTC),
            t -> LocalDate.parse(t, SLASHED).atStartOfDay().toInstant(ZoneOffset.UTC),
            t -> LocalDateTime.parse(t, DATE_TIME).toInstant(ZoneOffset.UTC),
            t -> LocalDateTime.parse(t, SLASHED_DATE_TIME).toInstant(ZoneOffset.UTC),
            t -> OffsetDateTime.parse(t).toInstant(),
            Instant::parse);

    public static DateLiteral parse(String raw) {
        String text = raw.trim();
        if (text.equalsIgnoreCase("now()") || text.equalsIgnoreCase("now")) {
            return new DateLiteral(raw, null, Duration.ZERO);
        }
        Matcher m = RELATIVE.matcher(text);
        if (m.matches()) {
            Duration unit;
            try {
                long amount = Long.parseLong(m.group(2));
                unit = switch (m.group(3)) {
                    case "m" -> Duration.ofMinutes(amount);
                    case "h" -> Duration.ofHours(amount);
                    case "d" -> Duration.ofDays(amount);
                    default -> Duration.ofDays(Math.multiplyExact(amount, 7L));
                };
            } catch (NumberFormatException | ArithmeticException e) {
                throw new QuerySyntaxException("Relative date offset out of range: '" + text + "'", -1);
            }
            return new DateLiteral(raw, null, "-".equals(m.group(1)) ? unit.negated() : unit);
        }
        return new DateLiteral(raw, parseAbsolute(text), null);
    }

    private static Instant parseAbsolute(String text) {
        DateTimeParseException last = null;
        for (Function<String, Instant> format : ABSOLUTE_FORMATS) {
            try {
                return format.apply(text);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw new QuerySyntaxException("Unsupported date value '" + text + "': " + last.getMessage(), -1);
    }

    public Instant resolve(Clock clock) {
        if (absolute != null) {
            return absolute;
        }
        try {
            return clock.instant().plus(relativeOffset);
        } catch (DateTimeException | ArithmeticException e) {
            // saturate offsets that fall outside the Instant range
            return relativeOffset.isNegative() ? Instant.MIN : Instant.MAX;
        }
    }
}
