package works.hydrate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * The built-in rule for turning strings and numbers into dates.
 */
final class DateCasts {
	private final List<Function<String, Instant>> parsers;

	DateCasts(ZoneId zone) {
		this.parsers = List.of(
			Instant::parse,
			s -> ZonedDateTime.parse(s).toInstant(),
			s -> LocalDateTime.parse(s).atZone(zone).toInstant(),
			s -> LocalDate.parse(s).atStartOfDay(zone).toInstant()
		);
	}

	/**
	 * Accepts, in order of preference: an ISO-8601 instant, an offset or zoned date-time,
	 * a local date-time, or a local date.
	 *
	 * @throws DateTimeParseException if none of the formats match
	 */
	Instant parse(String text) {
		DateTimeParseException failure = null;
		for (var parser: parsers) {
			try {
				return parser.apply(text);
			} catch (DateTimeParseException e) {
				if (failure == null) {
					failure = e;
				} else {
					failure.addSuppressed(e);
				}
			}
		}
		throw failure;
	}

	/**
	 * Treats {@code millis} as milliseconds since the epoch.
	 * Fractions are truncated toward zero.
	 *
	 * @return empty if {@code millis} is not finite or doesn't fit in a {@code long}
	 */
	Optional<Instant> fromEpochMillis(Number millis) {
		if (millis instanceof Double || millis instanceof Float) {
			double d = millis.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d) || Math.abs(d) >= 0x1p63) {
				return Optional.empty();
			}
			return Optional.of(Instant.ofEpochMilli((long) d));
		}
		BigInteger whole;
		if (millis instanceof BigDecimal bd) {
			whole = bd.setScale(0, RoundingMode.DOWN).toBigInteger();
		} else if (millis instanceof BigInteger bi) {
			whole = bi;
		} else {
			return Optional.of(Instant.ofEpochMilli(millis.longValue()));
		}
		if (whole.bitLength() >= Long.SIZE) {
			return Optional.empty();
		}
		return Optional.of(Instant.ofEpochMilli(whole.longValueExact()));
	}
}
