package works.hydrate;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import works.hydrate.exceptions.InvalidDateCastException;
import works.hydrate.exceptions.MissingRequiredConverterException;
import works.hydrate.metadata.ConverterTable;
import works.hydrate.metadata.RawType;
import works.hydrate.metadata.TargetType;
import works.hydrate.metadata.ValueConverter;

import static java.util.Objects.requireNonNull;

/**
 * Converts a single raw field value using the field's converter table,
 * or the built-in date rule if the field is a date and has no table.
 * <p>
 * Fields targeting model classes are not converted here unless they have a converter table;
 * the {@link Deserializer} reconstructs them instead.
 */
public final class ConverterResolver {
	private final DateCasts dateCasts;

	public ConverterResolver(ZoneId dateZone) {
		this.dateCasts = new DateCasts(requireNonNull(dateZone));
	}

	/**
	 * @param owner the model class declaring the field, for error messages
	 * @param fieldName the field, for error messages
	 * @return {@code raw} converted as declared; null if {@code raw} is null
	 * @throws MissingRequiredConverterException if {@code converters} has no entry for the type of {@code raw}
	 * @throws InvalidDateCastException if the built-in date rule can't handle {@code raw}
	 */
	public Object resolve(Class<?> owner, String fieldName, TargetType target, Optional<ConverterTable> converters, Object raw) {
		return resolve(owner, fieldName, target, converters, raw, Location.ROOT.field(fieldName));
	}

	Object resolve(Class<?> owner, String fieldName, TargetType target, Optional<ConverterTable> converters, Object raw, Location at) {
		if (raw == null) {
			return null;
		}
		RawType rawType = RawType.of(raw);
		if (converters.isPresent()) {
			ValueConverter converter = converters.get().lookup(rawType).orElseThrow(() ->
				new MissingRequiredConverterException(owner, fieldName, target, rawType, at.toString()));
			return converter.convert(raw);
		} else if (target instanceof TargetType.DateType) {
			return castToDate(owner, fieldName, rawType, raw, at);
		} else if (target instanceof TargetType.Absent) {
			return raw;
		} else {
			throw new IllegalStateException("Field " + owner.getSimpleName() + "." + fieldName
				+ " targets model type " + target + " and has no converters; it must be reconstructed, not converted");
		}
	}

	private Instant castToDate(Class<?> owner, String fieldName, RawType rawType, Object raw, Location at) {
		return switch (rawType) {
			case STRING -> {
				try {
					yield dateCasts.parse(raw.toString());
				} catch (DateTimeParseException e) {
					throw new InvalidDateCastException(owner, fieldName, rawType, at.toString(), "unrecognized date format \"" + raw + "\"", e);
				}
			}
			case NUMBER -> dateCasts.fromEpochMillis((Number) raw).orElseThrow(() ->
				new InvalidDateCastException(owner, fieldName, rawType, at.toString(), "not a representable timestamp: " + raw, null));
			default -> throw new InvalidDateCastException(owner, fieldName, rawType, at.toString());
		};
	}
}
