package works.hydrate.metadata;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps each {@link RawType} a field can receive to the {@link ValueConverter} for it.
 * <p>
 * A table must cover every raw type that can legitimately arrive for its field:
 * an uncovered type is an error, not a passthrough.
 */
public final class ConverterTable {
	private final Map<RawType, ValueConverter> converters;

	private ConverterTable(Map<RawType, ValueConverter> converters) {
		this.converters = converters;
	}

	public static ConverterTable of(RawType rawType, ValueConverter converter) {
		return builder().on(rawType, converter).build();
	}

	public static ConverterTable of(Map<RawType, ValueConverter> converters) {
		Builder builder = builder();
		converters.forEach(builder::on);
		return builder.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<ValueConverter> lookup(RawType rawType) {
		return Optional.ofNullable(converters.get(rawType));
	}

	public Set<RawType> coveredTypes() {
		return Collections.unmodifiableSet(converters.keySet());
	}

	@Override
	public String toString() {
		return "ConverterTable" + converters.keySet();
	}

	public static final class Builder {
		private final EnumMap<RawType, ValueConverter> converters = new EnumMap<>(RawType.class);

		Builder() { }

		/**
		 * @throws IllegalArgumentException if {@code rawType} is {@link RawType#NULL NULL},
		 * which is never converted, or already has a converter
		 */
		public Builder on(RawType rawType, ValueConverter converter) {
			requireNonNull(rawType);
			requireNonNull(converter);
			if (rawType == RawType.NULL) {
				throw new IllegalArgumentException("Null values are never converted; a converter for " + rawType + " would never run");
			}
			if (converters.putIfAbsent(rawType, converter) != null) {
				throw new IllegalArgumentException("Duplicate converter for " + rawType);
			}
			return this;
		}

		public ConverterTable build() {
			return new ConverterTable(new EnumMap<>(converters));
		}
	}
}
