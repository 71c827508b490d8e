package works.hydrate.metadata;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The declared reconstruction rule for one field of one model class.
 *
 * @param target what to reconstruct the raw value into
 * @param isArray the raw value must be a sequence, each element of which conforms to {@code target}
 * @param skip the raw value is assigned verbatim, bypassing all conversion and checking
 * @param converters if present, converts raw values by {@link RawType}
 */
public record FieldMetadata(
	TargetType target,
	boolean isArray,
	boolean skip,
	Optional<ConverterTable> converters
) {
	public static final FieldMetadata NONE = new FieldMetadata(TargetType.ABSENT, false, false, Optional.empty());

	public FieldMetadata {
		requireNonNull(target);
		requireNonNull(converters);
	}

	public static FieldMetadata dataType(Class<?> target) {
		return NONE.withDataType(TargetType.of(target), false);
	}

	public static FieldMetadata dataType(Class<?> target, boolean isArray) {
		return NONE.withDataType(TargetType.of(target), isArray);
	}

	public static FieldMetadata skipped() {
		return NONE.withSkip();
	}

	public static FieldMetadata converting(ConverterTable converters) {
		return NONE.withConverters(converters);
	}

	public FieldMetadata withDataType(TargetType target, boolean isArray) {
		return new FieldMetadata(target, isArray, skip, converters);
	}

	public FieldMetadata withSkip() {
		return new FieldMetadata(target, isArray, true, converters);
	}

	public FieldMetadata withConverters(ConverterTable converters) {
		return new FieldMetadata(target, isArray, skip, Optional.of(converters));
	}

	/**
	 * @return true if this metadata both skips and converts, which is never valid
	 */
	public boolean hasSkipConverterConflict() {
		return skip && converters.isPresent();
	}
}
